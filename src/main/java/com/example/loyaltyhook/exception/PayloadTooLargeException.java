package com.example.loyaltyhook.exception;

import lombok.Getter;

/**
 * 请求体读取过程中超过大小上限时抛出。
 */
@Getter
public class PayloadTooLargeException extends RuntimeException {

    private final long bytesRead;

    public PayloadTooLargeException(long bytesRead) {
        super("Request size exceeded limit");
        this.bytesRead = bytesRead;
    }
}
