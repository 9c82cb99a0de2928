package com.example.loyaltyhook.exception;

import lombok.Getter;

/**
 * 积分后端调用失败。所有出站调用的错误都归一到这个异常。
 */
@Getter
public class LoyaltyServiceException extends RuntimeException {

    private final String endpoint;

    /**
     * HTTP 状态码；网络层错误时为 -1。
     */
    private final int statusCode;

    public LoyaltyServiceException(String endpoint, int statusCode, String message) {
        super(message);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public LoyaltyServiceException(String endpoint, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
