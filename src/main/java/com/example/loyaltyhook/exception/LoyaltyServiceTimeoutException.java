package com.example.loyaltyhook.exception;

/**
 * 后端在 request-timeout 内未响应。不做进程内重试，以免超出平台的投递时间窗口。
 */
public class LoyaltyServiceTimeoutException extends LoyaltyServiceException {

    public LoyaltyServiceTimeoutException(String endpoint, String message, Throwable cause) {
        super(endpoint, -1, message, cause);
    }
}
