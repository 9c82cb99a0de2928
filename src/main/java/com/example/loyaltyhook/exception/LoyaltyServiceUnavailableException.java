package com.example.loyaltyhook.exception;

/**
 * 可重试的后端故障：5xx、超时或网络错误。
 */
public class LoyaltyServiceUnavailableException extends LoyaltyServiceException {

    public LoyaltyServiceUnavailableException(String endpoint, int statusCode, String message) {
        super(endpoint, statusCode, message);
    }

    public LoyaltyServiceUnavailableException(String endpoint, String message, Throwable cause) {
        super(endpoint, -1, message, cause);
    }
}
