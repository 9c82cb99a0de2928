package com.example.loyaltyhook.exception;

import com.example.loyaltyhook.model.ProcessingResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理逻辑
 * 所有逃出网关的异常都以统一的 { success:false, message, error } 格式返回，不泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownTopicException.class)
    public ResponseEntity<ProcessingResult> handleUnknownTopic(UnknownTopicException e, HttpServletRequest request) {
        log.warn("[UnknownTopic] Path: {}, Topic: {}", request.getRequestURI(), e.getTopic());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ProcessingResult.failure("Unknown webhook topic", e.getTopic()));
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<ProcessingResult> handlePayloadTooLarge(PayloadTooLargeException e,
            HttpServletRequest request) {
        log.warn("[DoS Protection] Stream exceeded limit for {}: read {} bytes", request.getRequestURI(),
                e.getBytesRead());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ProcessingResult.failure("Payload too large"));
    }

    /**
     * 处理资源未找到异常 (404)，避免在日志中打印堆栈
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProcessingResult> handleNotFound(NoResourceFoundException e, HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ProcessingResult.failure("Not Found", request.getRequestURI()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProcessingResult> handleMethodNotSupported(HttpRequestMethodNotSupportedException e,
            HttpServletRequest request) {
        log.debug("[MethodNotSupported] Path: {}, Method: {}", request.getRequestURI(), e.getMethod());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ProcessingResult.failure("Method not allowed", e.getMethod()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProcessingResult> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ProcessingResult.failure("Internal webhook processing error",
                        "An unexpected error occurred"));
    }
}
