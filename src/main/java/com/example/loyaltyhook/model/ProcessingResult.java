package com.example.loyaltyhook.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 所有主题处理器的统一输出，同时也是 POST 响应体。
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingResult {

    boolean success;

    String message;

    Map<String, Object> data;

    String error;

    public static ProcessingResult success(String message) {
        return ProcessingResult.builder().success(true).message(message).build();
    }

    public static ProcessingResult success(String message, Map<String, Object> data) {
        return ProcessingResult.builder().success(true).message(message).data(data).build();
    }

    public static ProcessingResult failure(String message) {
        return ProcessingResult.builder().success(false).message(message).build();
    }

    public static ProcessingResult failure(String message, String error) {
        return ProcessingResult.builder().success(false).message(message).error(error).build();
    }
}
