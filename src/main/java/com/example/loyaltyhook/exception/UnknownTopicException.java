package com.example.loyaltyhook.exception;

import lombok.Getter;

@Getter
public class UnknownTopicException extends RuntimeException {

    private final String topic;

    public UnknownTopicException(String topic) {
        super("Unknown webhook topic: " + topic);
        this.topic = topic;
    }
}
