package com.logpanel.logs.service;

public class InvalidLogQueryException extends RuntimeException {
    public InvalidLogQueryException(String message) {
        super(message);
    }
}
