package com.iplicense.search.config;

public class InvalidSearchConfigException extends RuntimeException {
    public InvalidSearchConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
