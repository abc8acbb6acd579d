package com.iplicense.search.service;

public class SearchCancelledException extends RuntimeException {
    public SearchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
