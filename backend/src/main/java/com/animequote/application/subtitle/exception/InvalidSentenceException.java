package com.animequote.application.subtitle.exception;

public class InvalidSentenceException extends RuntimeException {

    public InvalidSentenceException(String message) {
        super(message);
    }
}
