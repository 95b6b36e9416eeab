package com.animequote.application.subtitle.exception;

public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String fileName) {
        super("Unsupported file format: " + fileName + ". Please upload a .srt or .ass file.");
    }
}
