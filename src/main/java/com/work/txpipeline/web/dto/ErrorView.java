package com.work.txpipeline.web.dto;

public class ErrorView {

    private final String error;
    private final String message;

    public ErrorView(String error, String message) {
        this.error = error;
        this.message = message;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }
}
