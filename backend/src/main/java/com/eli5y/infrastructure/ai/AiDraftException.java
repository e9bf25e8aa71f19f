package com.eli5y.infrastructure.ai;

public class AiDraftException extends RuntimeException {

    public AiDraftException(String message) {
        super(message);
    }

    public AiDraftException(String message, Throwable cause) {
        super(message, cause);
    }
}
