package com.example.procurement.assistantservice.exception;

/**
 * Embedding provider unavailable or returned unusable vectors.
 */
public class EmbeddingException extends SpendAssistantException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
