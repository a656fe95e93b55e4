package com.example.procurement.assistantservice.exception;

/**
 * Vector store unreachable, corrupt, or not built yet.
 */
public class IndexException extends SpendAssistantException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
