package com.example.procurement.assistantservice.exception;

/**
 * Root of the assistant's failure taxonomy. All subclasses are unchecked.
 */
public class SpendAssistantException extends RuntimeException {

    public SpendAssistantException(String message) {
        super(message);
    }

    public SpendAssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
