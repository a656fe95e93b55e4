package com.example.procurement.assistantservice.exception;

/**
 * Missing or malformed source data. Fatal at build time.
 */
public class DataException extends SpendAssistantException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
