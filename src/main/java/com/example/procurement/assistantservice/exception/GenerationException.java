package com.example.procurement.assistantservice.exception;

/**
 * Generation provider failure (network, quota, server error, empty output).
 * Recovered inside {@code AnswerSynthesizer}; never reaches callers of the pipeline.
 */
public class GenerationException extends SpendAssistantException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
