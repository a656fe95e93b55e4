package com.example.procurement.assistantservice.model;

import java.util.List;
import java.util.Map;

public record Answer(String text, List<Map<String, Object>> sources, List<String> contexts) {

    public Answer {
        sources = List.copyOf(sources);
        contexts = List.copyOf(contexts);
    }

    /**
     * An answer that carries only an explanation, no sources or contexts.
     */
    public static Answer degraded(String text) {
        return new Answer(text, List.of(), List.of());
    }
}
