package com.example.procurement.assistantservice.service;

import com.example.procurement.assistantservice.config.GenerationProperties;
import com.example.procurement.assistantservice.exception.GenerationException;
import com.example.procurement.assistantservice.model.Answer;
import com.example.procurement.assistantservice.model.RetrievalResult;
import com.example.procurement.assistantservice.model.SamplingConfig;
import com.example.procurement.assistantservice.provider.GenerationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the generation provider for an answer and packages it with its sources.
 * <p>
 * Never throws: provider errors, timeouts and empty output all produce an
 * {@link Answer} whose text explains the failure and whose sources and contexts
 * are empty.
 */
@Service
public class AnswerSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String FAILURE_PREFIX = "Sorry, I encountered an error: ";

    private final GenerationProvider generationProvider;
    private final SamplingConfig sampling;
    private final Duration timeout;
    private final Executor executor;

    public AnswerSynthesizer(GenerationProvider generationProvider,
                             GenerationProperties properties,
                             @Qualifier("generationExecutor") Executor executor) {
        this.generationProvider = generationProvider;
        this.sampling = properties.toSamplingConfig();
        this.timeout = properties.getTimeout();
        this.executor = executor;
    }

    public Answer synthesize(String prompt, RetrievalResult retrieval) {
        logger.info("Generating answer using {} context chunks", retrieval.size());
        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(() -> generationProvider.generate(prompt, sampling), executor);
        } catch (RuntimeException e) {
            return degraded("the answer service is busy, please retry", e);
        }

        try {
            String text = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                throw new GenerationException("the model returned an empty response");
            }
            logger.info("Answer generated successfully");
            return new Answer(text, retrieval.metadatas(), retrieval.contexts());
        } catch (TimeoutException e) {
            call.cancel(true);
            return degraded("the model did not respond within " + timeout.toSeconds() + " seconds", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return degraded("the request was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return degraded(describe(cause), cause);
        } catch (RuntimeException e) {
            return degraded(describe(e), e);
        }
    }

    private static Answer degraded(String reason, Throwable cause) {
        logger.error("Error generating answer: {}", reason, cause);
        return Answer.degraded(FAILURE_PREFIX + reason);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
}
