package com.policyai.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyai.domain.suggestion.model.TransparencyEvent;
import com.policyai.domain.suggestion.service.TransparencyLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Writes each decision event as one JSON log line, off the caller's thread.
 * Best-effort: dispatch and serialization failures are logged and dropped.
 */
@Slf4j
@Component
public class LoggingTransparencyLogger implements TransparencyLogger {

    private final ObjectMapper objectMapper;
    private final Executor executor;

    public LoggingTransparencyLogger(ObjectMapper objectMapper,
                                     @Qualifier("retrievalExecutor") Executor executor) {
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public void logDecision(TransparencyEvent event) {
        try {
            executor.execute(() -> write(event));
        } catch (RuntimeException e) {
            log.warn("[Transparency] Could not dispatch decision event for {}: {}",
                    event.suggestionId(), e.getMessage());
        }
    }

    private void write(TransparencyEvent event) {
        try {
            log.info("[Transparency] {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("[Transparency] Could not serialize decision event for {}: {}",
                    event.suggestionId(), e.getMessage());
        }
    }
}
