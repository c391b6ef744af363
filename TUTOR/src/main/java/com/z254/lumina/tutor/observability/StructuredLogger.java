package com.z254.lumina.tutor.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for TUTOR.
 * Writes one JSON line per event with the current MDC context attached.
 */
@Component
@Slf4j
public class StructuredLogger {

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_AGENT_TYPE = "agentType";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_SESSION_ID = "sessionId";

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for a query.
     */
    public void setQueryContext(String requestId, String userId, String sessionId) {
        if (requestId != null) MDC.put(MDC_REQUEST_ID, requestId);
        if (userId != null) MDC.put(MDC_USER_ID, userId);
        if (sessionId != null) MDC.put(MDC_SESSION_ID, sessionId);
    }

    /**
     * Clear MDC context.
     */
    public void clearContext() {
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_AGENT_TYPE);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_SESSION_ID);
    }

    public void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "tutor");

        String requestId = MDC.get(MDC_REQUEST_ID);
        if (requestId != null) event.putIfAbsent("requestId", requestId);

        String userId = MDC.get(MDC_USER_ID);
        if (userId != null) event.putIfAbsent("userId", userId);

        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
