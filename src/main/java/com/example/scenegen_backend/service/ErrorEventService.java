package com.example.scenegen_backend.service;

import com.example.scenegen_backend.model.ErrorEvent;
import com.example.scenegen_backend.repository.ErrorEventRepository;
import com.example.scenegen_backend.util.LogRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Service
public class ErrorEventService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorEventService.class);
    private static final int MAX_MESSAGE = 2000;
    private static final int MAX_CONTEXT = 4000;

    private final ErrorEventRepository repo;
    private final ObjectMapper om = new ObjectMapper();

    public ErrorEventService(ErrorEventRepository repo) {
        this.repo = repo;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(String route, String method, int status, String code, String message,
                       String correlationId, String userId, Map<String, Object> safeContext) {
        try {
            ErrorEvent event = new ErrorEvent(LogRedactor.redact(route), method, status, code,
                    LogRedactor.truncate(message, MAX_MESSAGE), correlationId == null ? "-" : correlationId);
            event.setUserId(userId);
            if (safeContext != null && !safeContext.isEmpty()) {
                event.setSafeContext(LogRedactor.truncate(om.writeValueAsString(safeContext), MAX_CONTEXT));
            }
            repo.save(event);
        } catch (JsonProcessingException | RuntimeException e) {
            LOGGER.warn("ErrorEvent record FAIL correlationId={} code={} error={}", correlationId, code, e.toString());
        }
    }
}
