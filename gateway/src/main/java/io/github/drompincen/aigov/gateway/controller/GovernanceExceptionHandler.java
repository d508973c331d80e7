package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.runtime.error.GovernanceException;
import io.github.drompincen.aigov.runtime.error.ProjectConfigurationException;
import io.github.drompincen.aigov.runtime.error.SessionBlockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GovernanceExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceExceptionHandler.class);

    @ExceptionHandler(ProjectConfigurationException.class)
    public ResponseEntity<Map<String, String>> projectConfiguration(ProjectConfigurationException e) {
        log.warn("Project configuration error: {}", e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "project_configuration", e);
    }

    @ExceptionHandler(SessionBlockedException.class)
    public ResponseEntity<Map<String, String>> sessionBlocked(SessionBlockedException e) {
        log.warn("Session blocked: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "session_blocked", e);
    }

    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<Map<String, String>> governance(GovernanceException e) {
        log.error("Governance failure: {}", e.getMessage(), e);
        return body(HttpStatus.BAD_GATEWAY, "governance_failure", e);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
