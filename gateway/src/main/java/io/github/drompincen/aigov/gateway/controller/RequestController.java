package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.protocol.api.*;
import io.github.drompincen.aigov.runtime.governance.GovernanceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/requests")
public class RequestController {

    private final GovernanceService governanceService;

    public RequestController(GovernanceService governanceService) {
        this.governanceService = governanceService;
    }

    /**
     * Classifies, routes and handles one request synchronously. Requests without a channel come in
     * through the public API.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody SubmitRequest req) {
        if (req.projectId() == null || req.projectId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", "project_id is required"));
        }
        if (req.intent() == null || req.intent().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", "intent is required"));
        }
        Channel channel = req.channel() != null ? req.channel() : Channel.PUBLIC_API;
        GovernanceRequest request = GovernanceRequest.create(RequestSource.of(channel, req.identity()),
                req.projectId(), req.intent(), req.payload());
        GovernanceResponse response = governanceService.handle(request);
        return ResponseEntity.ok(response);
    }
}
