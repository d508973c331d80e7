package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.persistence.document.ApprovalDocument;
import io.github.drompincen.aigov.protocol.api.ApprovalResponseRequest;
import io.github.drompincen.aigov.protocol.api.ApprovalStatus;
import io.github.drompincen.aigov.runtime.approval.ApprovalService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

    private final ApprovalService approvalService;

    public ApprovalController(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @GetMapping
    public List<ApprovalDocument> list(@RequestParam String projectId,
                                       @RequestParam(required = false) ApprovalStatus status) {
        return approvalService.list(projectId, status);
    }

    /** Grants or denies a pending request. Already answered or unknown requests give 404. */
    @PostMapping("/{id}")
    public ResponseEntity<?> respond(@PathVariable String id, @RequestBody ApprovalResponseRequest req) {
        if (req.respondedBy() == null || req.respondedBy().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", "respondedBy is required"));
        }
        return approvalService.respond(id, req.granted(), req.respondedBy())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
