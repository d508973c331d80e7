package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.protocol.api.DecisionDto;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/decisions")
public class DecisionController {

    private final DecisionService decisionService;

    public DecisionController(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @GetMapping
    public List<DecisionDto> list(@RequestParam String projectId,
                                  @RequestParam(defaultValue = "50") int limit) {
        return decisionService.recent(projectId, Math.max(1, limit)).stream()
                .map(DecisionService::toDto)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DecisionDto> get(@PathVariable String id) {
        return decisionService.get(id)
                .map(d -> ResponseEntity.ok(DecisionService.toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }
}
