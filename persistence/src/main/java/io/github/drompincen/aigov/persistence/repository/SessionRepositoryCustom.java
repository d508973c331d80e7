package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.SessionStatus;

import java.time.Instant;

/**
 * Append-only updates to a session. Each call is a single atomic $push or $set, so concurrent
 * hooks never overwrite each other's entries.
 */
public interface SessionRepositoryCustom {

    void appendToolUse(String sessionId, SessionDocument.ToolUse toolUse);

    void appendDecision(String sessionId, String decisionId);

    void appendEscalation(String sessionId, String escalation);

    void finish(String sessionId, SessionStatus status, Instant endedAt, String reason);
}
