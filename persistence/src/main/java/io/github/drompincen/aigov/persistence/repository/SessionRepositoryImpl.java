package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class SessionRepositoryImpl implements SessionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public SessionRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void appendToolUse(String sessionId, SessionDocument.ToolUse toolUse) {
        mongoTemplate.updateFirst(byId(sessionId), new Update().push("toolUses", toolUse), SessionDocument.class);
    }

    @Override
    public void appendDecision(String sessionId, String decisionId) {
        mongoTemplate.updateFirst(byId(sessionId), new Update().push("decisionsLogged", decisionId), SessionDocument.class);
    }

    @Override
    public void appendEscalation(String sessionId, String escalation) {
        mongoTemplate.updateFirst(byId(sessionId), new Update().push("escalations", escalation), SessionDocument.class);
    }

    @Override
    public void finish(String sessionId, SessionStatus status, Instant endedAt, String reason) {
        Update update = new Update().set("status", status).set("endedAt", endedAt);
        if (reason != null) update.set("failureReason", reason);
        mongoTemplate.updateFirst(byId(sessionId), update, SessionDocument.class);
    }

    private static Query byId(String sessionId) {
        return Query.query(Criteria.where("_id").is(sessionId));
    }
}
