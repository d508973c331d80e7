package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionRepositoryImplTest {

    @Mock private MongoTemplate mongoTemplate;

    private SessionRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new SessionRepositoryImpl(mongoTemplate);
    }

    @Test
    void appendDecisionPushesOntoList() {
        repository.appendDecision("s1", "d1");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(SessionDocument.class));
        assertThat(query.getValue().getQueryObject().get("_id")).isEqualTo("s1");
        Document push = (Document) update.getValue().getUpdateObject().get("$push");
        assertThat(push.get("decisionsLogged")).isEqualTo("d1");
    }

    @Test
    void appendToolUsePushesEntry() {
        SessionDocument.ToolUse use = new SessionDocument.ToolUse();
        use.setToolName("log_decision");

        repository.appendToolUse("s1", use);

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(SessionDocument.class));
        Document push = (Document) update.getValue().getUpdateObject().get("$push");
        assertThat(push.get("toolUses")).isSameAs(use);
    }

    @Test
    void finishSetsStatusEndAndReason() {
        Instant end = Instant.parse("2026-01-01T00:00:00Z");

        repository.finish("s1", SessionStatus.FAILED, end, "boom");

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(SessionDocument.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("status")).isEqualTo(SessionStatus.FAILED);
        assertThat(set.get("endedAt")).isEqualTo(end);
        assertThat(set.get("failureReason")).isEqualTo("boom");
    }

    @Test
    void finishWithoutReasonLeavesReasonUntouched() {
        repository.finish("s1", SessionStatus.COMPLETED, Instant.now(), null);

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(SessionDocument.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set).doesNotContainKey("failureReason");
    }
}
