package io.github.drompincen.aigov.runtime.conversation;

import io.github.drompincen.aigov.persistence.document.ConversationThreadDocument;
import io.github.drompincen.aigov.persistence.repository.ConversationThreadRepository;
import io.github.drompincen.aigov.protocol.api.ConversationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Marks active conversations stale once nobody has spoken in them for a while, which frees the
 * participant set to start a fresh thread.
 */
@Component
public class ConversationMaintenanceJob {

    private static final Logger log = LoggerFactory.getLogger(ConversationMaintenanceJob.class);

    private final ConversationThreadRepository threadRepository;
    private final Clock clock;
    private final Duration staleAfter;

    public ConversationMaintenanceJob(ConversationThreadRepository threadRepository, Clock clock,
                                      @Value("${aigov.conversations.stale-after:PT24H}") Duration staleAfter) {
        this.threadRepository = threadRepository;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @Scheduled(fixedDelayString = "${aigov.conversations.sweep-interval-ms:600000}")
    public int markStale() {
        Instant cutoff = clock.instant().minus(staleAfter);
        List<ConversationThreadDocument> idle =
                threadRepository.findByStatusAndUpdatedAtBefore(ConversationStatus.ACTIVE, cutoff);
        int marked = 0;
        for (ConversationThreadDocument thread : idle) {
            try {
                thread.setStatus(ConversationStatus.STALE);
                thread.setActiveKey(null);
                threadRepository.save(thread);
                marked++;
            } catch (Exception e) {
                log.error("Failed to mark conversation {} stale", thread.getThreadId(), e);
            }
        }
        if (marked > 0) log.info("Marked {} idle conversations stale", marked);
        return marked;
    }
}
