package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.WikiDraftDocument;
import io.github.drompincen.aigov.persistence.repository.WikiDraftRepository;
import io.github.drompincen.aigov.protocol.api.WikiDraftStatus;
import io.github.drompincen.aigov.runtime.tools.*;

import java.time.Clock;
import java.util.Optional;

public class WikiRejectDraftTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private WikiDraftRepository wikiDraftRepository;
    private Clock clock = Clock.systemUTC();

    @Override public String name() { return "wiki_reject_draft"; }
    @Override public String description() { return "Reject a pending wiki draft with feedback for the proposer"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("draft_id").put("type", "string");
        props.putObject("reviewed_by").put("type", "string");
        props.putObject("feedback").put("type", "string").put("description", "Why the draft was rejected");
        schema.putArray("required").add("draft_id").add("feedback");
        return schema;
    }

    public void setWikiDraftRepository(WikiDraftRepository wikiDraftRepository) {
        this.wikiDraftRepository = wikiDraftRepository;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (wikiDraftRepository == null) return ToolResult.failure("Wiki not available");
        String draftId = ToolInputs.text(input, "draft_id");
        String reviewedBy = ToolInputs.actor(ctx, input, "reviewed_by");
        String feedback = ToolInputs.text(input, "feedback");
        if (draftId == null) return ToolResult.failure("'draft_id' is required");
        if (reviewedBy == null) return ToolResult.failure("'reviewed_by' is required");
        if (feedback == null) return ToolResult.failure("'feedback' is required");

        Optional<WikiDraftDocument> found = wikiDraftRepository.findById(draftId);
        if (found.isEmpty()) return ToolResult.failure("Draft not found: " + draftId);
        WikiDraftDocument draft = found.get();
        if (draft.getStatus() != WikiDraftStatus.PENDING) {
            return ToolResult.failure("Draft " + draftId + " is already " + draft.getStatus().name().toLowerCase());
        }

        draft.setStatus(WikiDraftStatus.REJECTED);
        draft.setReviewedBy(reviewedBy);
        draft.setReviewedAt(clock.instant());
        draft.setFeedback(feedback);
        wikiDraftRepository.save(draft);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("message", "Draft rejected");
        return ToolResult.success(result);
    }
}
