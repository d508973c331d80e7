package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.WikiDraftDocument;
import io.github.drompincen.aigov.persistence.document.WikiPageDocument;
import io.github.drompincen.aigov.persistence.repository.WikiDraftRepository;
import io.github.drompincen.aigov.persistence.repository.WikiPageRepository;
import io.github.drompincen.aigov.protocol.api.WikiDraftStatus;
import io.github.drompincen.aigov.runtime.tools.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Publishes a pending draft. An edit replaces the page content; a new page is created, or overwrites
 * a page someone published at the same path after the draft was proposed.
 */
public class WikiApproveDraftTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private WikiPageRepository wikiPageRepository;
    private WikiDraftRepository wikiDraftRepository;
    private Clock clock = Clock.systemUTC();

    @Override public String name() { return "wiki_approve_draft"; }
    @Override public String description() { return "Approve a pending wiki draft and publish it"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("draft_id").put("type", "string");
        props.putObject("reviewed_by").put("type", "string");
        props.putObject("feedback").put("type", "string").put("description", "Optional reviewer note");
        schema.putArray("required").add("draft_id");
        return schema;
    }

    public void setWikiPageRepository(WikiPageRepository wikiPageRepository) {
        this.wikiPageRepository = wikiPageRepository;
    }

    public void setWikiDraftRepository(WikiDraftRepository wikiDraftRepository) {
        this.wikiDraftRepository = wikiDraftRepository;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (wikiPageRepository == null || wikiDraftRepository == null) return ToolResult.failure("Wiki not available");
        String draftId = ToolInputs.text(input, "draft_id");
        String reviewedBy = ToolInputs.actor(ctx, input, "reviewed_by");
        if (draftId == null) return ToolResult.failure("'draft_id' is required");
        if (reviewedBy == null) return ToolResult.failure("'reviewed_by' is required");

        Optional<WikiDraftDocument> found = wikiDraftRepository.findById(draftId);
        if (found.isEmpty()) return ToolResult.failure("Draft not found: " + draftId);
        WikiDraftDocument draft = found.get();
        if (draft.getStatus() != WikiDraftStatus.PENDING) {
            return ToolResult.failure("Draft " + draftId + " is already " + draft.getStatus().name().toLowerCase());
        }

        Instant now = clock.instant();
        WikiPageDocument page = wikiPageRepository.findByProjectIdAndPath(draft.getProjectId(), draft.getPagePath())
                .orElseGet(WikiPageDocument::new);
        page.setProjectId(draft.getProjectId());
        page.setPath(draft.getPagePath());
        page.setContent(draft.getProposedContent());
        page.setTitle(WikiJson.titleOf(draft.getPagePath(), draft.getProposedContent()));
        page.setSummary(WikiJson.summaryOf(draft.getProposedContent()));
        page.setLastModified(now);
        page.setModifiedBy(draft.getProposedBy());
        wikiPageRepository.save(page);

        draft.setStatus(WikiDraftStatus.APPROVED);
        draft.setReviewedBy(reviewedBy);
        draft.setReviewedAt(now);
        draft.setFeedback(ToolInputs.text(input, "feedback"));
        wikiDraftRepository.save(draft);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("page_path", draft.getPagePath());
        result.put("message", "Draft approved and published to " + draft.getPagePath());
        return ToolResult.success(result);
    }
}
