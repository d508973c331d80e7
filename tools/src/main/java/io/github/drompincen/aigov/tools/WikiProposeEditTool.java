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
import java.util.Optional;
import java.util.UUID;

/**
 * Proposes a change to an existing page. The page content at proposal time is kept on the draft
 * so a reviewer sees exactly what the edit replaces.
 */
public class WikiProposeEditTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private WikiPageRepository wikiPageRepository;
    private WikiDraftRepository wikiDraftRepository;
    private Clock clock = Clock.systemUTC();

    @Override public String name() { return "wiki_propose_edit"; }
    @Override public String description() { return "Propose an edit to an existing wiki page; a maintainer reviews the draft"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("page_path").put("type", "string");
        props.putObject("content").put("type", "string").put("description", "Full proposed page content");
        props.putObject("edit_summary").put("type", "string").put("description", "What changed and why");
        props.putObject("proposed_by").put("type", "string");
        props.putObject("project_id").put("type", "string");
        schema.putArray("required").add("page_path").add("content").add("edit_summary");
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
        String path = ToolInputs.text(input, "page_path");
        String content = ToolInputs.text(input, "content");
        String summary = ToolInputs.text(input, "edit_summary");
        String proposedBy = ToolInputs.actor(ctx, input, "proposed_by");
        String projectId = ToolInputs.projectId(ctx, input);
        if (path == null) return ToolResult.failure("'page_path' is required");
        if (content == null) return ToolResult.failure("'content' is required");
        if (summary == null) return ToolResult.failure("'edit_summary' is required");
        if (proposedBy == null) return ToolResult.failure("'proposed_by' is required");
        if (projectId == null) return ToolResult.failure("'project_id' is required");

        Optional<WikiPageDocument> page = wikiPageRepository.findByProjectIdAndPath(projectId, path);
        if (page.isEmpty()) {
            return ToolResult.failure("Wiki page not found: " + path + ". Use wiki_propose_page for new pages.");
        }

        WikiDraftDocument draft = new WikiDraftDocument();
        draft.setDraftId(UUID.randomUUID().toString());
        draft.setProjectId(projectId);
        draft.setType(WikiDraftDocument.DraftType.EDIT_PAGE);
        draft.setPagePath(path);
        draft.setProposedContent(content);
        draft.setOriginalContent(page.get().getContent());
        draft.setProposedBy(proposedBy);
        draft.setProposedAt(clock.instant());
        draft.setEditSummary(summary);
        draft.setStatus(WikiDraftStatus.PENDING);
        wikiDraftRepository.save(draft);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("draft_id", draft.getDraftId());
        result.put("message", "Edit to " + path + " proposed for review");
        return ToolResult.success(result);
    }
}
