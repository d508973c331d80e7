package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.WikiDraftDocument;
import io.github.drompincen.aigov.persistence.repository.WikiDraftRepository;
import io.github.drompincen.aigov.protocol.api.WikiDraftStatus;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;

public class WikiReviewDraftsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private WikiDraftRepository wikiDraftRepository;

    @Override public String name() { return "wiki_review_drafts"; }
    @Override public String description() { return "List wiki drafts waiting for review, oldest first"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("project_id").put("type", "string");
        return schema;
    }

    public void setWikiDraftRepository(WikiDraftRepository wikiDraftRepository) {
        this.wikiDraftRepository = wikiDraftRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (wikiDraftRepository == null) return ToolResult.failure("Wiki not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'project_id' is required");

        List<WikiDraftDocument> drafts =
                wikiDraftRepository.findByProjectIdAndStatusOrderByProposedAtAsc(projectId, WikiDraftStatus.PENDING);
        ArrayNode arr = MAPPER.createArrayNode();
        drafts.forEach(d -> arr.add(WikiJson.draft(d)));

        ObjectNode result = MAPPER.createObjectNode();
        result.set("pending_drafts", arr);
        result.put("count", drafts.size());
        return ToolResult.success(result);
    }
}
