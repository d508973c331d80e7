package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.repository.WikiPageRepository;
import io.github.drompincen.aigov.runtime.tools.*;

public class WikiGetPageTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private WikiPageRepository wikiPageRepository;

    @Override public String name() { return "wiki_get_page"; }
    @Override public String description() { return "Read a wiki page by path"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("page_path").put("type", "string").put("description", "Page path, e.g. process/releases.md");
        props.putObject("project_id").put("type", "string");
        schema.putArray("required").add("page_path");
        return schema;
    }

    public void setWikiPageRepository(WikiPageRepository wikiPageRepository) {
        this.wikiPageRepository = wikiPageRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (wikiPageRepository == null) return ToolResult.failure("Wiki not available");
        String path = ToolInputs.text(input, "page_path");
        String projectId = ToolInputs.projectId(ctx, input);
        if (path == null) return ToolResult.failure("'page_path' is required");
        if (projectId == null) return ToolResult.failure("'project_id' is required");

        return wikiPageRepository.findByProjectIdAndPath(projectId, path)
                .map(page -> ToolResult.success(WikiJson.page(page, true)))
                .orElseGet(() -> ToolResult.failure("Wiki page not found: " + path));
    }
}
