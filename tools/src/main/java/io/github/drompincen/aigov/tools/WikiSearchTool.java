package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.WikiPageDocument;
import io.github.drompincen.aigov.persistence.repository.WikiPageRepository;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;
import java.util.regex.Pattern;

public class WikiSearchTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private WikiPageRepository wikiPageRepository;

    @Override public String name() { return "wiki_search"; }
    @Override public String description() { return "Search the project wiki by page title or content"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("query").put("type", "string").put("description", "Text to look for");
        props.putObject("project_id").put("type", "string");
        schema.putArray("required").add("query");
        return schema;
    }

    public void setWikiPageRepository(WikiPageRepository wikiPageRepository) {
        this.wikiPageRepository = wikiPageRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (wikiPageRepository == null) return ToolResult.failure("Wiki not available");
        String query = ToolInputs.text(input, "query");
        String projectId = ToolInputs.projectId(ctx, input);
        if (query == null) return ToolResult.failure("'query' is required");
        if (projectId == null) return ToolResult.failure("'project_id' is required");

        List<WikiPageDocument> pages = wikiPageRepository.search(projectId, Pattern.quote(query));
        ArrayNode results = MAPPER.createArrayNode();
        pages.forEach(p -> results.add(WikiJson.page(p, false)));

        ObjectNode result = MAPPER.createObjectNode();
        result.put("query", query);
        result.set("results", results);
        result.put("total", pages.size());
        return ToolResult.success(result);
    }
}
