package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.WikiDraftDocument;
import io.github.drompincen.aigov.persistence.document.WikiPageDocument;

import java.time.Instant;

final class WikiJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int SUMMARY_LENGTH = 200;

    private WikiJson() {}

    static ObjectNode page(WikiPageDocument page, boolean withContent) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("path", page.getPath());
        n.put("title", page.getTitle());
        n.put("summary", page.getSummary());
        if (withContent) n.put("content", page.getContent());
        n.put("last_modified", iso(page.getLastModified()));
        n.put("modified_by", page.getModifiedBy());
        return n;
    }

    static ObjectNode draft(WikiDraftDocument d) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("draft_id", d.getDraftId());
        n.put("type", d.getType() != null ? d.getType().name().toLowerCase() : null);
        n.put("page_path", d.getPagePath());
        n.put("proposed_content", d.getProposedContent());
        n.put("original_content", d.getOriginalContent());
        n.put("proposed_by", d.getProposedBy());
        n.put("proposed_at", iso(d.getProposedAt()));
        n.put("edit_summary", d.getEditSummary());
        n.put("status", d.getStatus() != null ? d.getStatus().name().toLowerCase() : null);
        return n;
    }

    /** First markdown heading, else the last path segment. */
    static String titleOf(String path, String content) {
        if (content != null) {
            for (String line : content.split("\n")) {
                String trimmed = line.trim();
                if (trimmed.startsWith("#")) {
                    String heading = trimmed.replaceFirst("^#+", "").trim();
                    if (!heading.isEmpty()) return heading;
                }
            }
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        return segment.endsWith(".md") ? segment.substring(0, segment.length() - 3) : segment;
    }

    /** First non-heading paragraph, cut at a fixed length. */
    static String summaryOf(String content) {
        if (content == null) return null;
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            return trimmed.length() > SUMMARY_LENGTH ? trimmed.substring(0, SUMMARY_LENGTH) + "..." : trimmed;
        }
        return null;
    }

    static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
