package io.github.drompincen.aigov.runtime.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.ConversationMessageDocument;
import io.github.drompincen.aigov.persistence.document.ConversationThreadDocument;
import io.github.drompincen.aigov.persistence.repository.ConversationMessageRepository;
import io.github.drompincen.aigov.persistence.repository.ConversationThreadRepository;
import io.github.drompincen.aigov.protocol.api.ConversationStatus;
import io.github.drompincen.aigov.protocol.api.NotificationType;
import io.github.drompincen.aigov.protocol.api.Participant;
import io.github.drompincen.aigov.protocol.api.ParticipantType;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.runtime.audit.AuditEventType;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.github.IssueRef;
import io.github.drompincen.aigov.runtime.github.IssueTracker;
import io.github.drompincen.aigov.runtime.session.SessionService;
import io.github.drompincen.aigov.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Agent-to-agent conversations. {@code converse} appends the caller's message to the thread shared
 * with the target role and synchronously runs the target one level deeper; {@code send} files a
 * notification and returns at once. All failures are returned in-band as
 * {@code {"error": true, "message": ...}}.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int MAX_CONVERSATION_DEPTH = 5;
    static final int DEFAULT_LIST_LIMIT = 10;

    private final ConversationThreadRepository threadRepository;
    private final ConversationMessageRepository messageRepository;
    private final AuditService auditService;
    private final SessionService sessionService;
    private final IssueTracker issueTracker;
    private final Clock clock;

    public ConversationService(ConversationThreadRepository threadRepository,
                               ConversationMessageRepository messageRepository,
                               AuditService auditService,
                               SessionService sessionService,
                               IssueTracker issueTracker,
                               Clock clock) {
        this.threadRepository = threadRepository;
        this.messageRepository = messageRepository;
        this.auditService = auditService;
        this.sessionService = sessionService;
        this.issueTracker = issueTracker;
        this.clock = clock;
    }

    public ToolResult execute(String toolName, JsonNode input, ConversationScope scope, RoleInvoker invoker) {
        JsonNode args = input != null ? input : MAPPER.createObjectNode();
        try {
            return switch (toolName) {
                case ConversationTools.CONVERSE -> converse(args, scope, invoker);
                case ConversationTools.END_CONVERSATION -> endConversation(args, scope);
                case ConversationTools.LIST_CONVERSATIONS -> listConversations(args, scope);
                case ConversationTools.GET_CONVERSATION -> getConversation(args, scope);
                case ConversationTools.SEND -> send(args, scope);
                default -> error("Unknown conversation tool: " + toolName);
            };
        } catch (Exception e) {
            log.warn("Conversation tool {} failed in session {}: {}", toolName, scope.sessionId(), e.getMessage());
            return error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    ToolResult converse(JsonNode args, ConversationScope scope, RoleInvoker invoker) {
        if (scope.depth() >= MAX_CONVERSATION_DEPTH) {
            auditService.record(AuditEventType.CONVERSATION_DEPTH_EXCEEDED, scopeOf(scope),
                    "Conversation depth limit reached", Map.<String, Object>of("depth", scope.depth(),
                            "maxDepth", MAX_CONVERSATION_DEPTH));
            log.warn("Session {}: converse rejected at depth {}", scope.sessionId(), scope.depth());
            return error("Maximum conversation depth (" + MAX_CONVERSATION_DEPTH + ") reached; "
                    + "answer with what you have instead of starting another conversation");
        }
        String message = text(args, "message");
        if (message == null) return error("'message' is required");

        String currentRole = scope.role().name();
        String conversationId = text(args, "conversation_id");
        ConversationThreadDocument thread;
        String targetName;
        if (conversationId != null) {
            Optional<ConversationThreadDocument> existing = findInProject(conversationId, scope);
            if (existing.isEmpty()) return error("Conversation not found: " + conversationId);
            thread = existing.get();
            if (!isParticipant(thread, currentRole)) return notParticipant(currentRole, conversationId);
            if (thread.getStatus() != ConversationStatus.ACTIVE) {
                return error("Conversation is " + thread.getStatus().name().toLowerCase() + ", cannot continue");
            }
            Optional<Participant> other = thread.getParticipants().stream()
                    .filter(p -> !(p.type() == ParticipantType.ROLE && p.id().equalsIgnoreCase(currentRole)))
                    .findFirst();
            if (other.isEmpty() || other.get().type() != ParticipantType.ROLE) {
                return error("Cannot determine target role for conversation");
            }
            targetName = other.get().id();
        } else {
            targetName = text(args, "with_role");
            if (targetName == null) return error("with_role is required when starting a new conversation");
            thread = null;
        }

        Optional<RoleDefinition> target = scope.project().findRole(targetName);
        if (target.isEmpty()) return error("Unknown role: " + targetName);
        RoleDefinition targetRole = target.get();
        if (targetRole.name().equalsIgnoreCase(currentRole)) return error("Cannot converse with yourself");
        if (!targetRole.accepts(scope.request().trust())) {
            return error("Role " + targetRole.name() + " does not accept trust level "
                    + scope.request().trust().wireName());
        }

        if (thread == null) {
            thread = findOrCreate(scope.project().id(),
                    List.of(Participant.role(currentRole), Participant.role(targetRole.name())),
                    text(args, "topic"));
        }

        appendMessage(thread, Participant.role(currentRole), message);
        List<ConversationMessageDocument> history = messageRepository.findByConversationIdOrderBySeqAsc(thread.getThreadId());
        String context = formatContext(thread, history, currentRole);

        String response;
        try {
            response = invoker.invoke(targetRole, context, thread.getThreadId());
        } catch (Exception e) {
            log.warn("Session {}: role {} failed to answer conversation {}: {}", scope.sessionId(),
                    targetRole.name(), thread.getThreadId(), e.getMessage());
            return error("Failed to get response from " + targetRole.name() + ": " + e.getMessage());
        }
        appendMessage(thread, Participant.role(targetRole.name()), response);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("conversation_id", thread.getThreadId());
        result.put("with_role", targetRole.name());
        result.put("response", response);
        result.put("message_count", history.size() + 1);
        return ToolResult.success(result);
    }

    /**
     * Returns the active thread of exactly these participants, creating it if none exists. Two
     * concurrent creators collide on the unique active key; the loser reads the winner's thread.
     */
    public ConversationThreadDocument findOrCreate(String projectId, List<Participant> participants, String topic) {
        String participantKey = Participant.setKey(participants);
        Optional<ConversationThreadDocument> existing = threadRepository
                .findFirstByProjectIdAndParticipantKeyAndStatus(projectId, participantKey, ConversationStatus.ACTIVE);
        if (existing.isPresent()) return existing.get();

        Instant now = clock.instant();
        ConversationThreadDocument doc = new ConversationThreadDocument();
        doc.setThreadId(UUID.randomUUID().toString());
        doc.setProjectId(projectId);
        doc.setParticipants(new ArrayList<>(participants));
        doc.setMemberKeys(participants.stream().map(Participant::key).collect(Collectors.toList()));
        doc.setParticipantKey(participantKey);
        doc.setActiveKey(activeKey(projectId, participantKey));
        doc.setStatus(ConversationStatus.ACTIVE);
        doc.setTopic(topic);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        try {
            ConversationThreadDocument created = threadRepository.insert(doc);
            log.info("Started conversation {} between {} in project {}", created.getThreadId(), participantKey, projectId);
            return created;
        } catch (DuplicateKeyException e) {
            log.info("Concurrent conversation start for {} in project {}, joining the existing thread",
                    participantKey, projectId);
            return threadRepository
                    .findFirstByProjectIdAndParticipantKeyAndStatus(projectId, participantKey, ConversationStatus.ACTIVE)
                    .orElseThrow(() -> e);
        }
    }

    ToolResult endConversation(JsonNode args, ConversationScope scope) {
        String conversationId = text(args, "conversation_id");
        if (conversationId == null) return error("'conversation_id' is required");
        Optional<ConversationThreadDocument> found = findInProject(conversationId, scope);
        if (found.isEmpty()) return error("Conversation not found: " + conversationId);
        ConversationThreadDocument thread = found.get();
        if (!isParticipant(thread, scope.role().name())) return notParticipant(scope.role().name(), conversationId);

        String resolution = text(args, "resolution");
        thread.setStatus(ConversationStatus.RESOLVED);
        thread.setResolution(resolution);
        thread.setActiveKey(null);
        thread.setUpdatedAt(clock.instant());
        threadRepository.save(thread);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("conversation_id", conversationId);
        result.put("status", "resolved");
        result.put("resolution", resolution != null ? resolution : "No resolution provided");
        return ToolResult.success(result);
    }

    ToolResult listConversations(JsonNode args, ConversationScope scope) {
        String status = args.path("status").asText("active").toLowerCase();
        int limit = args.path("limit").asInt(DEFAULT_LIST_LIMIT);
        if (limit <= 0) limit = DEFAULT_LIST_LIMIT;
        String memberKey = Participant.role(scope.role().name()).key();

        List<ConversationThreadDocument> threads;
        if ("all".equals(status)) {
            threads = threadRepository.findRecentByMember(scope.project().id(), memberKey, PageRequest.of(0, limit));
        } else {
            ConversationStatus wanted;
            try {
                wanted = ConversationStatus.valueOf(status.toUpperCase());
            } catch (IllegalArgumentException e) {
                return error("Unknown status: " + status);
            }
            threads = threadRepository.findByMember(scope.project().id(), wanted, memberKey).stream()
                    .limit(limit)
                    .collect(Collectors.toList());
        }

        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode items = result.putArray("conversations");
        for (ConversationThreadDocument thread : threads) {
            ObjectNode item = items.addObject();
            item.put("conversation_id", thread.getThreadId());
            ArrayNode participants = item.putArray("participants");
            thread.getParticipants().forEach(p -> participants.add(p.id()));
            item.put("status", thread.getStatus().name().toLowerCase());
            item.put("topic", thread.getTopic());
            item.put("updated_at", thread.getUpdatedAt() != null ? thread.getUpdatedAt().toString() : null);
        }
        result.put("total", threads.size());
        return ToolResult.success(result);
    }

    ToolResult getConversation(JsonNode args, ConversationScope scope) {
        String conversationId = text(args, "conversation_id");
        if (conversationId == null) return error("'conversation_id' is required");
        Optional<ConversationThreadDocument> found = findInProject(conversationId, scope);
        if (found.isEmpty()) return error("Conversation not found: " + conversationId);
        ConversationThreadDocument thread = found.get();
        if (!isParticipant(thread, scope.role().name())) return notParticipant(scope.role().name(), conversationId);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("conversation_id", thread.getThreadId());
        ArrayNode participants = result.putArray("participants");
        for (Participant p : thread.getParticipants()) {
            participants.addObject().put("type", p.type().name().toLowerCase()).put("id", p.id());
        }
        result.put("status", thread.getStatus().name().toLowerCase());
        result.put("topic", thread.getTopic());
        result.put("resolution", thread.getResolution());
        result.put("created_at", String.valueOf(thread.getCreatedAt()));
        result.put("updated_at", String.valueOf(thread.getUpdatedAt()));
        ArrayNode messages = result.putArray("messages");
        for (ConversationMessageDocument m : messageRepository.findByConversationIdOrderBySeqAsc(thread.getThreadId())) {
            ObjectNode item = messages.addObject();
            item.put("from", m.getFromParticipant().id());
            item.put("content", m.getContent());
            item.put("timestamp", String.valueOf(m.getTimestamp()));
        }
        return ToolResult.success(result);
    }

    ToolResult send(JsonNode args, ConversationScope scope) {
        if (!issueTracker.isAvailable()) {
            return error("send tool is not available: GitHub issue creation not configured");
        }
        String toRole = text(args, "to_role");
        String typeName = text(args, "type");
        String subject = text(args, "subject");
        String body = text(args, "body");
        if (toRole == null) return error("'to_role' is required");
        if (typeName == null) return error("'type' is required");
        if (subject == null) return error("'subject' is required");
        if (body == null) return error("'body' is required");
        NotificationType type;
        try {
            type = NotificationType.fromString(typeName);
        } catch (IllegalArgumentException e) {
            return error(e.getMessage());
        }
        String fromRole = scope.role().name();
        JsonNode context = args.path("context");

        IssueRef issue;
        try {
            issue = issueTracker.createIssue(scope.project().repository(), "[" + type.wireName() + "] " + subject,
                    notificationBody(fromRole, toRole, type, body, context),
                    List.of("notify:" + toRole, "type:" + type.wireName(), "from:" + fromRole));
        } catch (Exception e) {
            return error("Failed to send notification: " + e.getMessage());
        }
        if (type == NotificationType.ESCALATION) {
            sessionService.recordEscalation(scope.sessionId(), toRole + ": " + subject + " (#" + issue.number() + ")");
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("message", "Notification sent to " + toRole);
        result.put("issue_number", issue.number());
        result.put("issue_url", issue.url());
        result.put("type", type.wireName());
        result.put("to_role", toRole);
        return ToolResult.success(result);
    }

    static String notificationBody(String fromRole, String toRole, NotificationType type, String body, JsonNode context) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(type.label()).append("\n\n");
        sb.append("**From:** ").append(fromRole).append('\n');
        sb.append("**To:** ").append(toRole).append('\n');
        sb.append("**Type:** ").append(type.wireName()).append("\n\n");
        sb.append("---\n\n");
        sb.append(body);
        if (context != null && context.isObject() && context.size() > 0) {
            sb.append("\n\n---\n\n### Context\n\n```json\n").append(context.toPrettyString()).append("\n```\n");
            if (context.hasNonNull("conversation_id")) {
                sb.append("\n**Related Conversation:** `").append(context.get("conversation_id").asText()).append("`\n");
            }
            if (context.hasNonNull("issue_number")) {
                sb.append("\n**Related Issue:** #").append(context.get("issue_number").asText()).append('\n');
            }
            if (context.hasNonNull("pr_number")) {
                sb.append("\n**Related PR:** #").append(context.get("pr_number").asText()).append('\n');
            }
        }
        return sb.toString();
    }

    static String formatContext(ConversationThreadDocument thread, List<ConversationMessageDocument> messages,
                                String fromRole) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Active Conversation\n");
        sb.append("You are in a conversation with ").append(fromRole);
        if (thread.getTopic() != null && !thread.getTopic().isBlank()) {
            sb.append(" about: ").append(thread.getTopic());
        }
        sb.append(".\n\n");
        sb.append("Conversation ID: ").append(thread.getThreadId()).append("\n\n");
        if (!messages.isEmpty()) {
            sb.append("### Thread History\n");
            for (ConversationMessageDocument m : messages) {
                sb.append("\n[").append(m.getFromParticipant().id()).append("]: ").append(m.getContent()).append('\n');
            }
            sb.append('\n');
        }
        sb.append("### Your Turn\n");
        sb.append("Respond to continue this conversation. Your response will be returned to ").append(fromRole).append(".\n");
        return sb.toString();
    }

    /** Active threads that include a role, most recently updated first. */
    public List<ConversationThreadDocument> activeFor(String projectId, String roleName) {
        return threadRepository.findByMember(projectId, ConversationStatus.ACTIVE, Participant.role(roleName).key());
    }

    private void appendMessage(ConversationThreadDocument thread, Participant from, String content) {
        Instant now = clock.instant();
        ConversationMessageDocument msg = new ConversationMessageDocument();
        msg.setMessageId(UUID.randomUUID().toString());
        msg.setConversationId(thread.getThreadId());
        msg.setSeq(messageRepository.countByConversationId(thread.getThreadId()) + 1);
        msg.setFromParticipant(from);
        msg.setContent(content);
        msg.setTimestamp(now);
        messageRepository.save(msg);
        thread.setUpdatedAt(now);
        threadRepository.save(thread);
    }

    /** Threads of other projects are reported as missing. */
    private Optional<ConversationThreadDocument> findInProject(String conversationId, ConversationScope scope) {
        return threadRepository.findById(conversationId)
                .filter(t -> scope.project().id().equals(t.getProjectId()));
    }

    static boolean isParticipant(ConversationThreadDocument thread, String roleName) {
        String key = Participant.role(roleName).key();
        return thread.getMemberKeys() != null
                && thread.getMemberKeys().stream().anyMatch(k -> k.equalsIgnoreCase(key));
    }

    private static ToolResult notParticipant(String roleName, String conversationId) {
        return error("Role " + roleName + " is not a participant in conversation " + conversationId);
    }

    private AuditService.AuditScope scopeOf(ConversationScope scope) {
        return new AuditService.AuditScope(scope.project().id(), scope.sessionId(), scope.request().source().actor(),
                scope.role().name(), ConversationTools.CONVERSE, scope.request().trust());
    }

    static String activeKey(String projectId, String participantKey) {
        return projectId + "|" + participantKey;
    }

    private static String text(JsonNode args, String field) {
        String value = args.path(field).asText(null);
        return value == null || value.isBlank() ? null : value;
    }

    private static ToolResult error(String message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("error", true);
        node.put("message", message);
        return new ToolResult(false, node, message);
    }
}
