package io.github.drompincen.aigov.runtime.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.protocol.api.ToolSpec;

import java.util.List;
import java.util.Set;

/**
 * Catalog entries of the conversation tools, which the agent loop executes itself instead of the
 * tool dispatcher.
 */
public final class ConversationTools {

    public static final String CONVERSE = "converse";
    public static final String END_CONVERSATION = "end_conversation";
    public static final String LIST_CONVERSATIONS = "list_conversations";
    public static final String GET_CONVERSATION = "get_conversation";
    public static final String SEND = "send";

    public static final Set<String> NAMES =
            Set.of(CONVERSE, END_CONVERSATION, LIST_CONVERSATIONS, GET_CONVERSATION, SEND);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConversationTools() {}

    public static boolean handles(String toolName) {
        return NAMES.contains(toolName);
    }

    public static List<ToolSpec> specs() {
        return List.of(converse(), endConversation(), listConversations(), getConversation(), send());
    }

    private static ToolSpec converse() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("with_role").put("type", "string")
                .put("description", "Role to converse with (required when starting a new conversation)");
        props.putObject("message").put("type", "string").put("description", "Your message");
        props.putObject("conversation_id").put("type", "string")
                .put("description", "Continue an existing conversation");
        props.putObject("topic").put("type", "string").put("description", "Topic of a new conversation");
        schema.putArray("required").add("message");
        return new ToolSpec(CONVERSE, "Have a synchronous conversation with another role. "
                + "The other role responds before this call returns.", schema);
    }

    private static ToolSpec endConversation() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("conversation_id").put("type", "string");
        props.putObject("resolution").put("type", "string").put("description", "How the conversation was resolved");
        schema.putArray("required").add("conversation_id");
        return new ToolSpec(END_CONVERSATION, "End a conversation and record its resolution", schema);
    }

    private static ToolSpec listConversations() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        ObjectNode status = props.putObject("status");
        status.put("type", "string");
        status.putArray("enum").add("active").add("resolved").add("stale").add("all");
        props.putObject("limit").put("type", "integer").put("description", "Default 10");
        return new ToolSpec(LIST_CONVERSATIONS, "List your conversations", schema);
    }

    private static ToolSpec getConversation() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("conversation_id").put("type", "string");
        schema.putArray("required").add("conversation_id");
        return new ToolSpec(GET_CONVERSATION, "Get a conversation with its full message history", schema);
    }

    private static ToolSpec send() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("to_role").put("type", "string");
        ObjectNode type = props.putObject("type");
        type.put("type", "string");
        type.putArray("enum").add("escalation").add("work_request").add("review_request").add("fyi");
        props.putObject("subject").put("type", "string");
        props.putObject("body").put("type", "string");
        props.putObject("context").put("type", "object")
                .put("description", "Optional related ids such as conversation_id, issue_number, pr_number");
        schema.putArray("required").add("to_role").add("type").add("subject").add("body");
        return new ToolSpec(SEND, "Send an async notification to another role. Unlike converse, "
                + "this does not wait for a response; it files a tracked issue addressed to the role.", schema);
    }
}
