package io.github.drompincen.aigov.runtime.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import io.github.drompincen.aigov.runtime.agent.llm.*;
import io.github.drompincen.aigov.runtime.conversation.ConversationScope;
import io.github.drompincen.aigov.runtime.conversation.ConversationService;
import io.github.drompincen.aigov.runtime.conversation.ConversationTools;
import io.github.drompincen.aigov.runtime.error.AgentInvocationException;
import io.github.drompincen.aigov.runtime.error.SessionBlockedException;
import io.github.drompincen.aigov.runtime.hooks.*;
import io.github.drompincen.aigov.runtime.session.SessionService;
import io.github.drompincen.aigov.runtime.tools.ToolContext;
import io.github.drompincen.aigov.runtime.tools.ToolDispatcher;
import io.github.drompincen.aigov.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one role's agent for one request: builds the system context, then alternates LLM calls and
 * governed tool execution until the model stops asking for tools, and finally validates the session
 * with the stop hook.
 *
 * <p>Tool calls of one turn are executed in order. Every call passes the pre-tool hook first and the
 * post-tool hook after it ran; a rejected call is answered with an error tool result so the model can
 * adapt. Any other failure fails the session and propagates as {@link AgentInvocationException}.
 */
@Service
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LlmClient llmClient;
    private final LlmInteractionService llmInteractionService;
    private final SystemContextBuilder contextBuilder;
    private final ToolDispatcher toolDispatcher;
    private final ConversationService conversationService;
    private final SessionService sessionService;
    private final PreToolUseHook preToolUseHook;
    private final PostToolUseHook postToolUseHook;
    private final StopHook stopHook;
    private final int maxIterations;
    private final StopHookEnforcement enforcement;
    private final String defaultModel;
    private final int defaultMaxTokens;

    public AgentInvoker(LlmClient llmClient,
                        LlmInteractionService llmInteractionService,
                        SystemContextBuilder contextBuilder,
                        ToolDispatcher toolDispatcher,
                        ConversationService conversationService,
                        SessionService sessionService,
                        PreToolUseHook preToolUseHook,
                        PostToolUseHook postToolUseHook,
                        StopHook stopHook,
                        @Value("${aigov.agent.max-iterations:25}") int maxIterations,
                        @Value("${aigov.stop-hook.enforcement:warn}") String enforcement,
                        @Value("${aigov.llm.default-model:claude-sonnet-4-5-20250929}") String defaultModel,
                        @Value("${aigov.llm.default-max-tokens:8192}") int defaultMaxTokens) {
        this.llmClient = llmClient;
        this.llmInteractionService = llmInteractionService;
        this.contextBuilder = contextBuilder;
        this.toolDispatcher = toolDispatcher;
        this.conversationService = conversationService;
        this.sessionService = sessionService;
        this.preToolUseHook = preToolUseHook;
        this.postToolUseHook = postToolUseHook;
        this.stopHook = stopHook;
        this.maxIterations = maxIterations;
        this.enforcement = StopHookEnforcement.fromString(enforcement);
        this.defaultModel = defaultModel;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public AgentResponse invoke(InvocationContext ctx) {
        GovernanceRequest request = ctx.request();
        RoleDefinition role = ctx.role();
        SessionDocument session = sessionService.start(request, role, ctx.depth(), ctx.parentSessionId());
        RunState state = new RunState();
        StopHookResult stop;

        try {
            String system = contextBuilder.build(ctx);
            List<ToolSpec> tools = toolCatalog(ctx);
            List<LlmMessage> history = new ArrayList<>();
            history.add(LlmMessage.user(initialMessage(request)));

            int iteration = 0;
            while (true) {
                if (iteration >= maxIterations) {
                    log.warn("Session {}: stopped after {} iterations", session.getSessionId(), maxIterations);
                    state.warnings.add("Agent loop stopped after " + maxIterations + " iterations");
                    break;
                }
                iteration++;

                LlmRequest llmRequest = new LlmRequest(
                        role.model() != null ? role.model() : defaultModel,
                        role.maxTokens() != null ? role.maxTokens() : defaultMaxTokens,
                        system, history, tools);
                LlmResponse response = complete(session, ctx, llmRequest);
                history.add(LlmMessage.assistant(response.content()));
                String text = response.text();
                if (!text.isBlank()) state.texts.add(text);

                if (response.stopReason() != StopReason.TOOL_USE || response.toolUses().isEmpty()) break;

                List<ContentBlock> results = new ArrayList<>();
                for (ToolUseBlock use : response.toolUses()) {
                    results.add(executeToolUse(session, ctx, use, state));
                }
                history.add(LlmMessage.user(results));
            }

            stop = stopHook.validate(session, request, role, state.actions, state.decisions);
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            stopHook.forceComplete(session, SessionStatus.FAILED, reason);
            log.error("Session {} failed for role {}", session.getSessionId(), role.name(), e);
            throw new AgentInvocationException(session.getSessionId(),
                    "Agent invocation failed for role " + role.name() + ": " + reason, e);
        }

        if (!stop.canComplete()) {
            if (enforcement == StopHookEnforcement.BLOCK) {
                throw new SessionBlockedException(session.getSessionId(), stop.missingDecisions());
            }
            log.warn("Session {}: stop validation failed, returning response anyway: {}",
                    session.getSessionId(), stop.reason());
            state.warnings.add(stop.reason() + " (missing: " + String.join(", ", stop.missingDecisions()) + ")");
        }

        return new AgentResponse(session.getSessionId(), String.join("\n", state.texts),
                stop.canComplete() ? SessionStatus.COMPLETED : SessionStatus.BLOCKED, state.warnings);
    }

    private LlmResponse complete(SessionDocument session, InvocationContext ctx, LlmRequest llmRequest) {
        long start = System.currentTimeMillis();
        try {
            LlmResponse response = llmClient.complete(llmRequest);
            llmInteractionService.recordSuccess(session.getSessionId(), session.getProjectId(), ctx.role().name(),
                    llmClient.provider(), llmRequest, response, System.currentTimeMillis() - start);
            return response;
        } catch (RuntimeException e) {
            llmInteractionService.recordFailure(session.getSessionId(), session.getProjectId(), ctx.role().name(),
                    llmClient.provider(), llmRequest, e, System.currentTimeMillis() - start);
            throw e;
        }
    }

    private ToolResultBlock executeToolUse(SessionDocument session, InvocationContext ctx, ToolUseBlock use,
                                           RunState state) {
        var input = use.input() != null ? use.input() : MAPPER.createObjectNode();
        PreToolUseResult pre = preToolUseHook.validate(session, use.name(), input, ctx.request(), ctx.role());
        if (!pre.allowed()) {
            return new ToolResultBlock(use.id(), use.name(), "Tool use blocked: " + pre.reason(), true);
        }

        ToolResult result;
        if (ConversationTools.handles(use.name())) {
            ConversationScope scope = new ConversationScope(session.getSessionId(), ctx.request(), ctx.project(),
                    ctx.role(), ctx.depth());
            result = conversationService.execute(use.name(), input, scope,
                    (target, context, conversationId) ->
                            invoke(ctx.nested(target, session.getSessionId(), context)).text());
        } else {
            ToolContext toolContext = new ToolContext(session.getSessionId(), session.getProjectId(),
                    ctx.role().name(), ctx.project().repository(), null);
            result = toolDispatcher.executeTool(ctx.project(), toolContext, use.name(), input);
        }
        // only calls that actually took effect owe a decision
        if (result.success()) state.actions.add(use.name());

        PostToolUseResult post = postToolUseHook.process(session, use.name(), input, result, ctx.request(),
                ctx.role(), pre.requiresDecisionLogging());
        if (post.decisionLogged()) state.decisions.add(post.decisionId());
        state.warnings.addAll(post.warnings());

        return new ToolResultBlock(use.id(), use.name(), result.content(), !result.success());
    }

    List<ToolSpec> toolCatalog(InvocationContext ctx) {
        List<ToolSpec> tools = toolDispatcher.getToolDefinitions(ctx.project(), ctx.role().tools()).stream()
                .filter(spec -> !ConversationTools.handles(spec.name()))
                .collect(Collectors.toCollection(ArrayList::new));
        ConversationTools.specs().stream()
                .filter(spec -> ctx.role().tools().isAllowed(spec.name()))
                .forEach(tools::add);
        return tools;
    }

    static String initialMessage(GovernanceRequest request) {
        if (request.payload().isEmpty()) return request.intent();
        try {
            return request.intent() + "\n\n```json\n"
                    + MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(request.payload()) + "\n```";
        } catch (Exception e) {
            log.warn("Request {} payload is not serializable, sending the intent only: {}", request.id(), e.getMessage());
            return request.intent();
        }
    }

    private static final class RunState {
        final List<String> texts = new ArrayList<>();
        final List<String> actions = new ArrayList<>();
        final List<String> decisions = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
    }
}
