package me.golemcore.concierge.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.ConfigurationMissingException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationSession;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.domain.model.EngineReply;
import me.golemcore.concierge.domain.model.EngineRun;
import me.golemcore.concierge.domain.model.EngineRunStatus;
import me.golemcore.concierge.domain.model.InboundMessage;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.model.RateLimitResult;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.ChannelReplyAdapter;
import me.golemcore.concierge.domain.service.GenerationService;
import me.golemcore.concierge.domain.service.RunTracker;
import me.golemcore.concierge.domain.service.SessionService;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleResult;
import me.golemcore.concierge.module.ModuleRunner;
import me.golemcore.concierge.port.outbound.TenantSettingsPort;
import me.golemcore.concierge.ratelimit.RateLimiter;
import me.golemcore.concierge.routing.IntentRouter;
import me.golemcore.concierge.routing.RouteResult;
import me.golemcore.concierge.security.InputSanitizer;
import me.golemcore.concierge.security.PolicyEngine;
import me.golemcore.concierge.security.PolicyResult;
import me.golemcore.concierge.security.RuleSet;
import me.golemcore.concierge.security.RuleSetParser;
import me.golemcore.concierge.takeaway.ConversationalTakeawayModule;
import me.golemcore.concierge.takeaway.TakeawayConfigParser;
import me.golemcore.concierge.takeaway.TakeawayOrderModule;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates one inbound message through the pipeline:
 * rate limit, tenant context, session, input policy, intent classification,
 * module dispatch, output scrub, channel adaptation and run tracking.
 *
 * <p>
 * Every path records exactly one {@link EngineRun}. No exception escapes
 * {@link #handle(InboundMessage)}: unexpected failures become an
 * {@code error} run with an apology that hands off to a person.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Engine {

    static final String BLOCKED_REPLY = "I'm sorry, I'm unable to assist right now. "
            + "Please try again later or contact us directly.";
    static final String ERROR_REPLY = "I apologize for the inconvenience. "
            + "Let me connect you with a team member who can help.";
    static final String HANDOFF_REPLY = "Let me connect you with a team member who can better assist you.";
    static final String RATE_LIMITED_REPLY = "We're experiencing high demand. "
            + "Please try again in a moment, or I can have someone call you back.";
    static final String GREETING_FALLBACK = "Thank you for calling. Please hold while we connect you.";

    static final String AUDIT_HANDOFF = "engine.handoff_triggered";
    static final String AUDIT_COMPLETED = "engine.run_completed";
    static final String AUDIT_ERROR = "engine.error";

    static final String META_CUSTOMER_PHONE = "customerPhone";
    static final String META_LAST_INTENT = "lastIntent";

    private static final String ROLE_USER = "user";
    private static final String ROLE_ASSISTANT = "assistant";
    private static final String MODEL_NONE = "none";
    private static final String MODEL_POLICY = "policy";
    private static final String ORDER_ALIAS = "order";
    private static final double GREETING_ESTIMATED_COST = 0.01;
    private static final String GREETING_INSTRUCTION = "Generate a brief, friendly greeting for an incoming "
            + "phone call. Keep it under 30 words.";

    private final TenantSettingsPort tenantSettingsPort;
    private final RateLimiter rateLimiter;
    private final SessionService sessionService;
    private final RunTracker runTracker;
    private final InputSanitizer inputSanitizer;
    private final PolicyEngine policyEngine;
    private final IntentRouter intentRouter;
    private final FeatureGate featureGate;
    private final ModuleRunner moduleRunner;
    private final GenerationService generationService;
    private final ConciergeProperties properties;
    private final Clock clock;

    public EngineReply handle(InboundMessage message) {
        Instant started = clock.instant();
        String tenantId = message.getTenantId();
        Channel channel = message.getChannel() != null ? message.getChannel() : Channel.SMS;
        log.info("[Engine] Inbound {} message for tenant {}", channel.getValue(), tenantId);

        ConversationSession session = null;
        try {
            TenantSettings tenant = tenantSettingsPort.findByTenantId(tenantId).orElse(null);
            // unknown tenants never get a rate-limit window
            if (tenant == null) {
                throw new ConfigurationMissingException("Tenant settings not found: " + tenantId);
            }

            RateLimitResult admission = rateLimiter.admit(tenantId, rateLimitFor(tenant));
            if (!admission.isAllowed()) {
                return rateLimited(tenantId, admission, started);
            }

            String userText = inputSanitizer.sanitize(message.getUserText());
            log.debug("[Engine] Text: {}", truncate(userText, 200));

            session = sessionService.getOrCreate(tenantId, channel, message.getContactKey(),
                    message.getExternalThreadKey());
            List<ConversationTurn> history = sessionService.getConversationHistory(session.getId(),
                    properties.getEngine().getHistoryTurns());
            RuleSet rules = RuleSetParser.parse(tenant.getTemplateRules());

            PolicyResult inputPolicy = policyEngine.applyInputPolicies(userText, rules, history.size());
            if (!inputPolicy.passed()) {
                return inputPolicyHandoff(tenant, session, userText, message.getRaw(), inputPolicy, started);
            }

            sessionService.saveTurn(session, ROLE_USER, userText, message.getRaw());

            String systemPrompt = hasText(tenant.getSystemPrompt()) ? tenant.getSystemPrompt()
                    : properties.getEngine().getSystemPrompt();
            RouteResult route = intentRouter.classify(tenant, rules, systemPrompt, userText, history);
            if (route.isBlocked()) {
                return routeBlocked(tenant, session, route, started);
            }
            if (route.isRequiresHandoff()) {
                return routeHandoff(tenant, session, route, started);
            }

            List<String> modules = selectModules(tenant, route.getSuggestedModules());
            ModuleContext context = ModuleContext.builder()
                    .tenantId(tenantId)
                    .sessionId(session.getId())
                    .channel(channel)
                    .contactKey(session.getContactKey())
                    .userText(userText)
                    .history(history)
                    .systemPrompt(systemPrompt)
                    .rules(rules)
                    .tenant(tenant)
                    .sessionMetadata(sessionService.getSessionMetadata(session.getId()))
                    .capabilityCheck(capability -> featureGate.canUse(capability, tenant))
                    .intent(route.getIntent())
                    .build();

            ModuleResult result = moduleRunner.run(modules, context);
            return complete(tenant, session, route, modules, result, rules, started);

        } catch (ConfigurationMissingException e) {
            log.error("[Engine] {}", e.getMessage());
            EngineRun run = recordRun(tenantId, null, EngineRunStatus.ERROR, EngineRun.Decision.builder()
                    .blockedBy("config")
                    .error(e.getMessage())
                    .build(), MODEL_NONE, 0, 0, 0, started);
            return EngineReply.builder()
                    .replyText(ChannelReplyAdapter.adapt(ERROR_REPLY, channel).text())
                    .sessionId("")
                    .handoffTriggered(true)
                    .handoffReason("Configuration error")
                    .blocked(true)
                    .blockedBy("config")
                    .engineRunId(run.getId())
                    .build();
        } catch (Exception e) { // NOSONAR - the pipeline must always answer the caller
            return failed(tenantId, session, channel, e, started);
        }
    }

    /**
     * Welcome text for an inbound call. Falls back to a fixed greeting when
     * the tenant, the LLM or the budget is unavailable.
     */
    public CallGreeting greetCaller(String tenantId, String from) {
        try {
            TenantSettings tenant = tenantSettingsPort.findByTenantId(tenantId).orElse(null);
            if (tenant == null) {
                return new CallGreeting(GREETING_FALLBACK, null);
            }

            ConversationSession session = sessionService.getOrCreate(tenantId, Channel.VOICE, from, null);
            if (generationService.isConfigured() && hasText(tenant.getSystemPrompt())) {
                try {
                    return generateGreeting(tenant, session);
                } catch (BudgetExceededException | GenerationFailureException e) {
                    log.warn("[Engine] Voice greeting unavailable for tenant {}: {}", tenantId, e.getMessage());
                }
            }
            return new CallGreeting(GREETING_FALLBACK, session.getId());
        } catch (Exception e) { // NOSONAR - a caller always hears a greeting
            log.error("[Engine] Error in voice greeting: {}", e.getMessage(), e);
            return new CallGreeting(GREETING_FALLBACK, null);
        }
    }

    private CallGreeting generateGreeting(TenantSettings tenant, ConversationSession session) {
        Instant started = clock.instant();
        LlmRequest request = LlmRequest.builder()
                .model(generationService.resolveModel(tenant))
                .systemPrompt(tenant.getSystemPrompt())
                .messages(List.of(Message.user(GREETING_INSTRUCTION)))
                .maxTokens(60)
                .tenantId(tenant.getTenantId())
                .build();
        GenerationService.Generation generation = generationService.chat(tenant.getTenantId(), "llm.greeting",
                request, GREETING_ESTIMATED_COST);

        RuleSet rules = RuleSetParser.parse(tenant.getTemplateRules());
        String greeting = policyEngine.applyOutputPolicies(generation.text(), rules);
        if (!hasText(greeting)) {
            greeting = GREETING_FALLBACK;
        }

        EngineRun run = EngineRun.builder()
                .tenantId(tenant.getTenantId())
                .sessionId(session.getId())
                .status(EngineRunStatus.SUCCESS)
                .decision(EngineRun.Decision.builder().intent("voice_greeting").build())
                .inputTokens(generation.inputTokens())
                .outputTokens(generation.outputTokens())
                .costUsd(generation.costUsd())
                .modelUsed(generation.model())
                .durationMs(elapsed(started))
                .build();
        runTracker.createEngineRun(run);
        return new CallGreeting(greeting, session.getId());
    }

    /**
     * Read-only view of the tenant's admission window.
     */
    public RateLimitResult rateLimitStatus(String tenantId) {
        TenantSettings tenant = tenantSettingsPort.findByTenantId(tenantId).orElse(null);
        return rateLimiter.status(tenantId, rateLimitFor(tenant));
    }

    int rateLimitFor(TenantSettings tenant) {
        if (tenant != null && tenant.getMaxEngineRunsPerMinute() != null) {
            return tenant.getMaxEngineRunsPerMinute();
        }
        return properties.getEngine().getDefaultRateLimitPerMinute();
    }

    private EngineReply rateLimited(String tenantId, RateLimitResult admission, Instant started) {
        log.warn("[Engine] Tenant {} rate limited: {}", tenantId, admission.getReason());
        EngineRun run = recordRun(tenantId, null, EngineRunStatus.BLOCKED, EngineRun.Decision.builder()
                .blockedBy("rate_limit")
                .error(admission.getReason())
                .build(), MODEL_NONE, 0, 0, 0, started);
        return EngineReply.builder()
                .replyText(RATE_LIMITED_REPLY)
                .sessionId("")
                .handoffTriggered(true)
                .handoffReason(admission.getReason())
                .blocked(true)
                .blockedBy("rate_limit")
                .engineRunId(run.getId())
                .build();
    }

    private EngineReply inputPolicyHandoff(TenantSettings tenant, ConversationSession session, String userText,
            Map<String, Object> raw, PolicyResult policy, Instant started) {
        log.warn("[Engine] Input policy handoff ({}): {}", policy.category(), policy.reason());
        EngineRun run = recordRun(tenant.getTenantId(), session.getId(), EngineRunStatus.HANDOFF,
                EngineRun.Decision.builder()
                        .intent(policy.category())
                        .handoffReason(policy.reason())
                        .build(),
                MODEL_POLICY, 0, 0, 0, started);

        sessionService.saveTurn(session, ROLE_USER, userText, raw);
        sessionService.saveTurn(session, ROLE_ASSISTANT, HANDOFF_REPLY, null);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionId", session.getId());
        details.put("trigger", "input_policy");
        details.put("category", policy.category());
        details.put("reason", policy.reason());
        runTracker.audit(tenant.getTenantId(), AUDIT_HANDOFF, details);

        return EngineReply.builder()
                .replyText(ChannelReplyAdapter.adapt(HANDOFF_REPLY, session.getChannel()).text())
                .sessionId(session.getId())
                .handoffTriggered(true)
                .handoffReason(policy.reason())
                .blocked(false)
                .engineRunId(run.getId())
                .build();
    }

    private EngineReply routeBlocked(TenantSettings tenant, ConversationSession session, RouteResult route,
            Instant started) {
        log.warn("[Engine] Classification blocked by {} for tenant {}", route.getBlockedBy(),
                tenant.getTenantId());
        EngineRun run = recordRun(tenant.getTenantId(), session.getId(), EngineRunStatus.BLOCKED,
                decisionOf(route, route.getSuggestedModules()).blockedBy(route.getBlockedBy()).build(),
                modelOf(route), route.getInputTokens(), route.getOutputTokens(), route.getCostUsd(), started);

        String reply = ChannelReplyAdapter.adapt(BLOCKED_REPLY, session.getChannel()).text();
        sessionService.saveTurn(session, ROLE_ASSISTANT, reply, null);
        return EngineReply.builder()
                .replyText(reply)
                .sessionId(session.getId())
                .handoffTriggered(true)
                .handoffReason(route.getHandoffReason())
                .blocked(true)
                .blockedBy(route.getBlockedBy())
                .engineRunId(run.getId())
                .inputTokens(route.getInputTokens())
                .outputTokens(route.getOutputTokens())
                .build();
    }

    private EngineReply routeHandoff(TenantSettings tenant, ConversationSession session, RouteResult route,
            Instant started) {
        log.info("[Engine] Routing handoff: {}", route.getHandoffReason());
        EngineRun run = recordRun(tenant.getTenantId(), session.getId(), EngineRunStatus.HANDOFF,
                decisionOf(route, route.getSuggestedModules()).handoffReason(route.getHandoffReason()).build(),
                modelOf(route), route.getInputTokens(), route.getOutputTokens(), route.getCostUsd(), started);

        String handoffText = hasText(tenant.getHandoffReplyText()) ? tenant.getHandoffReplyText() : HANDOFF_REPLY;
        String reply = ChannelReplyAdapter.adapt(handoffText, session.getChannel()).text();
        sessionService.saveTurn(session, ROLE_ASSISTANT, reply, null);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionId", session.getId());
        details.put("intent", route.getIntent());
        details.put("confidence", route.getConfidence());
        details.put("reason", route.getHandoffReason());
        runTracker.audit(tenant.getTenantId(), AUDIT_HANDOFF, details);

        return EngineReply.builder()
                .replyText(reply)
                .sessionId(session.getId())
                .handoffTriggered(true)
                .handoffReason(route.getHandoffReason())
                .blocked(false)
                .engineRunId(run.getId())
                .inputTokens(route.getInputTokens())
                .outputTokens(route.getOutputTokens())
                .build();
    }

    private EngineReply complete(TenantSettings tenant, ConversationSession session, RouteResult route,
            List<String> modules, ModuleResult result, RuleSet rules, Instant started) {
        String scrubbed = policyEngine.applyOutputPolicies(result.getReplyText(), rules);
        String replyText = hasText(scrubbed) ? scrubbed : result.getReplyText();
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt(replyText, session.getChannel());
        if (adapted.truncated()) {
            log.debug("[Engine] Reply truncated from {} chars for {}", adapted.originalLength(),
                    session.getChannel().getValue());
        }

        EngineRunStatus status = statusOf(result);
        int inputTokens = route.getInputTokens() + result.getInputTokens();
        int outputTokens = route.getOutputTokens() + result.getOutputTokens();
        double cost = route.getCostUsd() + result.getCostUsd();
        String model = result.getModel() != null ? result.getModel() : modelOf(route);

        EngineRun run = recordRun(tenant.getTenantId(), session.getId(), status, decisionOf(route, modules)
                .blockedBy(result.getBlockedBy())
                .handoffReason(result.getHandoffReason())
                .build(), model, inputTokens, outputTokens, cost, started);

        sessionService.saveTurn(session, ROLE_ASSISTANT, adapted.text(), null);

        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(META_CUSTOMER_PHONE, session.getContactKey());
        updates.put(META_LAST_INTENT, route.getIntent());
        if (result.getSessionMetadataUpdates() != null) {
            updates.putAll(result.getSessionMetadataUpdates());
        }
        sessionService.updateSessionMetadata(session.getId(), updates);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionId", session.getId());
        details.put("intent", route.getIntent());
        details.put("confidence", route.getConfidence());
        details.put("status", status.getValue());
        details.put("durationMs", run.getDurationMs());
        runTracker.audit(tenant.getTenantId(), AUDIT_COMPLETED, details);

        log.info("[Engine] Run {} finished: status={}, intent={}, modules={}", run.getId(), status.getValue(),
                route.getIntent(), modules);
        return EngineReply.builder()
                .replyText(adapted.text())
                .sessionId(session.getId())
                .handoffTriggered(result.isHandoffTriggered())
                .handoffReason(result.getHandoffReason())
                .blocked(result.getBlockedBy() != null)
                .blockedBy(result.getBlockedBy())
                .engineRunId(run.getId())
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    private EngineReply failed(String tenantId, ConversationSession session, Channel channel, Exception e,
            Instant started) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("[Engine] Error processing message: {}", error, e);
        String sessionId = session != null ? session.getId() : null;

        EngineRun run;
        try {
            run = recordRun(tenantId, sessionId, EngineRunStatus.ERROR,
                    EngineRun.Decision.builder().error(error).build(), MODEL_NONE, 0, 0, 0, started);
        } catch (RuntimeException runFailure) { // NOSONAR - the store itself may be what failed
            log.error("[Engine] Could not record error run: {}", runFailure.getMessage());
            run = EngineRun.builder().id("").build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionId", sessionId);
        details.put("error", error);
        runTracker.audit(tenantId, AUDIT_ERROR, details);

        return EngineReply.builder()
                .replyText(ChannelReplyAdapter.adapt(ERROR_REPLY, channel).text())
                .sessionId(sessionId != null ? sessionId : "")
                .handoffTriggered(true)
                .handoffReason("Engine error")
                .blocked(false)
                .engineRunId(run.getId())
                .build();
    }

    /**
     * Swaps the keyword ordering module for the function-calling one when the
     * tenant opted in and has a menu to order from.
     */
    List<String> selectModules(TenantSettings tenant, List<String> suggested) {
        boolean conversational = tenant.isUseConversationalMode()
                && TakeawayConfigParser.parseTakeaway(tenant.getTakeawayConfig()).enabled()
                && TakeawayConfigParser.parseMenu(tenant.getMenuConfig()).enabled();
        if (!conversational) {
            return suggested;
        }
        log.info("[Engine] Using conversational mode for takeaway order");
        return suggested.stream()
                .map(name -> TakeawayOrderModule.NAME.equals(name) || ORDER_ALIAS.equals(name)
                        ? ConversationalTakeawayModule.NAME
                        : name)
                .toList();
    }

    /**
     * Blocked wins over handoff because a blocked module also hands off.
     */
    static EngineRunStatus statusOf(ModuleResult result) {
        if (result.getBlockedBy() != null) {
            return EngineRunStatus.BLOCKED;
        }
        if (result.isHandoffTriggered()) {
            return EngineRunStatus.HANDOFF;
        }
        return EngineRunStatus.SUCCESS;
    }

    private EngineRun recordRun(String tenantId, String sessionId, EngineRunStatus status,
            EngineRun.Decision decision, String model, int inputTokens, int outputTokens, double cost,
            Instant started) {
        return runTracker.createEngineRun(EngineRun.builder()
                .tenantId(tenantId)
                .sessionId(sessionId)
                .status(status)
                .decision(decision)
                .modelUsed(model)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .costUsd(cost)
                .durationMs(elapsed(started))
                .build());
    }

    private static EngineRun.Decision.DecisionBuilder decisionOf(RouteResult route, List<String> modules) {
        return EngineRun.Decision.builder()
                .intent(route.getIntent())
                .confidence(route.getConfidence())
                .modules(modules != null ? List.copyOf(modules) : List.of());
    }

    private static String modelOf(RouteResult route) {
        return route.getModel() != null ? route.getModel() : MODEL_NONE;
    }

    private long elapsed(Instant started) {
        return Math.max(0, clock.millis() - started.toEpochMilli());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }

    /**
     * Welcome text for a voice call, with the session opened for the caller
     * when the tenant is known.
     */
    public record CallGreeting(String welcomeText, String sessionId) {
    }
}
