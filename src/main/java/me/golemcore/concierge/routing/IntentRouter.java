package me.golemcore.concierge.routing;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.GenerationService;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.security.PolicyEngine;
import me.golemcore.concierge.security.PolicyResult;
import me.golemcore.concierge.security.RuleSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM-based intent classifier that maps an inbound message to candidate
 * modules.
 *
 * <p>
 * The classifier sees the tenant's system prompt, the allow-listed intents
 * (with descriptions and examples where configured), the last few history
 * turns and the user text, and must answer with a JSON object. The answer then
 * passes through the confidence policy:
 * <ul>
 * <li>below the threshold, the route always hands off</li>
 * <li>{@code handoff} and {@code unknown} always hand off</li>
 * <li>otherwise the classifier's suggested modules win, falling back to a
 * fixed intent table</li>
 * </ul>
 *
 * <p>
 * Classification never throws. An unconfigured provider, a failed call or an
 * unreadable answer yields {@code unknown} with confidence 0 and a handoff; an
 * exhausted budget yields a route blocked by {@code budget}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntentRouter {

    public static final String INTENT_UNKNOWN = "unknown";
    public static final String INTENT_HANDOFF = "handoff";

    public static final String MODULE_HANDOFF = "handoff";
    public static final String MODULE_TAKEAWAY = "takeaway-order";
    public static final String MODULE_BOOKING = "booking";

    public static final List<String> DEFAULT_INTENTS = List.of(
            "greeting", "faq", "handoff", "collect_contact", "goodbye", "unknown");

    // Intents served by the module of the same name
    private static final Set<String> DIRECT_MODULE_INTENTS = Set.of(
            "greeting", "faq", "handoff", "collect_contact", "goodbye");

    static final double CLASSIFICATION_ESTIMATED_COST = 0.001;
    private static final int MAX_EXAMPLES = 3;

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```",
            Pattern.DOTALL);
    private static final Pattern RAW_JSON_PATTERN = Pattern.compile("(\\{.*})", Pattern.DOTALL);

    private final GenerationService generationService;
    private final PolicyEngine policyEngine;
    private final ObjectMapper objectMapper;
    private final ConciergeProperties properties;

    /**
     * Classify a message for a tenant.
     *
     * @param tenant
     *            tenant settings snapshot (intents, definitions, model)
     * @param rules
     *            parsed template rules (confidence threshold)
     * @param systemPrompt
     *            business system prompt
     * @param userText
     *            the inbound message
     * @param history
     *            conversation turns in chronological order
     * @return routing decision, never {@code null}
     */
    public RouteResult classify(TenantSettings tenant, RuleSet rules, String systemPrompt, String userText,
            List<ConversationTurn> history) {
        if (!generationService.isConfigured()) {
            log.warn("[IntentRouter] LLM not configured, defaulting to handoff");
            return failSafe("LLM not configured", "AI engine not configured");
        }

        List<String> intents = resolveIntents(tenant);
        LlmRequest request = LlmRequest.builder()
                .model(generationService.classificationModel())
                .systemPrompt(buildPrompt(systemPrompt, intents, tenant.getIntentDefinitions(),
                        rules.confidenceThreshold()))
                .messages(buildMessages(userText, history))
                .temperature(0.1)
                .maxTokens(200)
                .build();

        GenerationService.Generation generation;
        try {
            generation = generationService.chat(tenant.getTenantId(), "llm.classify", request,
                    CLASSIFICATION_ESTIMATED_COST);
        } catch (BudgetExceededException e) {
            log.warn("[IntentRouter] Budget exhausted for tenant {}: {}", tenant.getTenantId(), e.getMessage());
            return RouteResult.builder()
                    .intent(INTENT_UNKNOWN)
                    .confidence(0)
                    .rationale("Budget exceeded")
                    .suggestedModules(List.of(MODULE_HANDOFF))
                    .requiresHandoff(true)
                    .handoffReason("AI budget exceeded")
                    .blockedBy("budget")
                    .build();
        } catch (GenerationFailureException e) {
            log.warn("[IntentRouter] Classification failed: {}", e.getMessage());
            return failSafe("Classification error: " + e.getMessage(), "Classification error");
        }

        Classification classification = parse(generation.text());
        log.info("[IntentRouter] Classified: intent={}, confidence={}", classification.intent(),
                String.format(Locale.ROOT, "%.2f", classification.confidence()));
        return route(classification, rules, generation);
    }

    private RouteResult route(Classification classification, RuleSet rules,
            GenerationService.Generation generation) {
        RouteResult.RouteResultBuilder builder = RouteResult.builder()
                .intent(classification.intent())
                .confidence(classification.confidence())
                .rationale(classification.rationale())
                .inputTokens(generation.inputTokens())
                .outputTokens(generation.outputTokens())
                .costUsd(generation.costUsd())
                .model(generation.model());

        PolicyResult confidenceCheck = policyEngine.checkConfidence(classification.confidence(), rules);
        if (!confidenceCheck.passed()) {
            return builder
                    .suggestedModules(List.of(MODULE_HANDOFF))
                    .requiresHandoff(true)
                    .handoffReason(confidenceCheck.reason())
                    .build();
        }

        String intent = classification.intent();
        boolean handoff = INTENT_HANDOFF.equals(intent) || INTENT_UNKNOWN.equals(intent);
        return builder
                .suggestedModules(mapIntentToModules(intent, classification.suggestedModules()))
                .requiresHandoff(handoff)
                .handoffReason(handoff ? "Intent: " + intent : null)
                .build();
    }

    /**
     * Candidate modules for an intent. Explicit suggestions from the classifier
     * are trusted as is.
     */
    public static List<String> mapIntentToModules(String intent, List<String> suggested) {
        if (suggested != null && !suggested.isEmpty()) {
            return List.copyOf(suggested);
        }
        if (intent == null) {
            return List.of(MODULE_HANDOFF);
        }
        if (DIRECT_MODULE_INTENTS.contains(intent)) {
            return List.of(intent);
        }
        if (intent.startsWith("order.") || intent.startsWith("menu.") || intent.startsWith("payment.")) {
            return List.of(MODULE_TAKEAWAY);
        }
        if (intent.startsWith("booking.")) {
            return List.of(MODULE_BOOKING);
        }
        return List.of(MODULE_HANDOFF);
    }

    private RouteResult failSafe(String rationale, String handoffReason) {
        return RouteResult.builder()
                .intent(INTENT_UNKNOWN)
                .confidence(0)
                .rationale(rationale)
                .suggestedModules(List.of(MODULE_HANDOFF))
                .requiresHandoff(true)
                .handoffReason(handoffReason)
                .build();
    }

    private List<String> resolveIntents(TenantSettings tenant) {
        List<String> allowed = tenant.getIntentsAllowed();
        if (allowed == null || allowed.isEmpty()) {
            return DEFAULT_INTENTS;
        }
        return allowed.stream()
                .filter(intent -> intent != null && !intent.isBlank())
                .toList();
    }

    private String buildPrompt(String systemPrompt, List<String> intents,
            Map<String, TenantSettings.IntentDefinition> definitions, double threshold) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an intent classification system. ")
                .append("Your task is to classify the user's message into one of the allowed intents.\n\n");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            sb.append(systemPrompt).append("\n\n");
        }

        sb.append("ALLOWED INTENTS:\n");
        for (String intent : intents) {
            sb.append("- ").append(intent);
            TenantSettings.IntentDefinition definition = definitions != null ? definitions.get(intent) : null;
            if (definition != null) {
                if (definition.getDescription() != null && !definition.getDescription().isBlank()) {
                    sb.append(": ").append(definition.getDescription());
                }
                List<String> examples = definition.getExamples();
                if (examples != null && !examples.isEmpty()) {
                    sb.append(" (examples: \"")
                            .append(String.join("\", \"", examples.subList(0, Math.min(MAX_EXAMPLES,
                                    examples.size()))))
                            .append("\")");
                }
            }
            sb.append('\n');
        }
        sb.append(String.format(Locale.ROOT,
                "- unknown (use when no intent matches or confidence is below %.2f)%n%n", threshold));

        sb.append("""
                RULES:
                1. Return ONLY valid JSON with this exact structure: \
                {"intent": "...", "confidence": 0.0-1.0, "rationale": "...", "suggestedModules": [...]}
                2. confidence must be a number between 0 and 1
                3. If unsure, use intent "unknown" with low confidence
                4. suggestedModules is optional - include it only if the intent needs specific modules
                """);
        return sb.toString();
    }

    private List<Message> buildMessages(String userText, List<ConversationTurn> history) {
        List<Message> messages = new ArrayList<>();
        if (history != null && !history.isEmpty()) {
            int window = Math.max(0, properties.getRouting().getHistoryTurns());
            int start = Math.max(0, history.size() - window);
            for (ConversationTurn turn : history.subList(start, history.size())) {
                messages.add(Message.fromTurn(turn));
            }
        }
        messages.add(Message.user(userText));
        return messages;
    }

    Classification parse(String content) {
        if (content == null || content.isBlank()) {
            return Classification.unreadable("Empty classification response");
        }
        try {
            JsonNode node = objectMapper.readTree(extractJson(content));
            if (node == null || !node.isObject()) {
                return Classification.unreadable("Classification response is not a JSON object");
            }

            String intent = node.path("intent").asText("");
            if (intent.isBlank()) {
                intent = INTENT_UNKNOWN;
            }
            JsonNode confidenceNode = node.get("confidence");
            double confidence = confidenceNode != null && confidenceNode.isNumber()
                    ? Math.max(0.0, Math.min(1.0, confidenceNode.asDouble()))
                    : 0.0;
            String rationale = node.hasNonNull("rationale") ? node.get("rationale").asText() : null;

            List<String> suggested = new ArrayList<>();
            JsonNode modules = node.get("suggestedModules");
            if (modules != null && modules.isArray()) {
                for (JsonNode module : modules) {
                    if (module.isTextual() && !module.asText().isBlank()) {
                        suggested.add(module.asText());
                    }
                }
            }
            return new Classification(intent, confidence, rationale, suggested);
        } catch (Exception e) { // NOSONAR - any unreadable answer degrades to unknown
            log.warn("[IntentRouter] Failed to parse classification response: {}", e.getMessage());
            return Classification.unreadable("Failed to parse classification response");
        }
    }

    private String extractJson(String response) {
        Matcher block = JSON_BLOCK_PATTERN.matcher(response);
        if (block.find()) {
            return block.group(1);
        }
        Matcher raw = RAW_JSON_PATTERN.matcher(response);
        if (raw.find()) {
            return raw.group(1);
        }
        return response.trim();
    }

    record Classification(String intent, double confidence, String rationale, List<String> suggestedModules) {

        static Classification unreadable(String rationale) {
            return new Classification(INTENT_UNKNOWN, 0.0, rationale, List.of());
        }
    }
}
