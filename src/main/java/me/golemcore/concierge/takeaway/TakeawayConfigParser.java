package me.golemcore.concierge.takeaway;

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
import me.golemcore.concierge.domain.model.PickupMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Parses the takeaway, payment and menu blobs of a tenant.
 *
 * <p>
 * None of the parse methods throws. A missing or mistyped field takes its
 * default; list entries without an id or a name are dropped.
 */
public final class TakeawayConfigParser {

    private TakeawayConfigParser() {
    }

    public static TakeawayConfig parseTakeaway(JsonNode node) {
        TakeawayConfig defaults = TakeawayConfig.defaults();
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new TakeawayConfig(
                bool(node, "enabled", defaults.enabled()),
                "time".equals(node.path("defaultPickupMode").asText(null)) ? PickupMode.TIME : PickupMode.ASAP,
                positiveInt(node, "minNoticeMinutes", defaults.minNoticeMinutes()),
                positiveInt(node, "maxItems", defaults.maxItems()),
                positiveInt(node, "maxClarificationQuestions", defaults.maxClarificationQuestions()),
                bool(node, "requireName", defaults.requireName()),
                bool(node, "requirePhone", defaults.requirePhone()),
                positiveInt(node, "defaultQuantity", defaults.defaultQuantity()),
                parseConfirmation(node.get("confirmation")),
                parseNotifications(node.get("notifications")),
                node.path("draft").isObject()
                        ? positiveInt(node.get("draft"), "expireMinutes", defaults.draftExpireMinutes())
                        : defaults.draftExpireMinutes(),
                parseTemplates(node.get("templates")));
    }

    public static PaymentConfig parsePayment(JsonNode node) {
        PaymentConfig defaults = PaymentConfig.defaults();
        if (node == null || !node.isObject()) {
            return defaults;
        }
        String currency = node.path("currency").isTextual() && node.get("currency").asText().length() == 3
                ? node.get("currency").asText().toUpperCase(Locale.ROOT)
                : defaults.currency();
        String productName = text(node, "productName");
        return new PaymentConfig(
                bool(node, "enabled", defaults.enabled()),
                bool(node, "testMode", defaults.testMode()),
                bool(node, "requiredByDefault", defaults.requiredByDefault()),
                positiveInt(node, "expiresMinutes", defaults.expiresMinutes()),
                bool(node, "allowDisable", defaults.allowDisable()),
                node.path("retry").isObject()
                        ? positiveInt(node.get("retry"), "maxRetries", defaults.maxRetries())
                        : defaults.maxRetries(),
                currency,
                productName != null && !productName.isBlank() ? productName.trim() : defaults.productName(),
                PaymentConfig.PRICING_ITEMS.equals(text(node, "pricingMode"))
                        ? PaymentConfig.PRICING_ITEMS
                        : PaymentConfig.PRICING_MANUAL,
                parsePaymentMessages(node.get("messages")));
    }

    public static MenuConfig parseMenu(JsonNode node) {
        MenuConfig defaults = MenuConfig.defaults();
        if (node == null || !node.isObject()) {
            return defaults;
        }
        String pricingMode = text(node, "pricingMode");
        return new MenuConfig(
                bool(node, "enabled", defaults.enabled()),
                textOr(node, "version", defaults.version()),
                textOr(node, "currency", defaults.currency()),
                MenuConfig.PRICING_MENU.equals(pricingMode) || MenuConfig.PRICING_MANUAL.equals(pricingMode)
                        ? pricingMode
                        : defaults.pricingMode(),
                bool(node, "allowOffMenuItems", defaults.allowOffMenuItems()),
                textOr(node, "itemNotFoundMessage", defaults.itemNotFoundMessage()),
                objects(node.get("categories"), TakeawayConfigParser::parseCategory),
                objects(node.get("items"), TakeawayConfigParser::parseItem));
    }

    // ==================== nested blobs ====================

    private static TakeawayConfig.Confirmation parseConfirmation(JsonNode node) {
        TakeawayConfig.Confirmation defaults = TakeawayConfig.DEFAULT_CONFIRMATION;
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new TakeawayConfig.Confirmation(
                "implicit".equals(text(node, "method")) ? "implicit" : "explicit_yes",
                stringList(node.get("yesWords"), defaults.yesWords()),
                stringList(node.get("noWords"), defaults.noWords()),
                positiveInt(node, "expiresMinutes", defaults.expiresMinutes()));
    }

    private static TakeawayConfig.Notifications parseNotifications(JsonNode node) {
        TakeawayConfig.Notifications defaults = TakeawayConfig.DEFAULT_NOTIFICATIONS;
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new TakeawayConfig.Notifications(
                bool(node, "notifyBySms", defaults.notifyBySms()),
                bool(node, "notifyByWhatsApp", defaults.notifyByWhatsApp()),
                text(node, "notifyTo"));
    }

    private static TakeawayConfig.Templates parseTemplates(JsonNode node) {
        TakeawayConfig.Templates defaults = TakeawayConfig.DEFAULT_TEMPLATES;
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new TakeawayConfig.Templates(
                textOr(node, "customerConfirmationText", defaults.customerConfirmationText()),
                textOr(node, "customerNeedConfirmationText", defaults.customerNeedConfirmationText()),
                textOr(node, "customerExpiredText", defaults.customerExpiredText()),
                textOr(node, "customerClarificationText", defaults.customerClarificationText()),
                textOr(node, "customerCanceledText", defaults.customerCanceledText()),
                textOr(node, "businessNotificationText", defaults.businessNotificationText()));
    }

    private static PaymentConfig.Messages parsePaymentMessages(JsonNode node) {
        PaymentConfig.Messages defaults = PaymentConfig.DEFAULT_MESSAGES;
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new PaymentConfig.Messages(
                textOr(node, "pending", defaults.pending()),
                textOr(node, "paid", defaults.paid()),
                textOr(node, "expired", defaults.expired()),
                textOr(node, "failed", defaults.failed()),
                textOr(node, "retryLinkSent", defaults.retryLinkSent()),
                textOr(node, "maxRetriesExceeded", defaults.maxRetriesExceeded()));
    }

    private static MenuConfig.MenuCategory parseCategory(JsonNode node) {
        String id = node.path("id").asText("");
        String name = node.path("name").asText("");
        if (id.isEmpty() || name.isEmpty()) {
            return null;
        }
        return new MenuConfig.MenuCategory(id, name, text(node, "description"),
                node.path("sortOrder").isNumber() ? node.get("sortOrder").asInt() : 0,
                bool(node, "available", true));
    }

    private static MenuConfig.MenuItem parseItem(JsonNode node) {
        String id = node.path("id").asText("");
        String name = node.path("name").asText("");
        if (id.isEmpty() || name.isEmpty()) {
            return null;
        }
        return new MenuConfig.MenuItem(id, name, text(node, "description"),
                node.path("priceCents").isNumber() ? node.get("priceCents").asInt() : 0,
                node.path("categoryId").asText(""),
                bool(node, "available", true),
                stringList(node.get("keywords"), List.of()),
                objects(node.get("optionGroups"), TakeawayConfigParser::parseOptionGroup),
                node.path("sortOrder").isNumber() ? node.get("sortOrder").asInt() : 0);
    }

    private static MenuConfig.OptionGroup parseOptionGroup(JsonNode node) {
        String id = node.path("id").asText("");
        String name = node.path("name").asText("");
        List<MenuConfig.MenuOption> options = objects(node.get("options"), option -> {
            String optionId = option.path("id").asText("");
            String optionName = option.path("name").asText("");
            if (optionId.isEmpty() || optionName.isEmpty()) {
                return null;
            }
            return new MenuConfig.MenuOption(optionId, optionName,
                    option.path("priceCents").isNumber() ? option.get("priceCents").asInt() : 0);
        });
        if (id.isEmpty() || name.isEmpty() || options.isEmpty()) {
            return null;
        }
        return new MenuConfig.OptionGroup(id, name,
                "checkbox".equals(text(node, "type")) ? "checkbox" : "radio",
                bool(node, "required", false), options, text(node, "defaultOptionId"));
    }

    // ==================== primitives ====================

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : fallback;
    }

    private static int positiveInt(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value != null && value.isIntegralNumber() && value.asInt() > 0) {
            return value.asInt();
        }
        return fallback;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value != null ? value : fallback;
    }

    private static List<String> stringList(JsonNode node, List<String> fallback) {
        if (node == null || !node.isArray()) {
            return fallback;
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> {
            if (element.isTextual()) {
                values.add(element.asText());
            }
        });
        return values.isEmpty() ? fallback : List.copyOf(values);
    }

    private static <T> List<T> objects(JsonNode node, Function<JsonNode, T> mapper) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<T> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isObject()) {
                continue;
            }
            T value = mapper.apply(element);
            if (value != null) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }
}
