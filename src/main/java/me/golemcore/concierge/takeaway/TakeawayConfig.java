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

import me.golemcore.concierge.domain.model.PickupMode;

import java.util.List;
import java.util.Locale;

/**
 * Per-tenant takeaway ordering settings. Produced by
 * {@link TakeawayConfigParser#parseTakeaway}; every field carries a default.
 */
public record TakeawayConfig(
        boolean enabled,
        PickupMode defaultPickupMode,
        int minNoticeMinutes,
        int maxItems,
        int maxClarificationQuestions,
        boolean requireName,
        boolean requirePhone,
        int defaultQuantity,
        Confirmation confirmation,
        Notifications notifications,
        int draftExpireMinutes,
        Templates templates) {

    public static final Confirmation DEFAULT_CONFIRMATION = new Confirmation(
            "explicit_yes",
            List.of("YES", "Y", "CONFIRM", "OK", "YEP", "YEAH"),
            List.of("NO", "N", "CANCEL", "NEVERMIND", "STOP"),
            10);

    public static final Notifications DEFAULT_NOTIFICATIONS = new Notifications(true, false, null);

    public static final Templates DEFAULT_TEMPLATES = new Templates(
            "Thanks! Your order has been received and we're preparing it now. "
                    + "Order #{orderId}\nPickup: {pickupTime}\nWe'll have it ready for you!",
            "Here's your order summary:\n\n{orderSummary}\n\nPickup: {pickupTime}\n\n"
                    + "Reply YES to confirm or NO to cancel.",
            "Your order has expired. Please start a new order when you're ready.",
            "I'm not sure I understood that. Could you please clarify: {question}",
            "Your order has been canceled. Let us know if you'd like to start a new order.",
            "NEW ORDER #{orderId}\nCustomer: {customerName} ({customerPhone})\nPickup: {pickupTime}\n"
                    + "Items:\n{itemsList}\n{notes}");

    public static TakeawayConfig defaults() {
        return new TakeawayConfig(false, PickupMode.ASAP, 20, 30, 3, true, true, 1,
                DEFAULT_CONFIRMATION, DEFAULT_NOTIFICATIONS, 30, DEFAULT_TEMPLATES);
    }

    /**
     * Exact, case-insensitive match of the whole trimmed reply against the yes
     * words. Free text never counts as a confirmation.
     */
    public boolean isConfirmationYes(String text) {
        return matchesAny(text, confirmation.yesWords());
    }

    public boolean isConfirmationNo(String text) {
        return matchesAny(text, confirmation.noWords());
    }

    private static boolean matchesAny(String text, List<String> words) {
        if (text == null) {
            return false;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        return words.stream().anyMatch(word -> normalized.equals(word.toUpperCase(Locale.ROOT)));
    }

    /**
     * @param method
     *            {@code explicit_yes} or {@code implicit}
     */
    public record Confirmation(String method, List<String> yesWords, List<String> noWords, int expiresMinutes) {
    }

    /**
     * Where new-order alerts for the business go. {@code notifyTo} falls back to
     * the tenant's handoff SMS number when absent.
     */
    public record Notifications(boolean notifyBySms, boolean notifyByWhatsApp, String notifyTo) {
    }

    public record Templates(
            String customerConfirmationText,
            String customerNeedConfirmationText,
            String customerExpiredText,
            String customerClarificationText,
            String customerCanceledText,
            String businessNotificationText) {
    }
}
