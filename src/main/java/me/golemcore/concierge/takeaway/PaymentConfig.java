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

import java.util.regex.Pattern;

/**
 * Per-tenant payment settings for takeaway orders.
 *
 * @param pricingMode
 *            {@code manual_total_required} or {@code items_with_prices}
 */
public record PaymentConfig(
        boolean enabled,
        boolean testMode,
        boolean requiredByDefault,
        int expiresMinutes,
        boolean allowDisable,
        int maxRetries,
        String currency,
        String productName,
        String pricingMode,
        Messages messages) {

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Za-z]{3}");

    public static final String PRICING_MANUAL = "manual_total_required";
    public static final String PRICING_ITEMS = "items_with_prices";

    public static final Messages DEFAULT_MESSAGES = new Messages(
            "Your order will only be confirmed once payment is completed. "
                    + "Please use the link below to pay securely:\n\n{paymentUrl}\n\n"
                    + "This link expires in {expiresMinutes} minutes.",
            "Payment received! Your order #{orderId} is now confirmed. "
                    + "We'll have it ready for you. Thank you!",
            "Your payment link has expired. Reply YES to request a new payment link.",
            "There was an issue with your payment. Please try again using the link below:\n\n{paymentUrl}",
            "Here's a new payment link:\n\n{paymentUrl}\n\nThis link expires in {expiresMinutes} minutes.",
            "We're having trouble processing your payment. "
                    + "Please call us directly and we'll be happy to help complete your order.");

    public static PaymentConfig defaults() {
        return new PaymentConfig(true, false, true, 10, true, 1, "AUD", "Takeaway order", PRICING_MANUAL,
                DEFAULT_MESSAGES);
    }

    /**
     * Payment is never required when disabled. A per-order override of
     * {@code false} wins only while the tenant allows disabling.
     */
    public boolean isPaymentRequired(Boolean orderOverride) {
        if (!enabled) {
            return false;
        }
        if (allowDisable && Boolean.FALSE.equals(orderOverride)) {
            return false;
        }
        return requiredByDefault;
    }

    /**
     * The first link is attempt zero, so {@code maxRetries=1} permits two links
     * in total.
     */
    public boolean canRetryPayment(int attemptCount) {
        return attemptCount <= maxRetries;
    }

    /**
     * Parses {@code "$45"}, {@code "45.50"} or {@code "$45.00 AUD"} into cents.
     *
     * @return {@code null} for negative or unparsable input
     */
    public static Integer parseAmountToCents(String amount) {
        if (amount == null) {
            return null;
        }
        String cleaned = CURRENCY_CODE.matcher(amount).replaceAll("")
                .replaceAll("[$\u20AC\u00A3\u00A5]", "")
                .replace(",", "")
                .trim();
        try {
            double parsed = Double.parseDouble(cleaned);
            if (Double.isNaN(parsed) || parsed < 0) {
                return null;
            }
            return (int) Math.round(parsed * 100);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public record Messages(
            String pending,
            String paid,
            String expired,
            String failed,
            String retryLinkSent,
            String maxRetriesExceeded) {
    }
}
