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

import java.text.NumberFormat;
import java.util.Comparator;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Tenant menu used to validate and price takeaway items.
 *
 * @param pricingMode
 *            {@code menu} resolves prices from items, {@code manual} leaves
 *            totals to staff
 */
public record MenuConfig(
        boolean enabled,
        String version,
        String currency,
        String pricingMode,
        boolean allowOffMenuItems,
        String itemNotFoundMessage,
        List<MenuCategory> categories,
        List<MenuItem> items) {

    public static final String PRICING_MENU = "menu";
    public static final String PRICING_MANUAL = "manual";
    public static final String DEFAULT_ITEM_NOT_FOUND = "I couldn't find that item on our menu. "
            + "Could you please check the name or describe what you'd like?";

    private static final Locale DISPLAY_LOCALE = Locale.forLanguageTag("en-AU");

    public static MenuConfig defaults() {
        return new MenuConfig(false, "1.0.0", "AUD", PRICING_MANUAL, true, DEFAULT_ITEM_NOT_FOUND, List.of(),
                List.of());
    }

    public boolean usesMenuPricing() {
        return enabled && PRICING_MENU.equals(pricingMode);
    }

    /**
     * Finds an available item: exact name, exact keyword, partial name, then
     * partial keyword.
     */
    public Optional<MenuItem> findMenuItem(String searchTerm) {
        if (searchTerm == null || searchTerm.isBlank()) {
            return Optional.empty();
        }
        String term = searchTerm.trim().toLowerCase(Locale.ROOT);
        List<Predicate<MenuItem>> matchers = List.of(
                item -> item.name().toLowerCase(Locale.ROOT).equals(term),
                item -> item.keywords().stream().anyMatch(kw -> kw.toLowerCase(Locale.ROOT).equals(term)),
                item -> item.name().toLowerCase(Locale.ROOT).contains(term),
                item -> item.keywords().stream().anyMatch(kw -> kw.toLowerCase(Locale.ROOT).contains(term)));
        for (Predicate<MenuItem> matcher : matchers) {
            Optional<MenuItem> match = items.stream()
                    .filter(MenuItem::available)
                    .filter(matcher)
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Base price plus every selected option. Selections map an option group id
     * to one option id or a list of them.
     */
    public static int calculateItemPrice(MenuItem item, Map<String, Object> selectedOptions) {
        int total = item.priceCents();
        if (selectedOptions == null || selectedOptions.isEmpty()) {
            return total;
        }
        for (OptionGroup group : item.optionGroups()) {
            Object selected = selectedOptions.get(group.id());
            if (selected == null) {
                continue;
            }
            List<?> selectedIds = selected instanceof List<?> list ? list : List.of(selected);
            for (Object optionId : selectedIds) {
                total += group.options().stream()
                        .filter(option -> option.id().equals(String.valueOf(optionId)))
                        .mapToInt(MenuOption::priceCents)
                        .findFirst()
                        .orElse(0);
            }
        }
        return total;
    }

    public static String formatPrice(int priceCents, String currency) {
        NumberFormat format = NumberFormat.getCurrencyInstance(DISPLAY_LOCALE);
        try {
            format.setCurrency(Currency.getInstance(currency));
        } catch (IllegalArgumentException e) {
            format.setCurrency(Currency.getInstance("AUD"));
        }
        return format.format(priceCents / 100.0);
    }

    public String getMenuSummary() {
        if (!enabled || items.isEmpty()) {
            return "No menu available";
        }
        List<String> names = categories.stream()
                .filter(MenuCategory::available)
                .sorted(Comparator.comparingInt(MenuCategory::sortOrder))
                .map(MenuCategory::name)
                .toList();
        return "Menu categories: " + String.join(", ", names);
    }

    public List<MenuItem> getItemsByCategory(String categoryId) {
        return items.stream()
                .filter(item -> item.available() && item.categoryId().equals(categoryId))
                .sorted(Comparator.comparingInt(MenuItem::sortOrder))
                .toList();
    }

    public record MenuCategory(String id, String name, String description, int sortOrder, boolean available) {
    }

    public record MenuItem(
            String id,
            String name,
            String description,
            int priceCents,
            String categoryId,
            boolean available,
            List<String> keywords,
            List<OptionGroup> optionGroups,
            int sortOrder) {
    }

    /**
     * @param type
     *            {@code radio} or {@code checkbox}
     */
    public record OptionGroup(String id, String name, String type, boolean required, List<MenuOption> options,
            String defaultOptionId) {
    }

    public record MenuOption(String id, String name, int priceCents) {
    }
}
