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

import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.PickupMode;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts order items, a customer name and a pickup time from free text.
 *
 * <p>
 * Items are matched against the menu by name or keyword, longest term first.
 * The quantity comes from the words right before a mention ("two margherita",
 * "3 x garlic bread"). Quantified mentions that match no menu item are
 * off-menu: kept without a price when the menu allows it, otherwise reported
 * as rejected.
 */
public final class OrderTextParser {

    private static final Map<String, Integer> NUMERALS = Map.ofEntries(
            Map.entry("a", 1), Map.entry("an", 1), Map.entry("one", 1), Map.entry("single", 1),
            Map.entry("two", 2), Map.entry("couple", 2), Map.entry("pair", 2), Map.entry("three", 3),
            Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7),
            Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11),
            Map.entry("twelve", 12), Map.entry("dozen", 12));

    private static final int QUANTITY_LOOKBACK_WORDS = 3;
    private static final Pattern WORD = Pattern.compile("[a-z0-9']+");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,2}x?");
    private static final Pattern SEGMENT_SPLIT = Pattern.compile(",|;|\\n|\\band\\b|\\bplus\\b|\\balso\\b");
    private static final Pattern LEADING_FILLER = Pattern.compile(
            "^(?:(?:i|i'd|i'll|we|we'd|can|could|may|would|please|just|to|get|me|us|like|want|have|"
                    + "order|add|also|and|with|some)\\s+)+");
    private static final Pattern QUANTIFIED_SEGMENT = Pattern.compile(
            "^(\\d{1,2}|" + String.join("|", NUMERALS.keySet()) + ")(?:\\s*x)?\\s+(?:of\\s+)?([a-z][a-z '-]*?)"
                    + "(?:\\s+please)?$");

    private static final Pattern NAME_PHRASE = Pattern.compile(
            "(?i)\\b(?:my name is|my name's|name is|name's|call me|under the name(?: of)?)\\s+"
                    + "([a-z][a-z'-]*(?:\\s+[a-z][a-z'-]*)?)");
    private static final Pattern PLAIN_NAME = Pattern.compile("(?i)^[a-z][a-z'-]*(?:\\s+[a-z][a-z'-]*){0,2}$");
    private static final List<String> NOT_A_NAME = List.of("yes", "no", "ok", "okay", "asap", "thanks",
            "thank you", "hello", "hi", "cancel", "stop");

    private static final Pattern ASAP = Pattern.compile("(?i)\\b(?:asap|as soon as possible|right away|now)\\b");
    private static final Pattern PICKUP_TIME = Pattern.compile(
            "(?i)\\b(?:(at|for|around|by)\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?"
                    + "|(\\d{1,2}):(\\d{2})\\s*(am|pm)?|(\\d{1,2})\\s*(am|pm))\\b");

    private OrderTextParser() {
    }

    public static ParsedOrder parse(String text, MenuConfig menu, int defaultQuantity) {
        if (text == null || text.isBlank()) {
            return new ParsedOrder(List.of(), List.of(), null, null, null);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<OrderItem> items = new ArrayList<>();
        List<String> rejected = new ArrayList<>();

        String remainder = lower;
        if (menu != null && menu.enabled()) {
            remainder = matchMenuItems(lower, menu, defaultQuantity, items);
        }
        for (OrderItem offMenu : parseQuantifiedSegments(remainder)) {
            if (menu != null && menu.enabled() && !menu.allowOffMenuItems()) {
                rejected.add(offMenu.getName());
            } else {
                items.add(offMenu);
            }
        }

        return new ParsedOrder(items, rejected, extractName(text, false), extractPickupMode(text),
                extractPickupTime(text));
    }

    /**
     * Finds the customer's name. With {@code awaitingName} a short reply made
     * of words only is taken as the name itself.
     */
    public static String extractName(String text, boolean awaitingName) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = NAME_PHRASE.matcher(text);
        if (matcher.find()) {
            return capitalize(matcher.group(1));
        }
        String trimmed = text.trim().replaceAll("[.!]+$", "");
        if (awaitingName && PLAIN_NAME.matcher(trimmed).matches()
                && !NOT_A_NAME.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return capitalize(trimmed);
        }
        return null;
    }

    public static PickupMode extractPickupMode(String text) {
        if (text == null) {
            return null;
        }
        if (ASAP.matcher(text).find()) {
            return PickupMode.ASAP;
        }
        return extractPickupTime(text) != null ? PickupMode.TIME : null;
    }

    /**
     * Clock time mentioned in the text. An hour without am/pm below 11 is read
     * as an afternoon or evening time.
     */
    public static LocalTime extractPickupTime(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = PICKUP_TIME.matcher(text);
        while (matcher.find()) {
            String hour = firstNonNull(matcher.group(2), matcher.group(5), matcher.group(8));
            String minute = firstNonNull(matcher.group(3), matcher.group(6));
            String meridiem = firstNonNull(matcher.group(4), matcher.group(7), matcher.group(9));
            if ("for".equalsIgnoreCase(matcher.group(1)) && minute == null && meridiem == null) {
                // "for 2" is a quantity, not a time
                continue;
            }
            int h = Integer.parseInt(hour);
            int m = minute != null ? Integer.parseInt(minute) : 0;
            if (h > 23 || m > 59) {
                continue;
            }
            if (meridiem != null) {
                boolean pm = meridiem.equalsIgnoreCase("pm");
                if (h > 12 || h == 0) {
                    continue;
                }
                h = pm ? (h % 12) + 12 : h % 12;
            } else if (h < 11) {
                h += 12;
            }
            return LocalTime.of(h, m);
        }
        return null;
    }

    // ==================== items ====================

    private static String matchMenuItems(String lower, MenuConfig menu, int defaultQuantity,
            List<OrderItem> items) {
        List<Term> terms = new ArrayList<>();
        for (MenuConfig.MenuItem item : menu.items()) {
            if (!item.available()) {
                continue;
            }
            terms.add(new Term(item.name().toLowerCase(Locale.ROOT), item));
            item.keywords().forEach(keyword -> terms.add(new Term(keyword.toLowerCase(Locale.ROOT), item)));
        }
        terms.sort(Comparator.comparingInt((Term term) -> term.text().length()).reversed());

        boolean[] consumed = new boolean[lower.length()];
        List<Mention> mentions = new ArrayList<>();
        for (Term term : terms) {
            if (term.text().isBlank()) {
                continue;
            }
            Matcher matcher = Pattern.compile("\\b" + Pattern.quote(term.text()) + "(?:e?s)?\\b").matcher(lower);
            while (matcher.find()) {
                if (overlaps(consumed, matcher.start(), matcher.end())) {
                    continue;
                }
                for (int i = matcher.start(); i < matcher.end(); i++) {
                    consumed[i] = true;
                }
                mentions.add(new Mention(matcher.start(), matcher.end(), term.item()));
            }
        }
        mentions.sort(Comparator.comparingInt(Mention::start));

        StringBuilder remainder = new StringBuilder();
        int previousEnd = 0;
        for (Mention mention : mentions) {
            String before = lower.substring(previousEnd, mention.start());
            QuantityMatch quantity = quantityBefore(before);
            int qty = quantity != null ? quantity.value() : defaultQuantity;
            remainder.append(quantity != null ? before.substring(0, quantity.wordStart()) : before).append(' ');
            items.add(OrderItem.builder()
                    .menuItemId(mention.item().id())
                    .name(mention.item().name())
                    .quantity(qty)
                    .unitPriceCents(menu.usesMenuPricing() ? mention.item().priceCents() : null)
                    .build());
            previousEnd = mention.end();
        }
        remainder.append(lower.substring(previousEnd));
        return remainder.toString();
    }

    private static QuantityMatch quantityBefore(String before) {
        Matcher matcher = WORD.matcher(before);
        List<int[]> spans = new ArrayList<>();
        while (matcher.find()) {
            spans.add(new int[] {matcher.start(), matcher.end()});
        }
        int checked = 0;
        for (int i = spans.size() - 1; i >= 0 && checked < QUANTITY_LOOKBACK_WORDS; i--, checked++) {
            String word = before.substring(spans.get(i)[0], spans.get(i)[1]);
            Integer value = quantityOf(word);
            if (value != null) {
                return new QuantityMatch(value, spans.get(i)[0]);
            }
            if (!word.equals("x") && !word.equals("of") && !word.equals("more") && !word.equals("extra")) {
                break;
            }
        }
        return null;
    }

    private static Integer quantityOf(String word) {
        if (DIGITS.matcher(word).matches()) {
            int value = Integer.parseInt(word.endsWith("x") ? word.substring(0, word.length() - 1) : word);
            return value > 0 ? value : null;
        }
        return NUMERALS.get(word);
    }

    private static List<OrderItem> parseQuantifiedSegments(String text) {
        List<OrderItem> items = new ArrayList<>();
        for (String rawSegment : SEGMENT_SPLIT.split(text)) {
            String segment = rawSegment.replaceAll("[^a-z0-9' -]", " ").replaceAll("\\s+", " ").trim();
            segment = LEADING_FILLER.matcher(segment).replaceFirst("");
            Matcher matcher = QUANTIFIED_SEGMENT.matcher(segment);
            if (!matcher.matches()) {
                continue;
            }
            String name = matcher.group(2).trim();
            if (name.length() < 2 || NUMERALS.containsKey(name)) {
                continue;
            }
            Integer quantity = quantityOf(matcher.group(1));
            items.add(OrderItem.builder()
                    .name(name)
                    .quantity(quantity != null ? quantity : 1)
                    .build());
        }
        return items;
    }

    private static boolean overlaps(boolean[] consumed, int start, int end) {
        for (int i = start; i < end; i++) {
            if (consumed[i]) {
                return true;
            }
        }
        return false;
    }

    private static String capitalize(String value) {
        StringBuilder sb = new StringBuilder();
        for (String part : value.trim().split("\\s+")) {
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private record Term(String text, MenuConfig.MenuItem item) {
    }

    private record Mention(int start, int end, MenuConfig.MenuItem item) {
    }

    private record QuantityMatch(int value, int wordStart) {
    }

    /**
     * @param rejected
     *            off-menu item names refused by the menu
     */
    public record ParsedOrder(List<OrderItem> items, List<String> rejected, String customerName,
            PickupMode pickupMode, LocalTime pickupTime) {

        public boolean hasItems() {
            return !items.isEmpty();
        }
    }
}
