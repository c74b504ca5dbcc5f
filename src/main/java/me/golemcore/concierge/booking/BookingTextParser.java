package me.golemcore.concierge.booking;

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

import me.golemcore.concierge.takeaway.OrderTextParser;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls booking details out of a free-text message.
 *
 * <p>
 * Dates are read relative to {@code now} in the booking time zone: today,
 * tonight, tomorrow, a weekday name, {@code 12 March} or {@code 12/3}
 * (day first). A time without a date means today, or tomorrow once today's
 * slot has passed. A date without a time yields no date-time at all.
 */
public final class BookingTextParser {

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
            Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8),
            Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11), Map.entry("twelve", 12));
    private static final String NUMBER = "(\\d{1,3}|" + String.join("|", NUMBER_WORDS.keySet()) + ")";

    private static final Pattern PARTY_NOUN = Pattern.compile(
            "(?i)\\b" + NUMBER + "\\s+(?:people|persons|guests|adults|pax|of us)\\b");
    private static final Pattern PARTY_PHRASE = Pattern.compile(
            "(?i)\\b(?:party of|group of|table for|for)\\s+" + NUMBER + "\\b(?!\\s*(?:am|pm|:|\\.\\d))");
    private static final Pattern PHONE = Pattern.compile("(?<![\\d+])(\\+?\\d[\\d\\s-]{7,14}\\d)(?!\\d)");
    private static final Pattern RELATIVE_DAY = Pattern.compile("(?i)\\b(today|tonight|tomorrow)\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "(?i)\\b(next\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "(?i)\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?"
                    + "(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\b");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2,4}))?\\b");
    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private BookingTextParser() {
    }

    public static BookingRequest parse(String text, ZoneId zone, Instant now) {
        if (text == null || text.isBlank()) {
            return BookingRequest.empty();
        }
        return new BookingRequest(
                null,
                extractDateTime(text, zone, now),
                extractPartySize(text),
                OrderTextParser.extractName(text, false),
                extractPhone(text),
                null,
                null);
    }

    public static Integer extractPartySize(String text) {
        if (text == null) {
            return null;
        }
        Matcher noun = PARTY_NOUN.matcher(text);
        if (noun.find()) {
            return toNumber(noun.group(1));
        }
        Matcher phrase = PARTY_PHRASE.matcher(text);
        if (phrase.find()) {
            return toNumber(phrase.group(1));
        }
        return null;
    }

    public static String extractPhone(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = PHONE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String phone = matcher.group(1).replaceAll("[\\s-]", "");
        return phone.replace("+", "").length() >= 8 ? phone : null;
    }

    public static Instant extractDateTime(String text, ZoneId zone, Instant now) {
        if (text == null) {
            return null;
        }
        // the time parser must not see the date digits
        String withoutDates = NUMERIC_DATE.matcher(DAY_MONTH.matcher(text).replaceAll(" ")).replaceAll(" ");
        LocalTime time = OrderTextParser.extractPickupTime(withoutDates);
        if (time == null) {
            return null;
        }
        LocalDate today = now.atZone(zone).toLocalDate();
        LocalDate date = extractDate(text, today);
        if (date == null) {
            Instant candidate = today.atTime(time).atZone(zone).toInstant();
            return candidate.isBefore(now) ? today.plusDays(1).atTime(time).atZone(zone).toInstant() : candidate;
        }
        return date.atTime(time).atZone(zone).toInstant();
    }

    static LocalDate extractDate(String text, LocalDate today) {
        Matcher relative = RELATIVE_DAY.matcher(text);
        if (relative.find()) {
            return "tomorrow".equalsIgnoreCase(relative.group(1)) ? today.plusDays(1) : today;
        }
        Matcher weekday = WEEKDAY.matcher(text);
        if (weekday.find()) {
            DayOfWeek day = DayOfWeek.valueOf(weekday.group(2).toUpperCase(Locale.ROOT));
            return weekday.group(1) != null
                    ? today.with(TemporalAdjusters.next(day))
                    : today.with(TemporalAdjusters.nextOrSame(day));
        }
        Matcher dayMonth = DAY_MONTH.matcher(text);
        if (dayMonth.find()) {
            return upcoming(today, Integer.parseInt(dayMonth.group(1)),
                    MONTHS.get(dayMonth.group(2).toLowerCase(Locale.ROOT)), null);
        }
        Matcher numeric = NUMERIC_DATE.matcher(text);
        if (numeric.find()) {
            Integer year = numeric.group(3) != null ? Integer.parseInt(numeric.group(3)) : null;
            if (year != null && year < 100) {
                year += 2000;
            }
            return upcoming(today, Integer.parseInt(numeric.group(1)), Integer.parseInt(numeric.group(2)), year);
        }
        return null;
    }

    private static LocalDate upcoming(LocalDate today, int day, int month, Integer year) {
        try {
            if (year != null) {
                return LocalDate.of(year, month, day);
            }
            LocalDate candidate = LocalDate.of(today.getYear(), month, day);
            return candidate.isBefore(today) ? candidate.plusYears(1) : candidate;
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static Integer toNumber(String token) {
        Integer word = NUMBER_WORDS.get(token.toLowerCase(Locale.ROOT));
        return word != null ? word : Integer.valueOf(token);
    }
}
