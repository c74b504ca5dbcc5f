package me.golemcore.concierge.domain.service;

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

import me.golemcore.concierge.domain.model.Channel;

import java.util.regex.Pattern;

/**
 * Fits a reply to the delivery channel: formatting rules and length limits.
 *
 * <p>
 * SMS and voice lose all markup; WhatsApp keeps its own bold syntax. Long
 * text is cut at a sentence end when one lies past 70% of the limit, else at
 * a word boundary past 80%, else hard.
 */
public final class ChannelReplyAdapter {

    public static final int SMS_MAX_LENGTH = 1600;
    public static final int WHATSAPP_MAX_LENGTH = 4096;
    public static final int VOICE_MAX_LENGTH = 3000;
    private static final String SUFFIX = "...";

    private static final Pattern HEADERS = Pattern.compile("(?m)^#{1,6}\\s+");
    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*([^*]+)\\*");
    private static final Pattern UNDERLINE_BOLD = Pattern.compile("__([^_]+)__");
    private static final Pattern UNDERLINE_ITALIC = Pattern.compile("_([^_]+)_");
    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)]\\([^)]+\\)");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private ChannelReplyAdapter() {
    }

    public static Adapted adapt(String text, Channel channel) {
        String input = text != null ? text : "";
        if (channel == null) {
            return forSms(input);
        }
        return switch (channel) {
        case SMS -> forSms(input);
        case WHATSAPP -> truncate(toWhatsApp(input), WHATSAPP_MAX_LENGTH, SUFFIX, input.length());
        case VOICE -> truncate(forSpeech(stripFormatting(input)), VOICE_MAX_LENGTH, "", input.length());
        };
    }

    private static Adapted forSms(String input) {
        return truncate(stripFormatting(input), SMS_MAX_LENGTH, SUFFIX, input.length());
    }

    static String stripFormatting(String text) {
        String result = HEADERS.matcher(text).replaceAll("");
        result = BOLD.matcher(result).replaceAll("$1");
        result = ITALIC.matcher(result).replaceAll("$1");
        result = UNDERLINE_BOLD.matcher(result).replaceAll("$1");
        result = UNDERLINE_ITALIC.matcher(result).replaceAll("$1");
        result = CODE_BLOCK.matcher(result).replaceAll("");
        result = INLINE_CODE.matcher(result).replaceAll("$1");
        result = LINK.matcher(result).replaceAll("$1");
        result = HTML_TAG.matcher(result).replaceAll("");
        return BLANK_LINES.matcher(result).replaceAll("\n\n").trim();
    }

    static String toWhatsApp(String text) {
        String result = BOLD.matcher(text).replaceAll("*$1*");
        result = CODE_BLOCK.matcher(result).replaceAll("");
        result = INLINE_CODE.matcher(result).replaceAll("```$1```");
        result = LINK.matcher(result).replaceAll("$1");
        return HEADERS.matcher(result).replaceAll("").trim();
    }

    static String forSpeech(String text) {
        return text
                .replaceAll("(?i)\\bdr\\.", "doctor")
                .replaceAll("(?i)\\bmr\\.", "mister")
                .replaceAll("(?i)\\bmrs\\.", "missus")
                .replaceAll("(?i)\\bms\\.", "miss")
                .replaceAll("(?i)\\bst\\.", "street")
                .replaceAll("(?i)\\bave\\.", "avenue")
                .replaceAll("(?i)\\bblvd\\.", "boulevard")
                .replaceAll(",\\s*", ", ")
                .replaceAll("[#@&*~`]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    static Adapted truncate(String text, int maxLength, String suffix, int originalLength) {
        if (text.length() <= maxLength) {
            return new Adapted(text, false, originalLength);
        }
        int limit = maxLength - suffix.length();
        String cut = text.substring(0, limit);

        int lastSentence = cut.lastIndexOf(". ");
        if (lastSentence > limit * 0.7) {
            return new Adapted(cut.substring(0, lastSentence + 1) + suffix, true, originalLength);
        }
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > limit * 0.8) {
            return new Adapted(cut.substring(0, lastSpace) + suffix, true, originalLength);
        }
        return new Adapted(cut + suffix, true, originalLength);
    }

    public record Adapted(String text, boolean truncated, int originalLength) {
    }
}
