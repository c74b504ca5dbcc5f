package me.golemcore.concierge.module.builtin;

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
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects a callback name and phone number over two turns.
 *
 * <p>
 * The first turn asks for the details and sets {@code collectingContact}. The
 * next turn extracts a phone number and a capitalized name; when neither is
 * found the customer is asked again and the flag stays set.
 */
@Component
@RequiredArgsConstructor
public class CollectContactModule implements ModuleHandler {

    static final String PROMPT_REPLY = "Sure, I'd be happy to arrange a callback. "
            + "Could you please provide your name and phone number?";
    static final String CONFIRM_REPLY = "Thank you! I've noted your contact details. "
            + "Someone from our team will reach out to you shortly.";
    static final String RETRY_REPLY = "I didn't quite catch that. Could you please provide your name and phone number?";

    private static final Pattern PHONE_PATTERN = Pattern.compile("(?:\\+?61|0)[0-9\\s-]{8,12}");
    private static final Pattern NAME_WORD_PATTERN = Pattern.compile("^[A-Z][a-z]+$");
    private static final Set<String> NOT_NAMES = Set.of(
            "My", "The", "Please", "Call", "Phone", "Name", "Number", "Yes", "No", "Thanks", "Hi", "Hello", "It's",
            "Is", "I'm");

    private final Clock clock;

    @Override
    public String getName() {
        return "collect_contact";
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        if (!context.metadataFlag("collectingContact")) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put("collectingContact", true);
            return ModuleResult.reply(PROMPT_REPLY, updates);
        }

        Contact contact = extractContact(context.getUserText());
        if (contact.phone() == null && contact.name() == null) {
            return ModuleResult.reply(RETRY_REPLY);
        }

        Map<String, Object> updates = ModuleResult.updates();
        updates.put("collectingContact", false);
        updates.put("collectedName", contact.name() != null ? contact.name() : context.metadata("collectedName"));
        updates.put("collectedPhone",
                contact.phone() != null ? contact.phone() : context.metadata("collectedPhone"));
        updates.put("contactCollectedAt", clock.instant().toString());
        return ModuleResult.reply(CONFIRM_REPLY, updates);
    }

    static Contact extractContact(String text) {
        if (text == null || text.isBlank()) {
            return new Contact(null, null);
        }

        String phone = null;
        Matcher phoneMatcher = PHONE_PATTERN.matcher(text);
        if (phoneMatcher.find()) {
            phone = phoneMatcher.group().replaceAll("[\\s-]", "");
        }

        List<String> nameWords = new ArrayList<>();
        for (String word : text.split("\\s+")) {
            String cleaned = word.replaceAll("[,.;:!?]+$", "");
            if (cleaned.length() > 1 && NAME_WORD_PATTERN.matcher(cleaned).matches() && !NOT_NAMES.contains(cleaned)) {
                nameWords.add(cleaned);
                if (nameWords.size() == 2) {
                    break;
                }
            }
        }
        String name = nameWords.isEmpty() ? null : String.join(" ", nameWords);
        return new Contact(name, phone);
    }

    record Contact(String name, String phone) {
    }
}
