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

import java.util.Map;

/**
 * Substitutes {@code {placeholder}} tokens in tenant message templates.
 */
public final class TemplateRenderer {

    private TemplateRenderer() {
    }

    /**
     * Replaces every given variable; a {@code null} value renders as empty.
     * Placeholders without a variable are left in place. The result is trimmed.
     */
    public static String render(String template, Map<String, ?> variables) {
        if (template == null) {
            return "";
        }
        String result = template;
        for (Map.Entry<String, ?> entry : variables.entrySet()) {
            Object value = entry.getValue();
            result = result.replace("{" + entry.getKey() + "}", value != null ? value.toString() : "");
        }
        return result.trim();
    }
}
