package me.golemcore.concierge.usage;

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

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Converts token counts into an approximate USD cost.
 *
 * <p>
 * Prices are per token. Unknown models are priced as {@code gpt-4o-mini}.
 */
@Component
public class CostEstimator {

    static final String DEFAULT_MODEL = "gpt-4o-mini";

    private static final Map<String, Price> PRICING = Map.of(
            "gpt-4o-mini", new Price(0.00000015, 0.0000006),
            "gpt-4o", new Price(0.0000025, 0.00001),
            "gpt-4-turbo", new Price(0.00001, 0.00003),
            "gpt-3.5-turbo", new Price(0.0000005, 0.0000015));

    public double estimate(String model, int inputTokens, int outputTokens) {
        Price price = PRICING.get(normalize(model));
        if (price == null) {
            price = PRICING.get(DEFAULT_MODEL);
        }
        return Math.max(0, inputTokens) * price.input() + Math.max(0, outputTokens) * price.output();
    }

    private String normalize(String model) {
        if (model == null) {
            return DEFAULT_MODEL;
        }
        String name = model.toLowerCase(Locale.ROOT);
        int slash = name.lastIndexOf('/');
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    private record Price(double input, double output) {
    }
}
