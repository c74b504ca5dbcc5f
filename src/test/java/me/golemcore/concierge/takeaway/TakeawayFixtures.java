package me.golemcore.concierge.takeaway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared tenant blobs for takeaway tests.
 */
final class TakeawayFixtures {

    static final ObjectMapper MAPPER = new ObjectMapper();

    static final String MENU_JSON = """
            {
              "enabled": true,
              "currency": "AUD",
              "pricingMode": "menu",
              "allowOffMenuItems": false,
              "categories": [
                {"id": "pizza", "name": "Pizza", "sortOrder": 1},
                {"id": "sides", "name": "Sides", "sortOrder": 2},
                {"id": "drinks", "name": "Drinks", "sortOrder": 3, "available": false}
              ],
              "items": [
                {"id": "m1", "name": "Margherita", "priceCents": 1800, "categoryId": "pizza",
                 "keywords": ["margherita pizza", "marg"],
                 "optionGroups": [{"id": "size", "name": "Size", "type": "radio",
                   "options": [{"id": "large", "name": "Large", "priceCents": 400}]},
                   {"id": "extras", "name": "Extras", "type": "checkbox",
                   "options": [{"id": "olives", "name": "Olives", "priceCents": 150},
                               {"id": "basil", "name": "Basil", "priceCents": 50}]}]},
                {"id": "p1", "name": "Pepperoni", "priceCents": 2100, "categoryId": "pizza", "sortOrder": 2},
                {"id": "g1", "name": "Garlic Bread", "priceCents": 750, "categoryId": "sides",
                 "keywords": ["garlic"]},
                {"id": "c1", "name": "Coke", "priceCents": 400, "categoryId": "drinks", "available": false},
                {"name": "No Id"}
              ]
            }
            """;

    static final String TAKEAWAY_JSON = """
            {"enabled": true, "minNoticeMinutes": 15, "maxItems": 10, "requireName": true,
             "requirePhone": true, "confirmation": {"method": "explicit_yes"}}
            """;

    private TakeawayFixtures() {
    }

    static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    static MenuConfig menu() {
        return TakeawayConfigParser.parseMenu(json(MENU_JSON));
    }

    static TakeawayConfig takeaway() {
        return TakeawayConfigParser.parseTakeaway(json(TAKEAWAY_JSON));
    }
}
