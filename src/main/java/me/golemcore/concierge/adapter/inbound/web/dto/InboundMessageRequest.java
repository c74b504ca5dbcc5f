package me.golemcore.concierge.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request body for {@code POST /api/inbound/message}, posted by channel
 * webhooks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessageRequest {

    /** Tenant the message was addressed to. Required. */
    private String tenantId;

    /** {@code sms}, {@code whatsapp} or {@code voice}. Defaults to sms. */
    private String channel;

    /** Sender phone number or identifier. Required. */
    private String contactKey;

    /** Message text or voice transcript. Required. */
    private String text;

    /** Provider thread or call id. */
    private String externalThreadKey;

    /** Provider payload stored with the turn. */
    @Builder.Default
    private Map<String, Object> raw = new HashMap<>();
}
