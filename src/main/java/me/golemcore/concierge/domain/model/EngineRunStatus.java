package me.golemcore.concierge.domain.model;

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

/**
 * Outcome of one pipeline invocation as recorded in the run log.
 */
public enum EngineRunStatus {

    SUCCESS("success"), HANDOFF("handoff"), BLOCKED("blocked"), ERROR("error");

    private final String value;

    EngineRunStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
