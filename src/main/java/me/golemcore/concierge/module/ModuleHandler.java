package me.golemcore.concierge.module;

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

import java.util.List;

/**
 * A named conversation capability the engine can dispatch to.
 *
 * <p>
 * Handlers are Spring beans collected by {@link ModuleRegistry}. A handler
 * reads only its {@link ModuleContext} and reports session state changes
 * through {@link ModuleResult#getSessionMetadataUpdates()}; it never writes
 * session storage itself. Returning a result without reply text lets the next
 * candidate module try.
 *
 * @since 1.0
 * @see ModuleRunner
 */
public interface ModuleHandler {

    /**
     * Unique registry name, e.g. {@code faq} or {@code takeaway-order}.
     */
    String getName();

    /**
     * Additional names routed to this handler.
     */
    default List<String> getAliases() {
        return List.of();
    }

    ModuleResult handle(ModuleContext context);
}
