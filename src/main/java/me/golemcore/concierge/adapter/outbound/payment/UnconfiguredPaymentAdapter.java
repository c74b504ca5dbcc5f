package me.golemcore.concierge.adapter.outbound.payment;

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

import me.golemcore.concierge.port.outbound.PaymentPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Payment adapter used when no payment provider is wired in. Test-mode links
 * do not go through this port.
 */
@Component
public class UnconfiguredPaymentAdapter implements PaymentPort {

    @Override
    public boolean isConfigured() {
        return false;
    }

    @Override
    public CompletableFuture<CheckoutLink> createCheckoutLink(CheckoutRequest request) {
        return CompletableFuture.failedFuture(new IllegalStateException("Payment provider not configured"));
    }
}
