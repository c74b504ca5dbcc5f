package me.golemcore.concierge.infrastructure.resilience;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.exception.ExternalCallException;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external collaborators (LLM, payment, notification, calendar)
 * with an explicit timeout and a small bounded retry count with exponential
 * backoff.
 *
 * <p>
 * Every failure mode ends in an {@link ExternalCallException} so callers can
 * map it to a defined fallback instead of propagating a raw provider error.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalCallExecutor {

    private final ConciergeProperties properties;

    /**
     * Executes the call, retrying on timeouts and provider errors.
     *
     * @param operation
     *            short name used in logs and errors (e.g. {@code llm.classify})
     * @param call
     *            supplier that starts one attempt
     * @return the value of the first successful attempt
     * @throws ExternalCallException
     *             when all attempts failed or the thread was interrupted
     */
    public <T> T call(String operation, Supplier<CompletableFuture<T>> call) {
        ConciergeProperties.ResilienceProperties config = properties.getResilience();
        int maxRetries = Math.max(0, config.getMaxRetries());
        Throwable lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            CompletableFuture<T> future = null;
            try {
                future = call.get();
                return future.get(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExternalCallException(operation, operation + " interrupted", e);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = e;
                log.warn("[External] {} timed out after {}ms (attempt {}/{})",
                        operation, config.getTimeoutMs(), attempt + 1, maxRetries + 1);
            } catch (ExecutionException | CompletionException e) {
                lastError = e.getCause() != null ? e.getCause() : e;
                log.warn("[External] {} failed (attempt {}/{}): {}",
                        operation, attempt + 1, maxRetries + 1, lastError.getMessage());
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("[External] {} failed before dispatch (attempt {}/{}): {}",
                        operation, attempt + 1, maxRetries + 1, e.getMessage());
            }

            if (!isRetryable(lastError)) {
                break;
            }
            if (attempt < maxRetries) {
                sleepBeforeRetry(operation, config, attempt);
            }
        }

        String reason = lastError != null ? lastError.getMessage() : "unknown error";
        throw new ExternalCallException(operation, operation + " failed: " + reason, lastError);
    }

    private boolean isRetryable(Throwable error) {
        return !(error instanceof IllegalArgumentException)
                && !(error instanceof UnsupportedOperationException);
    }

    private void sleepBeforeRetry(String operation, ConciergeProperties.ResilienceProperties config,
            int attempt) {
        long backoffMs = (long) (config.getInitialBackoffMs() * Math.pow(config.getBackoffMultiplier(), attempt));
        if (backoffMs <= 0) {
            return;
        }
        log.debug("[External] Retrying {} in {}ms", operation, backoffMs);
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException(operation, operation + " interrupted during retry backoff", ie);
        }
    }
}
