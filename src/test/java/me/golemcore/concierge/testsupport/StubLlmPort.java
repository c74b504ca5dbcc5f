package me.golemcore.concierge.testsupport;

import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.LlmResponse;
import me.golemcore.concierge.domain.model.LlmUsage;
import me.golemcore.concierge.port.outbound.LlmPort;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Scripted LLM provider. Replies are consumed in order; when the script is
 * empty the fallback function answers.
 */
public class StubLlmPort implements LlmPort {

    private final Deque<String> script = new ArrayDeque<>();
    private final List<LlmRequest> requests = new ArrayList<>();
    private Function<LlmRequest, String> fallback = request -> "";
    private boolean available = true;
    private RuntimeException failure;

    public StubLlmPort reply(String content) {
        script.add(content);
        return this;
    }

    public StubLlmPort answerWith(Function<LlmRequest, String> answer) {
        this.fallback = answer;
        return this;
    }

    public StubLlmPort failWith(RuntimeException error) {
        this.failure = error;
        return this;
    }

    public StubLlmPort unavailable() {
        this.available = false;
        return this;
    }

    public List<LlmRequest> requests() {
        return requests;
    }

    @Override
    public String getProviderId() {
        return "stub";
    }

    @Override
    public synchronized CompletableFuture<LlmResponse> chat(LlmRequest request) {
        requests.add(request);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        String content = script.isEmpty() ? fallback.apply(request) : script.poll();
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(content)
                .model(request.getModel())
                .usage(LlmUsage.of(100, 20))
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "gpt-4o-mini";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }
}
