package com.github.salilvnair.commandconsole.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.commandconsole.config.CommandConsoleInferenceConfig;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.llm.core.LlmClient;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asks the inference service for a structured intent. Every failure surfaces as a
 * {@link CommandConsoleException} with an INFERENCE_* code for the fallback chain to absorb.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InferenceIntentNormalizer implements IntentNormalizer {

    private final ObjectProvider<LlmClient> llmClientProvider;
    private final CommandConsoleInferenceConfig inferenceConfig;
    private final IntentPromptRenderer promptRenderer;
    private final IntentPayloadParser payloadParser;

    private volatile ThreadPoolExecutor executor;

    @PostConstruct
    public void init() {
        int workers = Math.max(1, inferenceConfig.getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        executor = new ThreadPoolExecutor(
                workers,
                workers,
                60,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, inferenceConfig.getQueueCapacity())),
                task -> {
                    Thread thread = new Thread(task, "commandconsole-inference-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Override
    public Intent normalize(NormalizationRequest request) {
        LlmClient llmClient = llmClientProvider.getIfAvailable();
        if (!inferenceConfig.isEnabled() || llmClient == null || executor == null) {
            throw new CommandConsoleException(CommandConsoleErrorCode.INFERENCE_UNAVAILABLE);
        }

        String prompt = promptRenderer.render(request);
        String schema = promptRenderer.schema();
        String context = promptRenderer.context(request);

        String raw = call(() -> llmClient.generateJson(prompt, schema, context));
        JsonNode node = JsonUtil.extractObject(raw);
        if (!node.isObject()) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.INFERENCE_INVALID_RESPONSE,
                    "Inference response did not contain a JSON object"
            );
        }
        Intent intent = payloadParser.parse(node);
        log.debug("Inference intent type={} entity={} confidence={} ambiguous={}",
                intent.type(), intent.entity(), intent.confidence(), intent.ambiguous());
        return intent;
    }

    private String call(Callable<String> task) {
        Future<String> future;
        try {
            future = executor.submit(task);
        }
        catch (RejectedExecutionException e) {
            throw new CommandConsoleException(CommandConsoleErrorCode.INFERENCE_UNAVAILABLE, "Inference worker pool is saturated", e);
        }
        try {
            return future.get(inferenceConfig.getTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.INFERENCE_TIMEOUT,
                    "Inference call exceeded " + inferenceConfig.getTimeoutMs() + " ms",
                    e
            );
        }
        catch (ExecutionException e) {
            throw new CommandConsoleException(CommandConsoleErrorCode.INFERENCE_FAILED, "Inference call failed: " + e.getCause(), e.getCause());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CommandConsoleException(CommandConsoleErrorCode.INFERENCE_FAILED, "Interrupted while waiting for inference", e);
        }
    }
}
