package com.jreinhal.quarry.service;

import com.jreinhal.quarry.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link GenerativeFallback} over a Spring AI {@link ChatClient}. Without a configured chat model
 * every call returns empty and the pipeline abstains.
 */
@Component
public class ChatClientGenerativeFallback implements GenerativeFallback {
    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerativeFallback.class);
    static final String SYSTEM_PROMPT = """
            Answer the question using only the context. The answer is often between 1 and 5 words.
            Copy file paths, commands and SQL exactly as they appear in the context.
            If the context does not contain the answer, reply exactly: I don't know
            """;
    private static final String USER_TEMPLATE = """
            Context:
            %s

            Question: %s
            Answer:""";
    private final ChatClient chatClient;
    private final ExecutorService executor;
    @Value(value="${quarry.fallback.enabled:true}")
    private boolean enabled = true;
    @Value(value="${quarry.fallback.timeout-seconds:30}")
    private int timeoutSeconds = 30;

    public ChatClientGenerativeFallback(ObjectProvider<ChatClient.Builder> builder, @Qualifier("fallbackExecutor") ExecutorService executor) {
        ChatClient.Builder available = builder.getIfAvailable();
        this.chatClient = available != null ? available.build() : null;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        log.info("Generative fallback initialized (enabled={}, chatClient={}, timeoutSeconds={})", new Object[]{this.enabled, this.chatClient != null, this.timeoutSeconds});
    }

    @Override
    public Optional<String> generate(String context, String question) {
        if (!this.enabled || this.chatClient == null) {
            return Optional.empty();
        }
        String userMessage = String.format(USER_TEMPLATE, context != null ? context : "", question != null ? question : "");
        Future<String> call;
        try {
            call = this.executor.submit(() -> this.chatClient.prompt().system(SYSTEM_PROMPT).user(userMessage).call().content());
        }
        catch (RejectedExecutionException e) {
            if (log.isWarnEnabled()) {
                log.warn("Fallback pool overloaded; abstaining for {}: {}", LogSanitizer.querySummary(question), e.getMessage());
            }
            return Optional.empty();
        }
        try {
            String content = call.get(this.timeoutSeconds, TimeUnit.SECONDS);
            if (content == null || content.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(content.strip());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            log.warn("Generative fallback interrupted for {}", LogSanitizer.querySummary(question));
            return Optional.empty();
        }
        catch (TimeoutException e) {
            call.cancel(true);
            if (log.isWarnEnabled()) {
                log.warn("Generative fallback timed out after {}s for {}", this.timeoutSeconds, LogSanitizer.querySummary(question));
            }
            return Optional.empty();
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (log.isWarnEnabled()) {
                log.warn("Generative fallback failed for {}: {}", LogSanitizer.querySummary(question), LogSanitizer.sanitize(cause.getMessage()));
            }
            return Optional.empty();
        }
    }
}
