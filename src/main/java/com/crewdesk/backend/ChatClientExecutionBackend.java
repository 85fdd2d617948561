package com.crewdesk.backend;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs each invocation as a single Spring AI chat call. Model aliases meant
 * for the agent CLI are ignored; the configured chat model is used.
 */
public class ChatClientExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatClientExecutionBackend.class);

    private final ChatClient chatClient;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "crewdesk-chat");
        t.setDaemon(true);
        return t;
    });

    public ChatClientExecutionBackend(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public BackendResult execute(BackendRequest request) {
        long start = System.currentTimeMillis();
        Future<String> call = executor.submit(() -> {
            var prompt = chatClient.prompt();
            if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
                prompt = prompt.system(request.systemPrompt());
            }
            return prompt.user(request.prompt()).call().content();
        });
        try {
            String content = call.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;
            if (content == null || content.isBlank()) {
                return new BackendResult(1, "", "Chat model returned empty content", false, elapsed);
            }
            return new BackendResult(0, content, "", false, elapsed);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Chat call timed out after {}s", request.timeout().toSeconds());
            return BackendResult.timeout("", "", System.currentTimeMillis() - start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Chat call failed: {}", cause.getMessage());
            return new BackendResult(1, "", String.valueOf(cause.getMessage()), false,
                    System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendException("Chat call interrupted", e);
        }
    }

    @Override
    public String name() {
        return "chat";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
