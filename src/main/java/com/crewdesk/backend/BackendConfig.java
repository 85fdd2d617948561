package com.crewdesk.backend;

import com.crewdesk.core.config.CrewdeskProperties;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BackendConfig {

    @Bean
    @ConditionalOnProperty(name = "crewdesk.backend.type", havingValue = "cli", matchIfMissing = true)
    public ExecutionBackend cliExecutionBackend(CrewdeskProperties properties) {
        return new CliExecutionBackend(properties);
    }

    @Bean
    @ConditionalOnProperty(name = "crewdesk.backend.type", havingValue = "chat")
    public ExecutionBackend chatExecutionBackend(ChatClient.Builder builder) {
        return new ChatClientExecutionBackend(builder);
    }
}
