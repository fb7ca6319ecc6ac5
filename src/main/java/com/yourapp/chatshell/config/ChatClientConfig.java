package com.yourapp.chatshell.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    @Bean(name = "answerChatClient")
    public ChatClient answerChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.chat:llama3.2:3b}") String chatModelName,
            @Value("${app.models.temperature:0.7}") double temperature,
            @Value("${app.models.top-p:0.9}") double topP) {
        return ChatClient.builder(chatModel)
                .defaultOptions(OllamaChatOptions.builder()
                        .model(chatModelName)
                        .temperature(temperature)
                        .topP(topP)
                        .build())
                .build();
    }
}
