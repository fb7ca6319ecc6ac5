package com.yourapp.chatshell.responder;

import com.yourapp.chatshell.conversation.ContextMessage;
import com.yourapp.chatshell.model.MessageRole;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class ChatClientResponder implements Responder {

    private static final Logger log = LoggerFactory.getLogger(ChatClientResponder.class);

    static final String FALLBACK_REPLY =
            "I apologize, but I'm having trouble generating a response right now. "
                    + "Could you please try rephrasing your question?";

    private static final String SYSTEM_PROMPT = """
            You are a helpful AI assistant running in a terminal chat.

            Rules:
            - Respond naturally and conversationally to the last user message
            - Use the earlier turns of the transcript only as context
            - Keep answers short unless the user asks for detail
            - Do NOT repeat the transcript back
            - If you do not know something, say so
            """;

    private final ChatClient chatClient;
    private final Timer responseTimer;

    public ChatClientResponder(
            @Qualifier("answerChatClient") ChatClient chatClient,
            MeterRegistry meterRegistry
    ) {
        this.chatClient = chatClient;
        this.responseTimer = Timer.builder("chat.responder.duration")
                .description("Assistant reply generation duration")
                .register(meterRegistry);
    }

    @Override
    public String respond(List<ContextMessage> context) {
        if (context == null || context.isEmpty()) {
            return FALLBACK_REPLY;
        }

        String transcript = transcript(context);
        try {
            long startNanos = System.nanoTime();
            String content = chatClient.prompt()
                    .system(system -> system.text(SYSTEM_PROMPT))
                    .user(user -> user.text(transcript))
                    .call()
                    .content();
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            responseTimer.record(durationMs, TimeUnit.MILLISECONDS);
            log.info("LLM answer call completed durationMs={} contextMessages={}",
                    durationMs, context.size());
            return postProcess(content);
        } catch (RuntimeException e) {
            log.error("Error generating response", e);
            return FALLBACK_REPLY;
        }
    }

    static String transcript(List<ContextMessage> context) {
        StringBuilder transcript = new StringBuilder();
        for (ContextMessage message : context) {
            transcript.append(message.role() == MessageRole.USER ? "User: " : "Assistant: ")
                    .append(message.content())
                    .append('\n');
        }
        transcript.append("Assistant:");
        return transcript.toString();
    }

    static String postProcess(String content) {
        if (content == null) {
            return FALLBACK_REPLY;
        }
        String cleaned = content.strip();
        if (cleaned.startsWith("Assistant:")) {
            cleaned = cleaned.substring("Assistant:".length()).strip();
        }
        return cleaned.isEmpty() ? FALLBACK_REPLY : cleaned;
    }
}
