package com.yourapp.chatshell.conversation;

import com.yourapp.chatshell.model.MessageRole;
import java.time.Instant;

public record ContextMessage(MessageRole role, String content, Instant timestamp) {}
