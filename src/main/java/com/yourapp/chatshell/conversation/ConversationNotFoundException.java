package com.yourapp.chatshell.conversation;

public class ConversationNotFoundException extends RuntimeException {

  private final String conversationId;

  public ConversationNotFoundException(String conversationId) {
    super("Conversation " + conversationId + " not found");
    this.conversationId = conversationId;
  }

  public String getConversationId() {
    return conversationId;
  }
}
