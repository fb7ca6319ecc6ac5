package com.yourapp.chatshell.responder;

import com.yourapp.chatshell.conversation.ContextMessage;
import java.util.List;

/** Turns the recent history of a conversation into the next assistant reply. */
public interface Responder {

  String respond(List<ContextMessage> context);
}
