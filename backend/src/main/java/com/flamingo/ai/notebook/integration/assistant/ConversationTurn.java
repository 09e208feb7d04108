package com.flamingo.ai.notebook.integration.assistant;

import com.flamingo.ai.notebook.domain.enums.MessageSender;

/** One earlier message of a conversation, as sent to the assistant. */
public record ConversationTurn(MessageSender sender, String content) {}
