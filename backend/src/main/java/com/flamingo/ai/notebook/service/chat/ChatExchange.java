package com.flamingo.ai.notebook.service.chat;

import com.flamingo.ai.notebook.domain.entity.ChatMessage;

/** A user message and the assistant reply stored right after it. */
public record ChatExchange(ChatMessage userMessage, ChatMessage assistantMessage) {}
