package com.flamingo.ai.notebook.integration.assistant;

import com.flamingo.ai.notebook.domain.enums.MessageSender;
import com.flamingo.ai.notebook.exception.GenerationFailedException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link AssistantAdapter} on top of a LangChain4j {@link ChatModel}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jAssistantAdapter implements AssistantAdapter {

  private final ChatModel chatModel;

  @Override
  @Timed(value = "assistant.generate", description = "Time spent waiting for the chat model")
  public String generate(PromptContext context) {
    List<ChatMessage> messages = toMessages(context);
    ChatResponse response;
    try {
      response = chatModel.chat(messages);
    } catch (RetriableException e) {
      log.warn("Chat model failed with a retriable error: {}", e.getMessage());
      throw new GenerationFailedException(true, e.getMessage(), e);
    } catch (NonRetriableException e) {
      log.error("Chat model rejected the request: {}", e.getMessage());
      throw new GenerationFailedException(false, e.getMessage(), e);
    } catch (RuntimeException e) {
      boolean transientFailure = isNetworkFailure(e);
      log.error(
          "Chat model call failed ({}): {}",
          transientFailure ? "transient" : "permanent",
          e.getMessage());
      throw new GenerationFailedException(transientFailure, e.getMessage(), e);
    }

    AiMessage aiMessage = response == null ? null : response.aiMessage();
    String text = aiMessage == null ? null : aiMessage.text();
    if (text == null || text.isBlank()) {
      throw new GenerationFailedException(false, "Model returned an empty response");
    }
    return text.strip();
  }

  private static List<ChatMessage> toMessages(PromptContext context) {
    List<ChatMessage> messages = new ArrayList<>();
    if (context.systemPrompt() != null && !context.systemPrompt().isBlank()) {
      messages.add(SystemMessage.from(context.systemPrompt()));
    }
    for (ConversationTurn turn : context.history()) {
      messages.add(
          turn.sender() == MessageSender.USER
              ? UserMessage.from(turn.content())
              : AiMessage.from(turn.content()));
    }
    messages.add(UserMessage.from(context.userContent()));
    return messages;
  }

  private static boolean isNetworkFailure(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof IOException || cause instanceof TimeoutException) {
        return true;
      }
    }
    return false;
  }
}
