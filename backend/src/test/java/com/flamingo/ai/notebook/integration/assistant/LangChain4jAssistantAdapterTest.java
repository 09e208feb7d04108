package com.flamingo.ai.notebook.integration.assistant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LangChain4jAssistantAdapterTest {

  @Mock private ChatModel chatModel;

  @Captor private ArgumentCaptor<List<ChatMessage>> messagesCaptor;

  private LangChain4jAssistantAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter = new LangChain4jAssistantAdapter(chatModel);
  }

  @Test
  void shouldSendSystemHistoryAndUserMessagesInOrder() {
    // Given
    when(chatModel.chat(anyList())).thenReturn(response("  The answer.  "));
    PromptContext context =
        new PromptContext(
            "Be precise.",
            List.of(
                new ConversationTurn(MessageSender.USER, "First question"),
                new ConversationTurn(MessageSender.ASSISTANT, "First answer")),
            "Second question");

    // When
    String result = adapter.generate(context);

    // Then
    assertThat(result).isEqualTo("The answer.");
    verify(chatModel).chat(messagesCaptor.capture());
    List<ChatMessage> messages = messagesCaptor.getValue();
    assertThat(messages).hasSize(4);
    assertThat(messages.get(0)).isEqualTo(SystemMessage.from("Be precise."));
    assertThat(messages.get(1)).isEqualTo(UserMessage.from("First question"));
    assertThat(messages.get(2)).isEqualTo(AiMessage.from("First answer"));
    assertThat(messages.get(3)).isEqualTo(UserMessage.from("Second question"));
  }

  @Test
  void shouldFailTransiently_whenModelErrorIsRetriable() {
    when(chatModel.chat(anyList())).thenThrow(new RetriableException("rate limit reached"));

    assertThatThrownBy(() -> adapter.generate(PromptContext.of("sys", "hi")))
        .isInstanceOf(GenerationFailedException.class)
        .satisfies(e -> assertThat(((GenerationFailedException) e).isTransient()).isTrue());
  }

  @Test
  void shouldFailPermanently_whenModelRejectsRequest() {
    when(chatModel.chat(anyList())).thenThrow(new NonRetriableException("invalid api key"));

    assertThatThrownBy(() -> adapter.generate(PromptContext.of("sys", "hi")))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessageContaining("invalid api key")
        .satisfies(e -> assertThat(((GenerationFailedException) e).isTransient()).isFalse());
  }

  @Test
  void shouldFailTransiently_whenNetworkErrorInCauseChain() {
    when(chatModel.chat(anyList()))
        .thenThrow(
            new RuntimeException(
                "call failed",
                new UncheckedIOException(new SocketTimeoutException("read timed out"))));

    assertThatThrownBy(() -> adapter.generate(PromptContext.of("sys", "hi")))
        .isInstanceOf(GenerationFailedException.class)
        .satisfies(e -> assertThat(((GenerationFailedException) e).isTransient()).isTrue());
  }

  @Test
  void shouldFailPermanently_whenModelReturnsBlankText() {
    when(chatModel.chat(anyList())).thenReturn(response("   "));

    assertThatThrownBy(() -> adapter.generate(PromptContext.of("sys", "hi")))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessageContaining("empty response")
        .satisfies(e -> assertThat(((GenerationFailedException) e).isTransient()).isFalse());
  }

  private static ChatResponse response(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }
}
