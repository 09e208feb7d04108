package com.flamingo.ai.notebook.service.chat;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.ChatMessage;
import com.flamingo.ai.notebook.domain.entity.ChatSession;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.domain.enums.MessageSender;
import com.flamingo.ai.notebook.domain.repository.ChatMessageRepository;
import com.flamingo.ai.notebook.domain.repository.ChatSessionRepository;
import com.flamingo.ai.notebook.domain.repository.NotebookRepository;
import com.flamingo.ai.notebook.exception.ChatMessageNotFoundException;
import com.flamingo.ai.notebook.exception.GenerationFailedException;
import com.flamingo.ai.notebook.exception.InvalidStateException;
import com.flamingo.ai.notebook.exception.NotebookNotFoundException;
import com.flamingo.ai.notebook.exception.OperationCancelledException;
import com.flamingo.ai.notebook.exception.SessionNotFoundException;
import com.flamingo.ai.notebook.exception.SessionOrderConflictException;
import com.flamingo.ai.notebook.integration.assistant.AssistantAdapter;
import com.flamingo.ai.notebook.integration.assistant.ConversationTurn;
import com.flamingo.ai.notebook.integration.assistant.PromptContext;
import com.flamingo.ai.notebook.service.context.ContextBudget;
import com.flamingo.ai.notebook.service.context.ContextSet;
import com.flamingo.ai.notebook.service.context.NotebookContextSelector;
import com.flamingo.ai.notebook.support.AdapterCallPolicy;
import com.flamingo.ai.notebook.support.AdapterInvoker;
import com.flamingo.ai.notebook.support.InFlightWork;
import com.flamingo.ai.notebook.support.SessionLocks;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Implementation of the ChatOrchestrator.
 *
 * <p>Posting a message reserves two order slots under the session lock: one for the user message
 * and the next for its reply. Generation runs without the lock, so other posts on the same session
 * proceed meanwhile, and the reply later fills its reserved slot.
 */
@Service
@Slf4j
public class ChatOrchestratorImpl implements ChatOrchestrator {

  private static final int MAX_ORDER_ATTEMPTS = 3;
  private static final String NO_CONTEXT =
      "The notebook has no content relevant to this message yet.";

  private final ChatSessionRepository sessionRepository;
  private final ChatMessageRepository messageRepository;
  private final NotebookRepository notebookRepository;
  private final NotebookContextSelector contextSelector;
  private final AssistantAdapter assistantAdapter;
  private final AdapterInvoker adapterInvoker;
  private final SessionLocks sessionLocks;
  private final InFlightWork inFlightWork;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;
  private final NotebookProperties.Chat chatSettings;
  private final ContextBudget contextBudget;
  private final AdapterCallPolicy generationPolicy;
  private final DateTimeFormatter defaultTitleFormat;

  public ChatOrchestratorImpl(
      ChatSessionRepository sessionRepository,
      ChatMessageRepository messageRepository,
      NotebookRepository notebookRepository,
      NotebookContextSelector contextSelector,
      AssistantAdapter assistantAdapter,
      AdapterInvoker adapterInvoker,
      SessionLocks sessionLocks,
      InFlightWork inFlightWork,
      TransactionTemplate transactionTemplate,
      MeterRegistry meterRegistry,
      NotebookProperties properties) {
    this.sessionRepository = sessionRepository;
    this.messageRepository = messageRepository;
    this.notebookRepository = notebookRepository;
    this.contextSelector = contextSelector;
    this.assistantAdapter = assistantAdapter;
    this.adapterInvoker = adapterInvoker;
    this.sessionLocks = sessionLocks;
    this.inFlightWork = inFlightWork;
    this.transactionTemplate = transactionTemplate;
    this.meterRegistry = meterRegistry;
    this.chatSettings = properties.getChat();
    this.contextBudget = ContextBudget.from(properties.getContext());
    this.generationPolicy = AdapterCallPolicy.generation(properties.getGeneration());
    this.defaultTitleFormat = DateTimeFormatter.ofPattern(chatSettings.getDefaultTitlePattern());
  }

  @Override
  @Transactional
  @Timed(value = "chat.session.create", description = "Time to create a chat session")
  public ChatSession createSession(UUID notebookId, String title) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));
    String effectiveTitle =
        title == null || title.isBlank()
            ? defaultTitleFormat.format(LocalDateTime.now())
            : title.strip();

    ChatSession saved =
        sessionRepository.save(ChatSession.builder().notebook(notebook).title(effectiveTitle).build());
    meterRegistry.counter("chat.session.created").increment();
    log.info("Created chat session {} in notebook {}", saved.getId(), notebookId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatSession> listSessions(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    return sessionRepository.findByNotebookIdOrderByUpdatedAtDesc(notebookId);
  }

  @Override
  @Transactional(readOnly = true)
  public ChatSession getSession(UUID sessionId) {
    return loadSession(sessionId);
  }

  @Override
  public ChatSession renameSession(UUID sessionId, String title) {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Session title must not be blank");
    }
    return sessionLocks.withLock(
        sessionId,
        () ->
            transactionTemplate.execute(
                status -> {
                  ChatSession session = loadSession(sessionId);
                  session.setTitle(title.strip());
                  return sessionRepository.save(session);
                }));
  }

  @Override
  @Timed(value = "chat.session.delete", description = "Time to delete a chat session")
  public void deleteSession(UUID sessionId) {
    sessionLocks.withLock(
        sessionId,
        () -> {
          ChatSession session = loadSession(sessionId);
          inFlightWork.cancelAll(sessionId);
          transactionTemplate.executeWithoutResult(status -> sessionRepository.delete(session));
          meterRegistry.counter("chat.session.deleted").increment();
          log.info("Deleted chat session {}", sessionId);
        });
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> listMessages(UUID sessionId) {
    loadSession(sessionId);
    return messageRepository.findConversation(sessionId);
  }

  @Override
  public ChatExchange postMessage(UUID sessionId, String content) {
    return postMessage(sessionId, content, generationPolicy.timeout());
  }

  @Override
  @Timed(value = "chat.message.post", description = "Time to post a message and get a reply")
  public ChatExchange postMessage(UUID sessionId, String content, Duration timeout) {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Message content must not be blank");
    }
    ChatSession session = loadSession(sessionId);
    ChatMessage userMessage = appendUserMessage(sessionId, content.strip());
    log.debug(
        "Stored user message {} at order {} in session {}",
        userMessage.getId(),
        userMessage.getMessageOrder(),
        sessionId);
    return reply(session, userMessage, timeout);
  }

  @Override
  public ChatExchange retryReply(UUID sessionId, UUID userMessageId) {
    ChatSession session = loadSession(sessionId);
    ChatMessage userMessage =
        messageRepository
            .findById(userMessageId)
            .filter(message -> message.getSession().getId().equals(sessionId))
            .orElseThrow(() -> new ChatMessageNotFoundException(userMessageId));
    if (userMessage.getSender() != MessageSender.USER) {
      throw new InvalidStateException("Only user messages can be answered again");
    }
    requireReplySlotFree(sessionId, userMessage);
    log.info("Retrying reply to message {} in session {}", userMessageId, sessionId);
    return reply(session, userMessage, generationPolicy.timeout());
  }

  private ChatExchange reply(ChatSession session, ChatMessage userMessage, Duration timeout) {
    UUID sessionId = session.getId();
    List<ConversationTurn> history = loadHistory(sessionId, userMessage.getMessageOrder());
    ContextSet context = selectContext(session.getNotebook().getId(), userMessage.getContent());
    PromptContext prompt =
        new PromptContext(buildSystemPrompt(context), history, userMessage.getContent());

    String replyText;
    try {
      replyText =
          adapterInvoker.invoke(
              generationPolicy.withTimeout(timeout),
              sessionId,
              () -> assistantAdapter.generate(prompt));
    } catch (GenerationFailedException e) {
      meterRegistry
          .counter("chat.errors", "type", e.isTransient() ? "transient" : "permanent")
          .increment();
      recordReplyFailure(sessionId, userMessage.getId(), e.getReason());
      throw e.forMessage(userMessage.getId());
    } catch (OperationCancelledException e) {
      meterRegistry.counter("chat.errors", "type", "cancelled").increment();
      recordReplyFailure(sessionId, userMessage.getId(), "Reply generation was cancelled");
      throw e;
    }

    ChatMessage assistantMessage = appendAssistantReply(sessionId, userMessage, replyText);
    meterRegistry.counter("chat.messages.generated").increment();
    log.info(
        "Replied to message {} in session {} with {} context item(s)",
        userMessage.getId(),
        sessionId,
        context.items().size());
    return new ChatExchange(userMessage, assistantMessage);
  }

  private ChatMessage appendUserMessage(UUID sessionId, String content) {
    for (int attempt = 1; ; attempt++) {
      try {
        return sessionLocks.withLock(
            sessionId,
            () ->
                transactionTemplate.execute(
                    status -> {
                      ChatSession session = loadSession(sessionId);
                      long order = session.reserveOrders(2);
                      sessionRepository.save(session);
                      return saveMessage(session, MessageSender.USER, content, order);
                    }));
      } catch (SessionOrderConflictException e) {
        if (attempt >= MAX_ORDER_ATTEMPTS) {
          throw new IllegalStateException(
              "Could not assign a message order in session " + sessionId, e);
        }
        log.error(
            "Order {} already taken in session {}, resynchronizing the session tail",
            e.getMessageOrder(),
            sessionId,
            e);
        resynchronizeTail(sessionId);
      }
    }
  }

  private ChatMessage appendAssistantReply(UUID sessionId, ChatMessage userMessage, String text) {
    return sessionLocks.withLock(
        sessionId,
        () ->
            transactionTemplate.execute(
                status -> {
                  ChatSession session = loadSession(sessionId);
                  requireReplySlotFree(sessionId, userMessage);
                  messageRepository
                      .findById(userMessage.getId())
                      .ifPresent(
                          stored -> {
                            if (stored.getReplyError() != null) {
                              stored.setReplyError(null);
                              messageRepository.save(stored);
                            }
                          });
                  userMessage.setReplyError(null);
                  ChatMessage reply =
                      saveMessage(
                          session, MessageSender.ASSISTANT, text, userMessage.replyOrder());
                  session.setUpdatedAt(LocalDateTime.now());
                  sessionRepository.save(session);
                  return reply;
                }));
  }

  private ChatMessage saveMessage(
      ChatSession session, MessageSender sender, String content, long order) {
    try {
      return messageRepository.saveAndFlush(
          ChatMessage.builder()
              .session(session)
              .sender(sender)
              .content(content)
              .messageOrder(order)
              .build());
    } catch (DataIntegrityViolationException e) {
      throw new SessionOrderConflictException(session.getId(), order, e);
    }
  }

  private void resynchronizeTail(UUID sessionId) {
    sessionLocks.withLock(
        sessionId,
        () ->
            transactionTemplate.executeWithoutResult(
                status -> {
                  ChatSession session = loadSession(sessionId);
                  // Keep the reply slot of the last stored message free
                  long tail = messageRepository.findMaxOrder(sessionId) + 1;
                  if (tail > session.getLastMessageOrder()) {
                    session.setLastMessageOrder(tail);
                    sessionRepository.save(session);
                  }
                }));
  }

  private void requireReplySlotFree(UUID sessionId, ChatMessage userMessage) {
    if (messageRepository
        .findBySessionIdAndMessageOrder(sessionId, userMessage.replyOrder())
        .isPresent()) {
      throw new InvalidStateException(
          "Message " + userMessage.getId() + " already has a reply");
    }
  }

  private void recordReplyFailure(UUID sessionId, UUID userMessageId, String reason) {
    String detail = reason == null || reason.isBlank() ? "Reply generation failed" : reason;
    sessionLocks.withLock(
        sessionId,
        () ->
            transactionTemplate.executeWithoutResult(
                status ->
                    messageRepository
                        .findById(userMessageId)
                        .ifPresentOrElse(
                            message -> {
                              message.setReplyError(detail);
                              messageRepository.save(message);
                            },
                            () ->
                                log.info(
                                    "Message {} was deleted before its failure was recorded",
                                    userMessageId))));
  }

  private List<ConversationTurn> loadHistory(UUID sessionId, long beforeOrder) {
    int window = chatSettings.getHistoryWindow();
    if (window <= 0) {
      return List.of();
    }
    List<ChatMessage> newestFirst =
        messageRepository.findHistoryBefore(sessionId, beforeOrder, window);
    List<ConversationTurn> turns = new ArrayList<>(newestFirst.size());
    for (ChatMessage message : newestFirst) {
      turns.add(new ConversationTurn(message.getSender(), message.getContent()));
    }
    Collections.reverse(turns);
    return turns;
  }

  private ContextSet selectContext(UUID notebookId, String query) {
    try {
      return contextSelector.select(notebookId, query, contextBudget);
    } catch (RuntimeException e) {
      log.warn(
          "Context selection failed for notebook {}, answering without context: {}",
          notebookId,
          e.getMessage());
      return ContextSet.empty();
    }
  }

  private String buildSystemPrompt(ContextSet context) {
    return chatSettings.getSystemPrompt()
        + "\n\n# NOTEBOOK CONTEXT\n"
        + (context.isEmpty() ? NO_CONTEXT : context.render());
  }

  private ChatSession loadSession(UUID sessionId) {
    return sessionRepository
        .findById(sessionId)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }
}
