package com.aiadvent.chatcore.chat.persistence;

import com.aiadvent.chatcore.chat.domain.ChatMessage;
import com.aiadvent.chatcore.chat.domain.ChatRole;
import com.aiadvent.chatcore.chat.domain.ChatSession;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class JpaChatHistoryStore implements ChatHistoryStore {

  static final int TITLE_MAX_LENGTH = 80;

  private final ChatSessionRepository chatSessionRepository;
  private final ChatMessageRepository chatMessageRepository;

  public JpaChatHistoryStore(
      ChatSessionRepository chatSessionRepository, ChatMessageRepository chatMessageRepository) {
    this.chatSessionRepository = chatSessionRepository;
    this.chatMessageRepository = chatMessageRepository;
  }

  @Override
  @Transactional
  public StoredMessage recordUserMessage(String sessionId, String content) {
    if (!StringUtils.hasText(sessionId)) {
      throw new IllegalArgumentException("Session id must not be empty");
    }
    if (!StringUtils.hasText(content)) {
      throw new IllegalArgumentException("Message must not be empty");
    }

    ChatSession session =
        chatSessionRepository
            .findById(sessionId)
            .orElseGet(
                () -> chatSessionRepository.save(new ChatSession(sessionId, titleFrom(content))));
    session.touch();

    int nextSequence = nextSequenceNumber(sessionId);
    ChatMessage saved =
        chatMessageRepository.save(new ChatMessage(session, ChatRole.USER, content, nextSequence));
    return StoredMessage.from(saved);
  }

  @Override
  @Transactional
  public StoredMessage saveAssistantResponse(String sessionId, String content, boolean failed) {
    if (!StringUtils.hasText(content)) {
      return null;
    }

    ChatSession session =
        chatSessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new ChatSessionNotFoundException(sessionId));
    session.touch();

    int nextSequence = nextSequenceNumber(sessionId);
    ChatMessage saved =
        chatMessageRepository.save(
            new ChatMessage(session, ChatRole.ASSISTANT, content, nextSequence, failed));
    return StoredMessage.from(saved);
  }

  @Override
  @Transactional(readOnly = true)
  public MessagePage loadLatest(String sessionId, int limit) {
    Slice<ChatMessage> slice =
        chatMessageRepository.findBySessionIdOrderBySequenceNumberDesc(
            sessionId, PageRequest.of(0, Math.max(1, limit)));
    return toPage(slice);
  }

  @Override
  @Transactional(readOnly = true)
  public MessagePage loadBefore(String sessionId, int beforeSequence, int limit) {
    Slice<ChatMessage> slice =
        chatMessageRepository.findBySessionIdAndSequenceNumberLessThanOrderBySequenceNumberDesc(
            sessionId, beforeSequence, PageRequest.of(0, Math.max(1, limit)));
    return toPage(slice);
  }

  @Override
  @Transactional(readOnly = true)
  public List<StoredMessage> search(String sessionId, String query, int limit) {
    if (!StringUtils.hasText(query)) {
      return List.of();
    }
    return chatMessageRepository
        .findBySessionIdAndContentContainingIgnoreCaseOrderBySequenceNumberAsc(
            sessionId, query.trim(), PageRequest.of(0, Math.max(1, limit)))
        .stream()
        .map(StoredMessage::from)
        .toList();
  }

  private MessagePage toPage(Slice<ChatMessage> slice) {
    if (!slice.hasContent()) {
      return MessagePage.empty();
    }
    List<StoredMessage> messages = new ArrayList<>(slice.getNumberOfElements());
    for (ChatMessage message : slice.getContent()) {
      messages.add(StoredMessage.from(message));
    }
    Collections.reverse(messages);
    return new MessagePage(messages, messages.get(0).sequenceNumber(), slice.hasNext());
  }

  private int nextSequenceNumber(String sessionId) {
    return chatMessageRepository
            .findTopBySessionIdOrderBySequenceNumberDesc(sessionId)
            .map(ChatMessage::getSequenceNumber)
            .orElse(0)
        + 1;
  }

  private String titleFrom(String content) {
    String normalized = content.replaceAll("\\s+", " ").trim();
    if (normalized.length() <= TITLE_MAX_LENGTH) {
      return normalized;
    }
    return normalized.substring(0, TITLE_MAX_LENGTH) + "...";
  }
}
