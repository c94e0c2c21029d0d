package com.aiadvent.chatcore.chat.persistence;

import com.aiadvent.chatcore.chat.domain.ChatMessage;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  Optional<ChatMessage> findTopBySessionIdOrderBySequenceNumberDesc(String sessionId);

  Slice<ChatMessage> findBySessionIdOrderBySequenceNumberDesc(String sessionId, Pageable pageable);

  Slice<ChatMessage> findBySessionIdAndSequenceNumberLessThanOrderBySequenceNumberDesc(
      String sessionId, Integer sequenceNumber, Pageable pageable);

  List<ChatMessage> findBySessionIdAndContentContainingIgnoreCaseOrderBySequenceNumberAsc(
      String sessionId, String query, Pageable pageable);
}
