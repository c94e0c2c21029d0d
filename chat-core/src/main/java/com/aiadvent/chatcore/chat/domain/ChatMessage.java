package com.aiadvent.chatcore.chat.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
    name = "chat_message",
    indexes = @Index(name = "idx_chat_message_session_seq", columnList = "session_id, sequence_number"))
public class ChatMessage {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "session_id", nullable = false)
  private ChatSession session;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32)
  private ChatRole role;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "sequence_number", nullable = false)
  private Integer sequenceNumber;

  @Column(name = "failed", nullable = false)
  private boolean failed;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatMessage() {}

  public ChatMessage(ChatSession session, ChatRole role, String content, Integer sequenceNumber) {
    this(session, role, content, sequenceNumber, false);
  }

  public ChatMessage(
      ChatSession session, ChatRole role, String content, Integer sequenceNumber, boolean failed) {
    this.session = session;
    this.role = role;
    this.content = content;
    this.sequenceNumber = sequenceNumber;
    this.failed = failed;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public ChatSession getSession() {
    return session;
  }

  public ChatRole getRole() {
    return role;
  }

  public String getContent() {
    return content;
  }

  public Integer getSequenceNumber() {
    return sequenceNumber;
  }

  public boolean isFailed() {
    return failed;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
