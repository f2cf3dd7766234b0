package com.example.ledger.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Append-only record of a state change made through the ledger services. */
@Entity
@Table(
    name = "audit_event",
    indexes = {
      @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
      @Index(name = "idx_audit_created", columnList = "created_at")
    })
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "actor_id")
  private User actor;

  @NotNull
  @Size(max = 50)
  @Column(name = "event_type", nullable = false, length = 50)
  private String eventType;

  @NotNull
  @Size(max = 50)
  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id")
  private Long entityId;

  @Size(max = 500)
  @Column(length = 500)
  private String summary;

  @Column(name = "details_json", columnDefinition = "TEXT")
  private String detailsJson;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public AuditEvent() {}

  public AuditEvent(
      User actor, String eventType, String entityType, Long entityId, String summary) {
    this.actor = actor;
    this.eventType = eventType;
    this.entityType = entityType;
    this.entityId = entityId;
    this.summary = summary;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public User getActor() {
    return actor;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public Long getEntityId() {
    return entityId;
  }

  public String getSummary() {
    return summary;
  }

  public String getDetailsJson() {
    return detailsJson;
  }

  public void setDetailsJson(String detailsJson) {
    this.detailsJson = detailsJson;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
