package com.example.ledger.service;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.AuditEvent;
import com.example.ledger.domain.User;
import com.example.ledger.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Records state changes made through the ledger services. Events are written in the caller's
 * transaction, so a rolled-back operation leaves no audit row behind.
 */
@Service
@Transactional
public class AuditService {

  private static final Logger log = LoggerFactory.getLogger(AuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final ObjectMapper objectMapper;

  public AuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
    this.objectMapper = new ObjectMapper();
  }

  public AuditEvent logEvent(
      User actor, String eventType, String entityType, Long entityId, String summary) {
    return logEvent(actor, eventType, entityType, entityId, summary, null);
  }

  /**
   * Records an event with structured details.
   *
   * @param actor user performing the change, may be null for system actions
   * @param eventType e.g. TRANSACTION_POSTED
   * @param entityType simple name of the entity touched
   * @param entityId id of the entity touched
   * @param summary one-line human readable description
   * @param details optional values serialized as JSON
   */
  public AuditEvent logEvent(
      User actor,
      String eventType,
      String entityType,
      Long entityId,
      String summary,
      Map<String, Object> details) {
    AuditEvent event = new AuditEvent(actor, eventType, entityType, entityId, truncate(summary));
    if (details != null && !details.isEmpty()) {
      try {
        event.setDetailsJson(objectMapper.writeValueAsString(details));
      } catch (JsonProcessingException e) {
        log.warn("Failed to serialize audit details for {} {}", entityType, entityId, e);
      }
    }
    return auditEventRepository.save(event);
  }

  @Transactional(readOnly = true)
  public List<AuditEvent> findForEntity(String entityType, Long entityId) {
    return auditEventRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
        entityType, entityId);
  }

  private static String truncate(String summary) {
    if (summary == null || summary.length() <= 500) {
      return summary;
    }
    return summary.substring(0, 497) + "...";
  }
}
