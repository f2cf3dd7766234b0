package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.domain.AuditEvent;
import com.example.ledger.repository.AuditEventRepository;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

  @Mock private AuditEventRepository auditEventRepository;

  private AuditService auditService;

  @BeforeEach
  void setUp() {
    auditService = new AuditService(auditEventRepository);
  }

  @Test
  void logEvent_withDetails_storesThemAsJson() {
    // Arrange
    when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(inv -> inv.getArgument(0));
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("entries", 2);
    details.put("amount", "45.00");

    // Act
    AuditEvent event =
        auditService.logEvent(null, "TRANSACTION_POSTED", "Transaction", 10L, "Posted", details);

    // Assert
    assertEquals("{\"entries\":2,\"amount\":\"45.00\"}", event.getDetailsJson());
    assertNull(event.getActor());
  }

  @Test
  void logEvent_withLongSummary_truncatesIt() {
    when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(inv -> inv.getArgument(0));

    AuditEvent event = auditService.logEvent(null, "ACCOUNT_CREATED", "Account", 1L, "x".repeat(600));

    assertEquals(500, event.getSummary().length());
    assertTrue(event.getSummary().endsWith("..."));
    assertNull(event.getDetailsJson());
  }
}
