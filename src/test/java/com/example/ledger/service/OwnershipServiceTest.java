package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.config.LedgerProperties.Ownership.DefaultOwnerPolicy;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.OwnershipShare;
import com.example.ledger.domain.User;
import com.example.ledger.exception.InvalidPercentageException;
import com.example.ledger.exception.OwnershipExceededException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.OwnershipShareRepository;
import com.example.ledger.repository.UserRepository;

/** Unit tests for OwnershipService: share validation, the 100% ceiling and default owners. */
@ExtendWith(MockitoExtension.class)
class OwnershipServiceTest {

  @Mock private OwnershipShareRepository shareRepository;

  @Mock private AccountRepository accountRepository;

  @Mock private UserRepository userRepository;

  @Mock private AuditService auditService;

  private LedgerProperties properties;
  private OwnershipService ownershipService;

  private Account house;
  private User alice;
  private User bob;
  private User carol;

  @BeforeEach
  void setUp() {
    properties = new LedgerProperties();
    ownershipService =
        new OwnershipService(
            shareRepository, accountRepository, userRepository, auditService, properties);

    house = new Account("House", Account.AccountType.ASSET, Account.AccountSubtype.REAL_ESTATE);
    house.setId(1L);
    house.setFullPath("Assets:House");

    alice = user(1L, "alice");
    bob = user(2L, "bob");
    carol = user(3L, "carol");
  }

  @Test
  void setOwnership_whenTotalWouldExceedOne_throwsAndKeepsFirstShare() {
    // Arrange
    when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(house));
    when(shareRepository.sumForAccountExcludingUser(house, alice)).thenReturn(BigDecimal.ZERO);
    when(shareRepository.sumForAccountExcludingUser(house, bob)).thenReturn(new BigDecimal("0.6"));
    when(shareRepository.findByAccountAndUser(house, alice)).thenReturn(Optional.empty());
    when(shareRepository.save(any(OwnershipShare.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act
    OwnershipShare first =
        ownershipService.setOwnership(house, alice, new BigDecimal("0.6"), carol);
    OwnershipExceededException exception =
        assertThrows(
            OwnershipExceededException.class,
            () -> ownershipService.setOwnership(house, bob, new BigDecimal("0.5"), carol));

    // Assert
    assertEquals(0, new BigDecimal("0.6").compareTo(first.getPercentage()));
    assertEquals(0, new BigDecimal("1.1").compareTo(exception.getAttemptedTotal()));
    verify(shareRepository, times(1)).save(any(OwnershipShare.class));
  }

  @Test
  void setOwnership_withinEpsilonOfOne_isAccepted() {
    // Arrange
    when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(house));
    when(shareRepository.sumForAccountExcludingUser(house, bob)).thenReturn(new BigDecimal("0.6667"));
    when(shareRepository.findByAccountAndUser(house, bob)).thenReturn(Optional.empty());
    when(shareRepository.save(any(OwnershipShare.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act & Assert
    assertDoesNotThrow(
        () -> ownershipService.setOwnership(house, bob, new BigDecimal("0.3334"), carol));
  }

  @Test
  void setOwnership_whenUserAlreadyOwnsShare_updatesIt() {
    // Arrange
    OwnershipShare existing = new OwnershipShare(alice, house, new BigDecimal("0.25"));
    when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(house));
    when(shareRepository.sumForAccountExcludingUser(house, alice)).thenReturn(new BigDecimal("0.5"));
    when(shareRepository.findByAccountAndUser(house, alice)).thenReturn(Optional.of(existing));
    when(shareRepository.save(existing)).thenReturn(existing);

    // Act
    OwnershipShare result =
        ownershipService.setOwnership(house, alice, new BigDecimal("0.5"), carol);

    // Assert
    assertSame(existing, result);
    assertEquals(0, new BigDecimal("0.5").compareTo(existing.getPercentage()));
  }

  @Test
  void setOwnership_withOutOfRangePercentage_throwsBeforeLocking() {
    assertThrows(
        InvalidPercentageException.class,
        () -> ownershipService.setOwnership(house, alice, BigDecimal.ZERO, carol));
    assertThrows(
        InvalidPercentageException.class,
        () -> ownershipService.setOwnership(house, alice, new BigDecimal("1.01"), carol));
    assertThrows(
        InvalidPercentageException.class,
        () -> ownershipService.setOwnership(house, alice, new BigDecimal("0.33333"), carol));
    verifyNoInteractions(accountRepository, shareRepository);
  }

  @Test
  void replaceOwnership_whenSharesExceedOne_throwsWithoutTouchingShares() {
    // Arrange
    Map<User, BigDecimal> shares = new LinkedHashMap<>();
    shares.put(alice, new BigDecimal("0.7"));
    shares.put(bob, new BigDecimal("0.4"));
    when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(house));

    // Act & Assert
    assertThrows(
        OwnershipExceededException.class,
        () -> ownershipService.replaceOwnership(house, shares, carol));
    verifyNoInteractions(shareRepository);
  }

  @Test
  void replaceOwnership_updatesKeptOwnersRemovesDroppedAndAddsNew() {
    // Arrange
    OwnershipShare aliceShare = new OwnershipShare(alice, house, new BigDecimal("0.5"));
    OwnershipShare bobShare = new OwnershipShare(bob, house, new BigDecimal("0.5"));
    Map<User, BigDecimal> shares = new LinkedHashMap<>();
    shares.put(alice, new BigDecimal("0.7"));
    shares.put(carol, new BigDecimal("0.3"));

    when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(house));
    when(shareRepository.findByAccountOrderByPercentageDesc(house)).thenReturn(List.of(aliceShare, bobShare));
    ArgumentCaptor<OwnershipShare> saved = ArgumentCaptor.forClass(OwnershipShare.class);

    // Act
    ownershipService.replaceOwnership(house, shares, carol);

    // Assert
    verify(shareRepository).delete(bobShare);
    verify(shareRepository, times(2)).save(saved.capture());
    assertSame(aliceShare, saved.getAllValues().get(0));
    assertEquals(0, new BigDecimal("0.7").compareTo(aliceShare.getPercentage()));
    assertEquals(carol, saved.getAllValues().get(1).getUser());
    assertEquals(0, new BigDecimal("0.3").compareTo(saved.getAllValues().get(1).getPercentage()));
  }

  @Test
  void ownershipEdits_areAuditedAsTheActingUser() {
    // Arrange
    OwnershipShare bobShare = new OwnershipShare(bob, house, new BigDecimal("0.5"));
    when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(house));
    when(shareRepository.sumForAccountExcludingUser(house, alice)).thenReturn(BigDecimal.ZERO);
    when(shareRepository.findByAccountAndUser(house, alice)).thenReturn(Optional.empty());
    when(shareRepository.findByAccountAndUser(house, bob)).thenReturn(Optional.of(bobShare));
    when(shareRepository.save(any(OwnershipShare.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act
    ownershipService.setOwnership(house, alice, new BigDecimal("0.5"), carol);
    ownershipService.replaceOwnership(house, Map.of(alice, BigDecimal.ONE), carol);
    ownershipService.removeOwnership(house, bob, carol);

    // Assert
    verify(auditService).logEvent(eq(carol), eq("OWNERSHIP_SET"), eq("Account"), eq(1L), anyString());
    verify(auditService)
        .logEvent(eq(carol), eq("OWNERSHIP_REPLACED"), eq("Account"), eq(1L), anyString(), anyMap());
    verify(auditService)
        .logEvent(eq(carol), eq("OWNERSHIP_REMOVED"), eq("Account"), eq(1L), anyString());
    verify(auditService, never())
        .logEvent(eq(alice), anyString(), anyString(), any(), anyString());
  }

  @Test
  void ownershipWeight_withNoUsers_isZero() {
    assertEquals(BigDecimal.ZERO, ownershipService.ownershipWeight(house, List.of()));
    verifyNoInteractions(shareRepository);
  }

  @Test
  void ownershipWeight_sumsSharesOfSelectedUsers() {
    when(shareRepository.sumForAccountAndUsers(house, List.of(alice, bob))).thenReturn(new BigDecimal("0.75"));

    BigDecimal weight = ownershipService.ownershipWeight(house, List.of(alice, bob));

    assertEquals(0, new BigDecimal("0.75").compareTo(weight));
  }

  @Test
  void applyDefaultOwnership_firstUserPolicy_givesWholeAccountToFirstUser() {
    // Arrange
    when(userRepository.findFirstByActiveTrueOrderByCreatedAtAscIdAsc()).thenReturn(Optional.of(alice));
    when(shareRepository.save(any(OwnershipShare.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act
    Optional<OwnershipShare> share = ownershipService.applyDefaultOwnership(house, bob);

    // Assert
    assertTrue(share.isPresent());
    assertEquals(alice, share.get().getUser());
    assertEquals(0, BigDecimal.ONE.compareTo(share.get().getPercentage()));
  }

  @Test
  void applyDefaultOwnership_creatorPolicy_givesWholeAccountToCreator() {
    // Arrange
    properties.getOwnership().setDefaultOwnerPolicy(DefaultOwnerPolicy.CREATOR);
    when(shareRepository.save(any(OwnershipShare.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act
    Optional<OwnershipShare> share = ownershipService.applyDefaultOwnership(house, bob);

    // Assert
    assertEquals(bob, share.orElseThrow().getUser());
    verifyNoInteractions(userRepository);
  }

  @Test
  void applyDefaultOwnership_nonePolicy_leavesAccountUnowned() {
    properties.getOwnership().setDefaultOwnerPolicy(DefaultOwnerPolicy.NONE);

    Optional<OwnershipShare> share = ownershipService.applyDefaultOwnership(house, alice);

    assertTrue(share.isEmpty());
    verifyNoInteractions(shareRepository);
  }

  @Test
  void applyDefaultOwnership_withoutAnyUser_createsNothing() {
    when(userRepository.findFirstByActiveTrueOrderByCreatedAtAscIdAsc()).thenReturn(Optional.empty());

    assertTrue(ownershipService.applyDefaultOwnership(house, null).isEmpty());
    verify(shareRepository, never()).save(any());
  }

  @Test
  void assignUnownedAccounts_givesEachUnownedAccountToUser() {
    // Arrange
    Account car = new Account("Car", Account.AccountType.ASSET, Account.AccountSubtype.EQUIPMENT);
    car.setId(2L);
    when(shareRepository.findAccountsWithoutOwners()).thenReturn(List.of(house, car));

    // Act
    int assigned = ownershipService.assignUnownedAccounts(alice);

    // Assert
    assertEquals(2, assigned);
    verify(shareRepository, times(2)).save(any(OwnershipShare.class));
  }

  private static User user(Long id, String name) {
    User user = new User(name, name);
    user.setId(id);
    return user;
  }
}
