package com.example.ledger.repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.OwnershipShare;
import com.example.ledger.domain.User;

@Repository
public interface OwnershipShareRepository extends JpaRepository<OwnershipShare, Long> {

  List<OwnershipShare> findByAccountOrderByPercentageDesc(Account account);

  List<OwnershipShare> findByUser(User user);

  Optional<OwnershipShare> findByAccountAndUser(Account account, User user);

  boolean existsByAccount(Account account);

  void deleteByAccount(Account account);

  @Query(
      "SELECT COALESCE(SUM(os.percentage), 0) FROM OwnershipShare os "
          + "WHERE os.account = :account AND os.user <> :user")
  BigDecimal sumForAccountExcludingUser(
      @Param("account") Account account, @Param("user") User user);

  @Query(
      "SELECT COALESCE(SUM(os.percentage), 0) FROM OwnershipShare os "
          + "WHERE os.account = :account AND os.user IN :users")
  BigDecimal sumForAccountAndUsers(
      @Param("account") Account account, @Param("users") Collection<User> users);

  @Query(
      "SELECT COALESCE(SUM(os.percentage), 0) FROM OwnershipShare os WHERE os.account = :account")
  BigDecimal sumForAccount(@Param("account") Account account);

  @Query(
      "SELECT a FROM Account a WHERE NOT EXISTS "
          + "(SELECT os FROM OwnershipShare os WHERE os.account = a)")
  List<Account> findAccountsWithoutOwners();
}
