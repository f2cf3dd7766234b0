package com.example.ledger.repository;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.Account;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

  // Sibling lookups return lists: more than one row means the uniqueness invariant is broken.

  @Query("SELECT a FROM Account a WHERE a.parent IS NULL AND a.name = :name")
  List<Account> findRootsByName(@Param("name") String name);

  List<Account> findByParentAndName(Account parent, String name);

  @Query("SELECT a FROM Account a WHERE a.parent IS NULL ORDER BY a.name")
  List<Account> findRoots();

  List<Account> findByParentOrderByName(Account parent);

  List<Account> findByParent(Account parent);

  List<Account> findByActiveOrderByFullPath(boolean active);

  List<Account> findByTypeAndActiveOrderByFullPath(Account.AccountType type, boolean active);

  Optional<Account> findByFullPath(String fullPath);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT a FROM Account a WHERE a.id = :id")
  Optional<Account> findByIdForUpdate(@Param("id") Long id);
}
