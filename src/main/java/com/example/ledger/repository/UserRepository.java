package com.example.ledger.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.User;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

  Optional<User> findByName(String name);

  boolean existsByName(String name);

  /** The earliest-created active user, who receives default ownership of new accounts. */
  Optional<User> findFirstByActiveTrueOrderByCreatedAtAscIdAsc();

  List<User> findByActiveTrueOrderByName();
}
