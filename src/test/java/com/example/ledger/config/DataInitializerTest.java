package com.example.ledger.config;

import static org.mockito.Mockito.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.domain.User;
import com.example.ledger.service.UserService;

@ExtendWith(MockitoExtension.class)
class DataInitializerTest {

  @Mock private UserService userService;

  @Test
  void run_withoutUsers_createsDefaultUser() {
    when(userService.findFirstUser()).thenReturn(Optional.empty());

    new DataInitializer(userService, true, "household", "Household").run(null);

    verify(userService).createUser("household", "Household");
  }

  @Test
  void run_whenUserExists_createsNothing() {
    when(userService.findFirstUser()).thenReturn(Optional.of(new User("alice", "Alice")));

    new DataInitializer(userService, true, "household", "Household").run(null);

    verify(userService, never()).createUser(any(), any());
  }

  @Test
  void run_whenDisabled_doesNothing() {
    new DataInitializer(userService, false, "household", "Household").run(null);

    verifyNoInteractions(userService);
  }
}
