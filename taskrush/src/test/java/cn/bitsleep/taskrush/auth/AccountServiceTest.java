package cn.bitsleep.taskrush.auth;

import cn.bitsleep.taskrush.domain.Account;
import cn.bitsleep.taskrush.repo.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private AccountRepository repo;

    // low cost factor keeps the suite fast
    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private AccountService accounts;

    @BeforeEach
    void setUp() {
        accounts = new AccountService(repo, encoder);
    }

    @Test
    void unknownUsernameRegistersNormalizedAccount() {
        when(repo.findByUsername("alice")).thenReturn(Optional.empty());
        when(repo.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

        AccountService.LoginResult result = accounts.login("  Alice ", "s3cret");

        assertTrue(result.isCreated());
        ArgumentCaptor<Account> captor = ArgumentCaptor.forClass(Account.class);
        verify(repo).save(captor.capture());
        Account saved = captor.getValue();
        assertEquals("alice", saved.getUsername());
        assertNotNull(saved.getId());
        assertNotEquals("s3cret", saved.getPasswordHash());
        assertTrue(encoder.matches("s3cret", saved.getPasswordHash()));
    }

    @Test
    void knownUsernameWithRightPasswordLogsIn() {
        Account alice = Account.builder().id("acc-1").username("alice").passwordHash(encoder.encode("s3cret")).build();
        when(repo.findByUsername("alice")).thenReturn(Optional.of(alice));

        AccountService.LoginResult result = accounts.login("ALICE", "s3cret");

        assertFalse(result.isCreated());
        assertSame(alice, result.getAccount());
        verify(repo, never()).save(any());
    }

    @Test
    void wrongPasswordIsRejected() {
        Account alice = Account.builder().id("acc-1").username("alice").passwordHash(encoder.encode("s3cret")).build();
        when(repo.findByUsername("alice")).thenReturn(Optional.of(alice));

        assertThrows(InvalidCredentialsException.class, () -> accounts.login("alice", "guess"));
    }
}
