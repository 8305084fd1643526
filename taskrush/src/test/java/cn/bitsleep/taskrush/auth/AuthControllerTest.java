package cn.bitsleep.taskrush.auth;

import cn.bitsleep.taskrush.domain.Account;
import cn.bitsleep.taskrush.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuthControllerTest {

    private final Account alice = Account.builder()
            .id("acc-1")
            .username("alice")
            .passwordHash("hash")
            .createdAt(Instant.parse("2026-01-15T08:00:00Z"))
            .build();
    private final Authentication aliceAuth = new UsernamePasswordAuthenticationToken("acc-1", null, List.of());

    private AccountService accounts;
    private TokenService tokens;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        accounts = Mockito.mock(AccountService.class);
        tokens = Mockito.mock(TokenService.class);
        mvc = MockMvcBuilders.standaloneSetup(new AuthController(accounts, tokens))
                .setControllerAdvice(new GlobalExceptionHandler(false))
                .build();
    }

    @Test
    void firstLoginCreatesAccount() throws Exception {
        when(accounts.login("Alice", "pw")).thenReturn(new AccountService.LoginResult(alice, true));
        when(tokens.issue("acc-1")).thenReturn("jwt-token");

        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"Alice\",\"password\":\"pw\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true))
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.userId").value("acc-1"))
                .andExpect(jsonPath("$.token").value("jwt-token"));
    }

    @Test
    void returningLoginIs200() throws Exception {
        when(accounts.login("alice", "pw")).thenReturn(new AccountService.LoginResult(alice, false));
        when(tokens.issue("acc-1")).thenReturn("jwt-token");

        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"pw\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(false))
                .andExpect(jsonPath("$.message").value("Logged in"));
    }

    @Test
    void missingPasswordIsBadRequest() throws Exception {
        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("username and password required"));

        verifyNoInteractions(accounts, tokens);
    }

    @Test
    void wrongPasswordIs401() throws Exception {
        when(accounts.login("alice", "nope")).thenThrow(new InvalidCredentialsException());

        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid password"));

        verify(tokens, never()).issue(anyString());
    }

    @Test
    void meWithoutTokenIsAnonymous() throws Exception {
        mvc.perform(get("/api/auth/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false));
    }

    @Test
    void meDescribesCaller() throws Exception {
        when(accounts.find("acc-1")).thenReturn(Optional.of(alice));

        mvc.perform(get("/api/auth/me").principal(aliceAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.user.username").value("alice"))
                .andExpect(jsonPath("$.user.createdAt").value("2026-01-15T08:00:00Z"));
    }

    @Test
    void meForDeletedAccountIsAnonymous() throws Exception {
        when(accounts.find("acc-1")).thenReturn(Optional.empty());

        mvc.perform(get("/api/auth/me").principal(aliceAuth))
                .andExpect(jsonPath("$.authenticated").value(false));
    }

    @Test
    void logoutRevokesToken() throws Exception {
        mvc.perform(post("/api/auth/logout").principal(aliceAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logged out"));

        verify(tokens).revoke("acc-1");
    }

    @Test
    void logoutWithoutSession() throws Exception {
        mvc.perform(post("/api/auth/logout"))
                .andExpect(jsonPath("$.message").value("No active session"));

        verifyNoInteractions(tokens);
    }
}
