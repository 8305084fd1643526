package cn.bitsleep.taskrush.auth;

import cn.bitsleep.taskrush.domain.Account;
import cn.bitsleep.taskrush.repo.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final AccountRepository repo;
    private final PasswordEncoder passwordEncoder;

    /**
     * Logs in with the given credentials. An unknown username registers a new account
     * on the spot; a known one must match its stored hash.
     */
    @Transactional
    public LoginResult login(String username, String password) {
        String normalized = normalize(username);
        Optional<Account> existing = repo.findByUsername(normalized);
        if (existing.isEmpty()) {
            Account account = Account.builder()
                    .id(UUID.randomUUID().toString())
                    .username(normalized)
                    .passwordHash(passwordEncoder.encode(password))
                    .build();
            Account saved = repo.save(account);
            log.info("Registered account {} ({})", normalized, saved.getId());
            return new LoginResult(saved, true);
        }
        Account account = existing.get();
        if (!passwordEncoder.matches(password, account.getPasswordHash())) {
            log.info("Rejected login for {}", normalized);
            throw new InvalidCredentialsException();
        }
        return new LoginResult(account, false);
    }

    @Transactional(readOnly = true)
    public Optional<Account> find(String id) {
        return repo.findById(id);
    }

    static String normalize(String username) {
        return username.trim().toLowerCase(Locale.ROOT);
    }

    @Value
    public static class LoginResult {
        Account account;
        boolean created;
    }
}
