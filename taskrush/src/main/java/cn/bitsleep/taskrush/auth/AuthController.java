package cn.bitsleep.taskrush.auth;

import cn.bitsleep.taskrush.domain.Account;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {
    private final AccountService accountService;
    private final TokenService tokenService;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginReq req) {
        AccountService.LoginResult result = accountService.login(req.getUsername(), req.getPassword());
        Account account = result.getAccount();
        String token = tokenService.issue(account.getId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", result.isCreated() ? "Account created and logged in" : "Logged in");
        body.put("created", result.isCreated());
        body.put("username", account.getUsername());
        body.put("userId", account.getId());
        body.put("token", token);
        return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @PostMapping("/logout")
    public Map<String, String> logout(Authentication authentication) {
        if (!isAuthenticated(authentication)) return Map.of("message", "No active session");
        tokenService.revoke(authentication.getName());
        return Map.of("message", "Logged out");
    }

    @GetMapping("/me")
    public Map<String, Object> me(Authentication authentication) {
        if (!isAuthenticated(authentication)) return Map.of("authenticated", false);
        return accountService.find(authentication.getName())
                .<Map<String, Object>>map(a -> {
                    Map<String, Object> user = new LinkedHashMap<>();
                    user.put("id", a.getId());
                    user.put("username", a.getUsername());
                    user.put("createdAt", a.getCreatedAt() == null ? null : a.getCreatedAt().toString());
                    return Map.of("authenticated", true, "user", user);
                })
                .orElseGet(() -> Map.of("authenticated", false));
    }

    private static boolean isAuthenticated(Authentication authentication) {
        return authentication != null && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken);
    }

    @Data
    public static class LoginReq {
        @NotBlank(message = "username and password required")
        private String username;
        @NotBlank(message = "username and password required")
        private String password;
    }
}
