package cn.bitsleep.taskrush.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;

@Configuration
public class SecurityConfig {

    /** Request attribute holding the account id once a bearer token is accepted. */
    public static final String ACCOUNT_ATTRIBUTE = "taskrush.accountId";

    private static final int BCRYPT_STRENGTH = 10;

    private final TokenService tokenService;
    public SecurityConfig(TokenService tokenService) { this.tokenService = tokenService; }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
    http
        .cors(c -> {})
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(reg -> reg
            // login / logout / me answer anonymous callers too
            .requestMatchers("/api/auth/**", "/error").permitAll()
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .anyRequest().authenticated()
        )
        .exceptionHandling(eh -> eh.authenticationEntryPoint(unauthorizedEntryPoint()))
        .addFilterBefore(new JwtFilter(tokenService), UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }

    static AuthenticationEntryPoint unauthorizedEntryPoint() {
        return (request, response, ex) -> {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"timestamp\":\"" + Instant.now() + "\",\"status\":401,"
                    + "\"error\":\"UNAUTHORIZED\",\"message\":\"Authentication required\"}");
        };
    }

    /**
     * Resolves {@code Authorization: Bearer <jwt>} to an authenticated principal named
     * after the account id. Anything else passes through unauthenticated.
     */
    static class JwtFilter extends OncePerRequestFilter {
        private static final String BEARER = "Bearer ";

        private final TokenService tokenService;
        JwtFilter(TokenService tokenService){this.tokenService = tokenService;}

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
            String token = bearerToken(request);
            String accountId = token == null ? null : tokenService.validate(token);
            if (accountId != null) {
                UserDetails ud = User.withUsername(accountId).password("NOP").authorities(Collections.emptyList()).build();
                var authToken = new UsernamePasswordAuthenticationToken(ud, token, ud.getAuthorities());
                SecurityContextHolder.getContext().setAuthentication(authToken);
                request.setAttribute(ACCOUNT_ATTRIBUTE, accountId);
            }
            filterChain.doFilter(request, response);
        }

        private static String bearerToken(HttpServletRequest request) {
            String header = request.getHeader("Authorization");
            if (header == null || !header.startsWith(BEARER)) return null;
            String token = header.substring(BEARER.length()).trim();
            return token.isEmpty() ? null : token;
        }
    }
}
