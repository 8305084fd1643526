package cn.bitsleep.taskrush.web;

import cn.bitsleep.taskrush.auth.SecurityConfig;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One access-log line per request. Runs ahead of the security chain so rejected requests
 * are logged too; the security context is cleared by the time the chain returns, so the
 * account comes from the request attribute the bearer filter sets.
 */
@Slf4j
@Component
@Order(SecurityProperties.DEFAULT_FILTER_ORDER - 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long tookMs = (System.nanoTime() - start) / 1_000_000;
            boolean authenticated = request.getAttribute(SecurityConfig.ACCOUNT_ATTRIBUTE) != null;
            log.info("{} {} -> {} ({} ms){}", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), tookMs, authenticated ? " (auth)" : "");
        }
    }
}
