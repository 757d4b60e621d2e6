package com.gt.wordreminder.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates webhook calls by the secret Telegram echoes in {@value #SECRET_HEADER}, which is the
 * secret_token given to setWebhook.
 */
@Component
public class WebhookSecretFilter extends OncePerRequestFilter {

    private final static Logger log = LoggerFactory.getLogger(WebhookSecretFilter.class);

    public static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    public static final String WEBHOOK_ROLE = "ROLE_TELEGRAM_WEBHOOK";

    private final byte[] webhookSecret;

    @Autowired
    public WebhookSecretFilter(@Value("${wordreminder.telegram.webhookSecret:}") String webhookSecret) {
        if (webhookSecret.isBlank()) {
            log.warn("No webhook secret configured. Webhook requests are accepted without authentication.");
        }

        this.webhookSecret = webhookSecret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        String presentedSecret = request.getHeader(SECRET_HEADER);

        if (webhookSecret.length == 0 || (presentedSecret != null && MessageDigest.isEqual(webhookSecret, presentedSecret.getBytes(StandardCharsets.UTF_8)))) {
            UsernamePasswordAuthenticationToken authenticationToken = new UsernamePasswordAuthenticationToken("telegram", null, List.of(new SimpleGrantedAuthority(WEBHOOK_ROLE)));
            authenticationToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authenticationToken);
        } else if (presentedSecret != null) {
            log.warn("Webhook request from {} presented an invalid secret", request.getRemoteAddr());
        }

        filterChain.doFilter(request, response);
    }
}
