package com.gt.wordreminder.conf;

import com.gt.wordreminder.filter.WebhookSecretFilter;
import jakarta.servlet.DispatcherType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.logout.LogoutFilter;

@Configuration
@EnableWebSecurity
public class WebSecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, WebhookSecretFilter webhookSecretFilter) throws Exception {
        // Telegram posts without cookies or CSRF tokens, the header secret is the only credential
        http.csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests((requests) -> requests
                        .dispatcherTypeMatchers(DispatcherType.FORWARD, DispatcherType.ERROR).permitAll()
                        .requestMatchers("/telegram/webhook").hasAuthority(WebhookSecretFilter.WEBHOOK_ROLE)
                        .anyRequest().denyAll())
                .addFilterAfter(webhookSecretFilter, LogoutFilter.class);

        return http.build();
    }
}
