package com.supportsignal.session.config;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.supportsignal.session.security.SessionTokenAuthenticationFilter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Security configuration.
 *
 * Session operations take their token as an explicit argument and do their
 * own checks, so the API paths stay open at this layer. The token filter
 * still resolves the caller on every request so downstream code can read
 * the effective user from the security context.
 *
 * Current setup:
 * - Stateless (no HTTP session, no cookies)
 * - CSRF off (tokens travel in headers, not cookies)
 * - /api/sessions/me requires a resolved identity
 * - /api/sessions/cleanup requires a system admin
 */
@Slf4j
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final SessionTokenAuthenticationFilter sessionTokenAuthenticationFilter;

    /**
     * Configures HTTP security for the application.
     *
     * @param http HttpSecurity builder
     * @return configured SecurityFilterChain
     * @throws Exception if configuration fails
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        log.info("Configuring stateless security filter chain with session token resolution");

        http
            .csrf(AbstractHttpConfigurer::disable)

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/api/sessions/me").authenticated()
                .requestMatchers("/api/sessions/cleanup").hasRole("SYSTEM_ADMIN")
                .requestMatchers("/api/**").permitAll()
                .anyRequest().denyAll()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            .addFilterBefore(sessionTokenAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)

            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable);

        return http.build();
    }

    /**
     * Keeps the token filter out of the plain servlet chain; it runs inside
     * the security filter chain only.
     *
     * @param filter the token filter bean
     * @return disabled registration
     */
    @Bean
    public FilterRegistrationBean<SessionTokenAuthenticationFilter> sessionTokenFilterRegistration(
            SessionTokenAuthenticationFilter filter) {
        FilterRegistrationBean<SessionTokenAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
