package com.supportsignal.session.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.StaticApplicationContext;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.servlet.mvc.method.annotation.ExceptionHandlerExceptionResolver;

import com.supportsignal.session.domain.ImpersonationSession;
import com.supportsignal.session.domain.Session;
import com.supportsignal.session.domain.User;
import com.supportsignal.session.domain.UserRole;
import com.supportsignal.session.repository.ImpersonationSessionRepository;
import com.supportsignal.session.repository.SessionRepository;
import com.supportsignal.session.repository.UserRepository;
import com.supportsignal.session.service.SessionResolverService;
import com.supportsignal.session.util.GlobalExceptionHandler;
import com.supportsignal.session.util.MetricsHelper;
import com.supportsignal.session.util.MutableClock;
import com.supportsignal.session.util.RequestTokens;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class SessionTokenAuthenticationFilterTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private ImpersonationSessionRepository impersonationSessionRepository;

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private UserRepository userRepository;

    private final User worker = User.builder()
        .id(2L).name("Worker").email("worker@acme.test").role(UserRole.FRONTLINE_WORKER).build();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void doFilter_WithRegularToken_ShouldInstallPrincipal() throws Exception {
        // Given
        when(impersonationSessionRepository.findLiveBySessionToken("tok", NOW)).thenReturn(Optional.empty());
        when(sessionRepository.findActiveBySessionToken("tok", NOW)).thenReturn(Optional.of(
            Session.builder().id(1L).userId(2L).sessionToken("tok").expiresAt(NOW.plusSeconds(60)).build()));
        when(userRepository.findById(2L)).thenReturn(Optional.of(worker));

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/me");
        request.addHeader(RequestTokens.SESSION_TOKEN_HEADER, "tok");

        // When
        Authentication authentication = runFilter(request);

        // Then
        assertThat(authentication).isNotNull();
        SessionPrincipal principal = (SessionPrincipal) authentication.getPrincipal();
        assertThat(principal.userId()).isEqualTo(2L);
        assertThat(principal.isImpersonating()).isFalse();
        assertThat(authentication.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_FRONTLINE_WORKER");
    }

    @Test
    void doFilter_WithOverlayBearerToken_ShouldCarryImpersonator() throws Exception {
        ImpersonationSession overlay = ImpersonationSession.builder()
            .id(9L).adminUserId(1L).targetUserId(2L).sessionToken("imp_tok")
            .correlationId("corr-9").expiresAt(NOW.plusSeconds(600)).active(true).build();
        when(impersonationSessionRepository.findLiveBySessionToken("imp_tok", NOW)).thenReturn(Optional.of(overlay));
        when(userRepository.findById(2L)).thenReturn(Optional.of(worker));

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/me");
        request.addHeader("Authorization", "Bearer imp_tok");

        Authentication authentication = runFilter(request);

        SessionPrincipal principal = (SessionPrincipal) authentication.getPrincipal();
        assertThat(principal.isImpersonating()).isTrue();
        assertThat(principal.impersonatorId()).isEqualTo(1L);
        assertThat(principal.impersonationCorrelationId()).isEqualTo("corr-9");
    }

    @Test
    void doFilter_WithoutToken_ShouldSkipResolution() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/validate");

        Authentication authentication = runFilter(request);

        assertThat(authentication).isNull();
        verify(sessionRepository, never()).findActiveBySessionToken(anyString(), any());
    }

    @Test
    void doFilter_WhenStoreIsDown_ShouldAnswerServiceUnavailable() throws Exception {
        // Given
        when(impersonationSessionRepository.findLiveBySessionToken("tok", NOW))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/me");
        request.addHeader(RequestTokens.SESSION_TOKEN_HEADER, "tok");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        newFilter().doFilter(request, response, chain);

        // Then
        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getContentAsString()).contains("\"error\":\"StoreUnavailable\"");
        assertThat(chain.getRequest()).isNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    private Authentication runFilter(MockHttpServletRequest request) throws Exception {
        newFilter().doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
        return SecurityContextHolder.getContext().getAuthentication();
    }

    private SessionTokenAuthenticationFilter newFilter() {
        SessionResolverService resolver = new SessionResolverService(
            impersonationSessionRepository, sessionRepository, userRepository,
            new MetricsHelper(new SimpleMeterRegistry()), new MutableClock(NOW));
        return new SessionTokenAuthenticationFilter(resolver, adviceResolver());
    }

    private static ExceptionHandlerExceptionResolver adviceResolver() {
        StaticApplicationContext context = new StaticApplicationContext();
        context.registerSingleton("globalExceptionHandler", GlobalExceptionHandler.class);
        context.refresh();

        ExceptionHandlerExceptionResolver resolver = new ExceptionHandlerExceptionResolver();
        resolver.getMessageConverters().add(new MappingJackson2HttpMessageConverter());
        resolver.setApplicationContext(context);
        resolver.afterPropertiesSet();
        return resolver;
    }
}
