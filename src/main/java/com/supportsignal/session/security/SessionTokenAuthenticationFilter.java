package com.supportsignal.session.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import com.supportsignal.session.domain.User;
import com.supportsignal.session.service.SessionResolverService;
import com.supportsignal.session.service.SessionResolverService.ResolvedIdentity;
import com.supportsignal.session.util.RequestTokens;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the request token into a {@link SessionPrincipal}.
 *
 * The token is read by {@link RequestTokens}. Requests without a live token
 * continue unauthenticated; access rules in SecurityConfig decide what that
 * means for each path.
 *
 * Store connectivity failures during resolution are handed to the MVC
 * exception resolvers, so they render as 503 through GlobalExceptionHandler
 * instead of surfacing as an unauthenticated request.
 */
@Slf4j
@Component
public class SessionTokenAuthenticationFilter extends OncePerRequestFilter {

    private final SessionResolverService sessionResolverService;
    private final HandlerExceptionResolver handlerExceptionResolver;

    public SessionTokenAuthenticationFilter(
            SessionResolverService sessionResolverService,
            @Qualifier("handlerExceptionResolver") HandlerExceptionResolver handlerExceptionResolver) {
        this.sessionResolverService = sessionResolverService;
        this.handlerExceptionResolver = handlerExceptionResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = RequestTokens.extract(request);

        if (token != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            Optional<ResolvedIdentity> resolved;
            try {
                resolved = sessionResolverService.resolve(token);
            } catch (DataAccessResourceFailureException | CannotCreateTransactionException ex) {
                log.error("Token resolution failed on {}: {}", request.getRequestURI(), ex.getMessage());
                handlerExceptionResolver.resolveException(request, response, null, ex);
                return;
            }

            resolved.ifPresent(identity -> {
                UsernamePasswordAuthenticationToken authentication = toAuthentication(identity);
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated user {} (impersonating={})",
                    identity.user().getId(), identity.impersonating());
            });
        }

        filterChain.doFilter(request, response);
    }

    private UsernamePasswordAuthenticationToken toAuthentication(ResolvedIdentity identity) {
        User user = identity.user();
        SessionPrincipal principal = new SessionPrincipal(
            user.getId(),
            user.getEmail(),
            user.getRole(),
            identity.adminUserId(),
            identity.impersonationCorrelationId()
        );

        return new UsernamePasswordAuthenticationToken(
            principal,
            null,
            List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name()))
        );
    }
}
