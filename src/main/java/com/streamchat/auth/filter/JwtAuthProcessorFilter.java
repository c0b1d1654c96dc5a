package com.streamchat.auth.filter;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.auth.provider.IdentityProvider;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves the caller's identity from its bearer token. The identity becomes the principal of
 * the request's {@code Authentication}, with the platform role as {@code ROLE_*} authority, and
 * is also exposed as the {@link StreamIdentity#ATTRIBUTE} request attribute for the WebSocket
 * handshake, which cannot take an injected {@code Authentication}. Requests without a valid
 * token continue anonymously; the security chain decides what an anonymous caller may do.
 *
 * Token sources, first match wins: {@code Authorization: Bearer} header, {@code Authorization}
 * cookie, {@code token} query parameter (browsers cannot set headers on a WebSocket upgrade).
 */
public class JwtAuthProcessorFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthProcessorFilter.class);

    private static final String AUTH_HEADER = "Authorization";
    private static final String AUTH_COOKIE_NAME = "Authorization";
    private static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ROLE_PREFIX = "ROLE_";

    private final IdentityProvider identityProvider;

    public JwtAuthProcessorFilter(IdentityProvider identityProvider) {
        this.identityProvider = identityProvider;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
                                    throws ServletException, IOException {

        Optional<String> tokenOpt = extractToken(request);
        if (tokenOpt.isEmpty()) {
            logger.debug("[auth] no token: method={}, uri={}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        Optional<StreamIdentity> identity = identityProvider.verify(tokenOpt.get());
        if (identity.isEmpty()) {
            logger.warn("[auth] token verification failed: uri={}", request.getRequestURI());
            SecurityContextHolder.clearContext();
            filterChain.doFilter(request, response);
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                identity.get(), null, authoritiesOf(identity.get()));
        authentication.setDetails(identity.get().getUsername());
        SecurityContextHolder.getContext().setAuthentication(authentication);
        request.setAttribute(StreamIdentity.ATTRIBUTE, identity.get());
        logger.info("[auth] authenticated: userId={}, role={}", identity.get().getUserId(), identity.get().getRole());

        filterChain.doFilter(request, response);
    }

    public static List<SimpleGrantedAuthority> authoritiesOf(StreamIdentity identity) {
        if (identity.getRole() == null || identity.getRole().isBlank()) {
            return List.of();
        }
        return List.of(new SimpleGrantedAuthority(ROLE_PREFIX + identity.getRole().toUpperCase(Locale.ROOT)));
    }

    private Optional<String> extractToken(HttpServletRequest request) {
        String header = request.getHeader(AUTH_HEADER);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return Optional.of(header.substring(BEARER_PREFIX.length()).trim());
        }
        if (request.getCookies() != null) {
            Optional<String> cookie = Arrays.stream(request.getCookies())
                    .filter(c -> AUTH_COOKIE_NAME.equals(c.getName()))
                    .map(Cookie::getValue)
                    .filter(v -> !v.isBlank())
                    .findFirst();
            if (cookie.isPresent()) {
                return cookie;
            }
        }
        return Optional.ofNullable(request.getParameter(TOKEN_PARAM)).filter(v -> !v.isBlank());
    }
}
