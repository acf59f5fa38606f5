package com.linlay.assistantgw.security;

import com.linlay.assistantgw.config.AppAuthProperties;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

public class ApiJwtAuthWebFilter implements WebFilter {

    public static final String JWT_PRINCIPAL_ATTR = "APP_JWT_PRINCIPAL";

    private static final String AUTH_PREFIX = "Bearer ";
    private static final List<String> PROTECTED_PREFIXES = List.of("/runs", "/ingest", "/retrieval");

    private final AppAuthProperties authProperties;
    private final JwtTokenVerifier jwtVerifier;

    public ApiJwtAuthWebFilter(AppAuthProperties authProperties, JwtTokenVerifier jwtVerifier) {
        this.authProperties = authProperties;
        this.jwtVerifier = jwtVerifier;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled()) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        if (!isProtected(path)) {
            return chain.filter(exchange);
        }
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        String token = resolveBearerToken(exchange);
        JwtTokenVerifier.AuthenticatedUser principal = jwtVerifier.verify(token).orElse(null);
        if (principal == null) {
            return writeUnauthorized(exchange);
        }

        exchange.getAttributes().put(JWT_PRINCIPAL_ATTR, principal);
        return chain.filter(exchange);
    }

    private boolean isProtected(String path) {
        if (!StringUtils.hasText(path)) {
            return false;
        }
        for (String prefix : PROTECTED_PREFIXES) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst("Authorization");
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? token : null;
    }

    private Mono<Void> writeUnauthorized(ServerWebExchange exchange) {
        byte[] body = "{\"error\":\"unauthorized\"}".getBytes(StandardCharsets.UTF_8);
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
