package dev.newsroom.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags each request with an id, taken from {@code X-Request-ID} when the caller
 * supplies a well-formed one. The id is echoed on the response and put in the
 * Reactor context under {@link #REQUEST_ID_CONTEXT_KEY}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String external = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = sanitize(external);
        if (requestId == null) {
            if (external != null && !external.isBlank()) {
                log.warn("Rejected malformed external request id");
            }
            requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .header(REQUEST_ID_HEADER, requestId)
                .build();
        ServerWebExchange mutatedExchange = exchange.mutate().request(mutatedRequest).build();
        mutatedExchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        return chain.filter(mutatedExchange)
                .contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, requestId));
    }

    private String sanitize(String value) {
        if (value == null || value.isBlank() || value.length() > MAX_ID_LENGTH) {
            return null;
        }
        return VALID_ID_PATTERN.matcher(value).matches() ? value : null;
    }
}
