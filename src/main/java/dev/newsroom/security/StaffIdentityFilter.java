package dev.newsroom.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.repository.StaffUserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;

/**
 * Resolves the staff member named by the {@code X-Staff-Id} header set by the
 * upstream identity provider and publishes it as the authenticated principal.
 * Requests without the header continue unauthenticated.
 */
@Component
@Slf4j
public class StaffIdentityFilter implements WebFilter {

    public static final String STAFF_ID_HEADER = "X-Staff-Id";

    private final StaffUserRepository staffUserRepository;

    /**
     * Short-lived cache; a deactivated staff member is locked out within a minute.
     */
    private final Cache<Long, StaffUser> staffCache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofSeconds(60))
            .build();

    public StaffIdentityFilter(StaffUserRepository staffUserRepository) {
        this.staffUserRepository = staffUserRepository;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String header = exchange.getRequest().getHeaders().getFirst(STAFF_ID_HEADER);
        if (!StringUtils.hasText(header)) {
            return chain.filter(exchange);
        }

        Long staffId = parseStaffId(header);
        if (staffId == null) {
            log.warn("Access denied: malformed {} header for path {}", STAFF_ID_HEADER,
                    exchange.getRequest().getPath());
            return unauthorizedResponse(exchange, "Malformed staff id");
        }

        StaffUser cached = staffCache.getIfPresent(staffId);
        Mono<StaffUser> staffMono = cached != null
                ? Mono.just(cached)
                : staffUserRepository.findById(staffId)
                        .doOnNext(staff -> staffCache.put(staffId, staff));

        return staffMono
                .filter(staff -> staff.isActiveStaff() && staff.role() != null)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Access denied: staff {} not found or inactive", staffId);
                    return unauthorizedResponse(exchange, "Staff member not found or inactive")
                            .then(Mono.empty());
                }))
                .flatMap(staff -> {
                    log.debug("Authenticated staff {} as {}", staff.getId(), staff.getStaffRole());
                    var auth = new UsernamePasswordAuthenticationToken(
                            staff, null,
                            Collections.singleton(new SimpleGrantedAuthority("ROLE_" + staff.getStaffRole())));
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
                });
    }

    /** Drops a cached entry, e.g. after a role change. */
    public void evict(Long staffId) {
        staffCache.invalidate(staffId);
    }

    private static Long parseStaffId(String header) {
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + message + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
