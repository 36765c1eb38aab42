package dev.newsroom.exception;

import dev.newsroom.config.RequestIdFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final List<Locale> SUPPORTED_LOCALES = List.of(Locale.ENGLISH);

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.NOT_FOUND, "error.not_found", ex.getMessage(), exchange).build());
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleAccessDenied(AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.FORBIDDEN, "error.forbidden", ex.getMessage(), exchange).build());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex, ServerWebExchange exchange) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, "error.invalid_transition", ex.getMessage(), exchange).build());
    }

    @ExceptionHandler(StaleStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleStaleState(StaleStateException ex, ServerWebExchange exchange) {
        log.info("Stale state rejected: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, "error.stale_state", ex.getMessage(), exchange)
                .retryable(true)
                .build());
    }

    @ExceptionHandler(AlreadyTerminalException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleAlreadyTerminal(AlreadyTerminalException ex, ServerWebExchange exchange) {
        log.warn("Already terminal: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, "error.already_terminal", ex.getMessage(), exchange).build());
    }

    @ExceptionHandler(DuplicateResourceException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleDuplicateResource(DuplicateResourceException ex, ServerWebExchange exchange) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, "error.conflict", ex.getMessage(), exchange).build());
    }

    @ExceptionHandler(ValidationFailedException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationFailed(ValidationFailedException ex, ServerWebExchange exchange) {
        log.warn("Validation failed on '{}': {}", ex.getField(), ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.validation_failed", ex.getMessage(), exchange)
                .validationErrors(Map.of(ex.getField(), ex.getMessage()))
                .build());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleBindErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage()
                                : msg(locale, "error.invalid_value"),
                        (existing, ignored) -> existing));
        log.warn("Request binding failed: {}", errors);
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_data", exchange)
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });
        log.warn("Constraint violations: {}", errors);
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_params", exchange)
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        String reason = ex.getReason() != null ? ex.getReason() : "error.invalid_request";
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.bad_request", reason, exchange).build());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, "error.internal_server_error",
                "error.unexpected_error", exchange).build());
    }

    private ErrorResponse.ErrorResponseBuilder build(HttpStatus status, String errorKey, String message,
                                                     ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(msg(locale, errorKey))
                .message(msg(locale, message))
                .path(exchange.getRequest().getPath().value())
                .requestId(exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER));
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        String acceptLanguage = exchange.getRequest().getHeaders().getFirst(HttpHeaders.ACCEPT_LANGUAGE);
        if (acceptLanguage != null && !acceptLanguage.isBlank()) {
            try {
                Locale matched = Locale.lookup(Locale.LanguageRange.parse(acceptLanguage), SUPPORTED_LOCALES);
                if (matched != null) {
                    return matched;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Accept-Language header: {}", acceptLanguage);
            }
        }
        return Locale.ENGLISH;
    }

    /**
     * Resolves message keys; free-text messages pass through unchanged.
     */
    private String msg(Locale locale, String code, Object... args) {
        if (code == null) {
            return null;
        }
        return messageSource.getMessage(code, args, code, locale);
    }
}
