package io.linchmind.daemon.app;

import io.linchmind.daemon.domain.ConnectorLifecycleException;
import io.linchmind.daemon.domain.LifecycleError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps lifecycle failures to RFC 9457 problem details. The machine-readable error code is carried
 * in the {@code code} property.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConnectorLifecycleException.class)
    ProblemDetail handleLifecycle(ConnectorLifecycleException ex) {
        HttpStatus status = statusOf(ex.getCode());
        if (status.is5xxServerError()) {
            log.warn("lifecycle operation failed code={}: {}", ex.getCode(), ex.getMessage(), ex.getCause());
        } else {
            log.debug("lifecycle operation rejected code={}: {}", ex.getCode(), ex.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setProperty("code", ex.getCode().name());
        return problem;
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    ProblemDetail handleBadRequest(Exception ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setProperty("code", "BAD_REQUEST");
        return problem;
    }

    static HttpStatus statusOf(LifecycleError code) {
        return switch (code) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TYPE, CONFIG_VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case INSTANCE_LIMIT_EXCEEDED, STILL_RUNNING, INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case SPAWN_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case STORE_UNAVAILABLE, SHUTDOWN_IN_PROGRESS -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
