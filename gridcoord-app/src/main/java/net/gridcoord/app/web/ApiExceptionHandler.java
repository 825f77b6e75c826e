package net.gridcoord.app.web;

import net.gridcoord.app.web.dto.ErrorBody;
import net.gridcoord.core.error.CoordinatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** ErrorCode → HTTP 상태. 매칭 불가는 예외가 아니므로 여기 오지 않는다 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CoordinatorException.class)
    public ResponseEntity<ErrorBody> coordinator(CoordinatorException e) {
        HttpStatus status = switch (e.code()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case LEASE_MISMATCH, ALREADY_LEASED -> HttpStatus.CONFLICT;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
        };
        log.debug("Request rejected with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorBody(e.code().name(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorBody> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorBody("VALIDATION", "malformed request body"));
    }
}
