package com.iplicense.search.api;

import com.iplicense.search.analytics.UnknownSearchEventException;
import com.iplicense.search.api.dto.ErrorResponse;
import com.iplicense.search.common.RequestContext;
import com.iplicense.search.common.RequestContextHolder;
import com.iplicense.search.config.InvalidSearchConfigException;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.service.SearchCancelledException;
import com.iplicense.search.service.SearchUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(InvalidSearchRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "invalid value for parameter " + ex.getName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "malformed request body");
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex) {
        return error(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage());
    }

    @ExceptionHandler(UnknownSearchEventException.class)
    public ResponseEntity<ErrorResponse> handleUnknownEvent(UnknownSearchEventException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", "search event not found");
    }

    @ExceptionHandler(InvalidSearchConfigException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfig(InvalidSearchConfigException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_config", ex.getMessage());
    }

    @ExceptionHandler(SearchUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(SearchUnavailableException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "search_unavailable", ex.getMessage());
    }

    @ExceptionHandler(SearchCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(SearchCancelledException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "search_cancelled", "search was cancelled");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        RequestContext context = RequestContextHolder.get();
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            context == null ? null : context.getRequestId(),
            context == null ? null : context.getTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        RequestContext context = RequestContextHolder.get();
        ErrorResponse response = new ErrorResponse(
            code,
            message,
            context == null ? null : context.getTraceId(),
            context == null ? null : context.getRequestId()
        );
        return ResponseEntity.status(status).body(response);
    }
}
