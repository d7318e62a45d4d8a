package com.tsl.tripsearch.api;

import com.tsl.tripsearch.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({
        IllegalArgumentException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse("bad_request", ex.getMessage(), request));
    }

    // store failures other than complexity rejections; the raw engine message stays in the log
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataError(DataAccessException ex, HttpServletRequest request) {
        logger.error("data error on {}", request.getRequestURI(), ex);
        ErrorResponse body = errorResponse("data_error", "The trip store rejected the request", request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error("unexpected error on {}", request.getRequestURI(), ex);
        ErrorResponse body = errorResponse("internal_error", "Unexpected error", request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse errorResponse(String code, String message, HttpServletRequest request) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.TRACE_HEADER);
        String requestId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.REQUEST_HEADER);
        return new ErrorResponse(code, message, traceId, requestId);
    }
}
