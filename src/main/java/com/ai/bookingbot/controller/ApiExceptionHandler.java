package com.ai.bookingbot.controller;

import com.ai.bookingbot.exception.AvailabilityException;
import com.ai.bookingbot.exception.BookingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldError() == null
                ? "Validation error"
                : ex.getBindingResult().getFieldError().getField() + ": "
                        + Objects.toString(ex.getBindingResult().getFieldError().getDefaultMessage(), "invalid");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "VALIDATION_ERROR");
        body.put("code", "V001");
        body.put("message", message);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    ResponseEntity<Map<String, Object>> badRequest(Exception ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "VALIDATION_ERROR");
        body.put("code", "V001");
        body.put("message", Objects.toString(ex.getMessage(), "Malformed request"));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(AvailabilityException.class)
    ResponseEntity<Map<String, Object>> availability(AvailabilityException ex) {
        ResponseEntity<Map<String, Object>> response = booking(ex);
        response.getBody().put("reason", ex.getReason().name());
        return response;
    }

    @ExceptionHandler(BookingException.class)
    ResponseEntity<Map<String, Object>> booking(BookingException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getErrorCode().name());
        body.put("code", ex.getErrorCode().getCode());
        body.put("message", Objects.toString(ex.getMessage(), ex.getErrorCode().getMessage()));
        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(body);
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<Map<String, Object>> generic(Exception ex) {
        log.error("Unhandled error", ex);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "INTERNAL_ERROR");
        body.put("code", "X001");
        body.put("message", Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
