package cn.bitsleep.taskrush.web;

import cn.bitsleep.taskrush.auth.InvalidCredentialsException;
import cn.bitsleep.taskrush.service.ForbiddenException;
import cn.bitsleep.taskrush.service.InvalidInputException;
import cn.bitsleep.taskrush.service.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final boolean maskForbidden;

    public GlobalExceptionHandler(@Value("${taskrush.tasks.mask-forbidden:false}") boolean maskForbidden) {
        this.maskForbidden = maskForbidden;
    }

    private ResponseEntity<Map<String,Object>> body(HttpStatus status, String code, String msg) {
        return body(status, code, msg, null);
    }

    private ResponseEntity<Map<String,Object>> body(HttpStatus status, String code, String msg, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", msg);
        if (field != null) body.put("field", field);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String,Object>> handleInvalidInput(InvalidInputException e) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", e.getMessage(), e.getField());
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String,Object>> handleTaskNotFound(TaskNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<Map<String,Object>> handleForbidden(ForbiddenException e) {
        if (maskForbidden) {
            return body(HttpStatus.NOT_FOUND, "NOT_FOUND", "Task not found");
        }
        return body(HttpStatus.FORBIDDEN, "FORBIDDEN", e.getMessage());
    }

    @ExceptionHandler({InvalidCredentialsException.class, AuthenticationException.class})
    public ResponseEntity<Map<String,Object>> handleUnauthorized(RuntimeException e) {
        return body(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", e.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
    public ResponseEntity<Map<String,Object>> handleBinding(BindException e) {
        FieldError fe = e.getBindingResult().getFieldError();
        if (fe == null) return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", fe.getDefaultMessage(), fe.getField());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String,Object>> handleConstraint(ConstraintViolationException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String,Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body", e);
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request body");
    }

    // Spring 6+ static resource / unmatched controller 404s should not surface as 500
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String,Object>> handleNotFound(NoResourceFoundException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String,Object>> handleGeneric(Exception e) {
        log.error("Unhandled error", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Server error");
    }
}
