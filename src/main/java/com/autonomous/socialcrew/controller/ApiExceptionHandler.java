package com.autonomous.socialcrew.controller;

import com.autonomous.socialcrew.exception.AlreadyTerminalException;
import com.autonomous.socialcrew.exception.CrewException;
import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.autonomous.socialcrew.exception.InvalidTransitionException;
import com.autonomous.socialcrew.exception.NoAgentForTypeException;
import com.autonomous.socialcrew.exception.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body");
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(AlreadyTerminalException.class)
    public ResponseEntity<Map<String, Object>> alreadyTerminal(AlreadyTerminalException e) {
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, "already_terminal", e.getMessage());
        response.getBody().put("state", e.getState());
        return response;
    }

    @ExceptionHandler(NoAgentForTypeException.class)
    public ResponseEntity<Map<String, Object>> noAgent(NoAgentForTypeException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "no_agent_for_type", e.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> invalidTransition(InvalidTransitionException e) {
        log.error("Invalid task transition: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "invalid_transition", e.getMessage());
    }

    @ExceptionHandler(CrewException.class)
    public ResponseEntity<Map<String, Object>> other(CrewException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
