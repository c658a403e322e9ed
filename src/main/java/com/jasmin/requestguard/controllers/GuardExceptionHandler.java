package com.jasmin.requestguard.controllers;

import com.jasmin.requestguard.models.GuardErrorResponse;
import com.jasmin.requestguard.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = BlocklistAdminController.class)
public class GuardExceptionHandler {

    @ExceptionHandler(SuperuserRequiredException.class)
    public ResponseEntity<GuardErrorResponse> forbidden(SuperuserRequiredException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new GuardErrorResponse("Access denied", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<GuardErrorResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(new GuardErrorResponse("Bad request", e.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<GuardErrorResponse> storeUnavailable(StoreUnavailableException e) {
        log.error("Blocklist admin request failed, store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new GuardErrorResponse("Service unavailable", "Block store is unreachable"));
    }
}
