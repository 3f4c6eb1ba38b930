package net.fiddleserver.controller;

import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.exception.ObjectStoreUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures reaching the controllers onto HTTP statuses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ObjectStoreUnavailableException.class)
    public ResponseEntity<Void> handleObjectStoreUnavailable(ObjectStoreUnavailableException ex) {
        log.error("Object store unavailable while reading '{}'", ex.getKey(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
    }
}
