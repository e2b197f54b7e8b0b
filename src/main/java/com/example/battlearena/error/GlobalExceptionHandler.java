package com.example.battlearena.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GameException.class)
    protected ResponseEntity<ErrorResponse> handleGameException(GameException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            log.warn("Game failure: {} | {}", e.getErrorCode().getCode(), e.getMessage(), e.getCause());
        } else {
            log.debug("Rejected request: {} | {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    protected ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(new InvalidInputException("malformed request body"));
    }

    // Store failures that escaped translation in the service layer
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    protected ResponseEntity<ErrorResponse> handlePersistence(RuntimeException e) {
        log.error("Persistence failure", e);
        return ErrorResponse.toResponseEntity(GameErrorCode.PERSISTENCE_FAILURE);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected failure", e);
        return ErrorResponse.toResponseEntity(GameErrorCode.INTERNAL_SERVER_ERROR);
    }
}
