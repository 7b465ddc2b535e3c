package com.autolog.ops.DailyReportService.controller;

import com.autolog.ops.DailyReportService.exception.RunSetupException;
import com.autolog.ops.DailyReportService.util.StandardResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<StandardResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return new ResponseEntity<>(
                new StandardResponse(
                        HttpStatus.BAD_REQUEST.value(),
                        message,
                        null
                ),
                HttpStatus.BAD_REQUEST
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<StandardResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(
                new StandardResponse(
                        HttpStatus.BAD_REQUEST.value(),
                        "Malformed request body",
                        null
                ),
                HttpStatus.BAD_REQUEST
        );
    }

    @ExceptionHandler(RunSetupException.class)
    public ResponseEntity<StandardResponse> handleRunSetup(RunSetupException ex) {
        LOGGER.error("Report run could not start: {}", ex.getMessage());
        return new ResponseEntity<>(
                new StandardResponse(
                        HttpStatus.SERVICE_UNAVAILABLE.value(),
                        ex.getMessage(),
                        null
                ),
                HttpStatus.SERVICE_UNAVAILABLE
        );
    }
}
