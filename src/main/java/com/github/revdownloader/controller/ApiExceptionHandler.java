package com.github.revdownloader.controller;

import com.github.revdownloader.exception.DownloadException;
import com.github.revdownloader.exception.SessionNotFoundException;
import com.github.revdownloader.exception.SessionRejectedException;
import com.github.revdownloader.model.DownloadErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine exceptions to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SessionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(SessionRejectedException e) {
        log.warn("Session rejected ({}): {}", e.getErrorType(), e.getMessage());
        HttpStatus status = e.getErrorType() == DownloadErrorType.ALREADY_DOWNLOADING
                ? HttpStatus.CONFLICT
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(body(e));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(e));
    }

    @ExceptionHandler(DownloadException.class)
    public ResponseEntity<ErrorResponse> handleDownload(DownloadException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        HttpStatus status = e.getErrorType() == DownloadErrorType.ALREADY_DOWNLOADING
                ? HttpStatus.CONFLICT
                : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(body(e));
    }

    private static ErrorResponse body(DownloadException e) {
        return ErrorResponse.builder()
                .errorType(e.getErrorType())
                .message(e.getMessage())
                .build();
    }
}
