package com.crosspost.platform.publication.handler;

import com.crosspost.platform.publication.dto.ErrorResponse;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.ForbiddenException;
import com.crosspost.platform.publication.exception.MediaStoreException;
import com.crosspost.platform.publication.exception.NotFoundException;
import com.crosspost.platform.publication.exception.PublicationServiceException;
import com.crosspost.platform.publication.exception.ValidationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex, null);
    }

    @ExceptionHandler
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex) {
        return respond(HttpStatus.FORBIDDEN, ex, null);
    }

    @ExceptionHandler
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex, null);
    }

    @ExceptionHandler
    public ResponseEntity<ErrorResponse> handleValidationFailed(ValidationFailedException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getViolations());
    }

    @ExceptionHandler
    public ResponseEntity<ErrorResponse> handleMediaStore(MediaStoreException ex) {
        log.error("Media store error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, PublicationServiceException ex, Object details) {
        log.debug("{} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(ex.getCode())
                .message(ex.getMessage())
                .details(details)
                .build());
    }
}
