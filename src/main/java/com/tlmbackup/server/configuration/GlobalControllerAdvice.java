package com.tlmbackup.server.configuration;

import com.tlmbackup.server.exception.*;
import com.tlmbackup.server.model.api.global.TlmBackupHttpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("controller failed. business logic failed. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(FileOperationException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleFileOperationException(FileOperationException e) {
        log.warn("controller failed. file operation failed. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(UploadException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleUploadException(UploadException e) {
        log.warn("controller failed. upload target failed. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleMissingParameterException(
            MissingServletRequestParameterException e) {
        log.warn("controller failed. request parameter missing. ", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(
                new ValidationException("request parameter %s is missing".formatted(e.getParameterName()), e)));
    }

    @ExceptionHandler(TlmBackupException.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleTlmBackupException(TlmBackupException e) {
        log.warn("controller failed. TlmBackupException happen", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<TlmBackupHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponseEntity(TlmBackupHttpResponse.fail(
                new TlmBackupException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString())));
    }

    private static ResponseEntity<TlmBackupHttpResponse<Void>> toResponseEntity(
            TlmBackupHttpResponse<Void> tlmBackupHttpResponse) {
        return ResponseEntity.status(tlmBackupHttpResponse.getStatusCode()).body(tlmBackupHttpResponse);
    }
}
