package com.examify.api.exception;

import com.examify.api.dto.response.ErrorResponse;
import com.examify.common.exception.ConflictException;
import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.core.ocr.OcrException;
import com.examify.llm.provider.ProviderClient.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
            .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        ErrorResponse errorResponse = base(HttpStatus.BAD_REQUEST, "Validation failed", request)
            .fieldErrors(fieldErrors)
            .build();
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, WebRequest request) {
        return ResponseEntity.badRequest().body(base(HttpStatus.BAD_REQUEST, ex.getMessage(), request).build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        return ResponseEntity.badRequest().body(base(HttpStatus.BAD_REQUEST, "Malformed request body", request).build());
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPartException(
            MissingServletRequestPartException ex,
            WebRequest request
    ) {
        log.warn("[API] Missing multipart part | part={}", ex.getRequestPartName());
        String message = String.format("Required part '%s' is not present, send it as multipart/form-data",
            ex.getRequestPartName());
        return ResponseEntity.badRequest().body(base(HttpStatus.BAD_REQUEST, message, request).build());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex, WebRequest request) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(base(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file is too large", request).build());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, WebRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(base(HttpStatus.NOT_FOUND, ex.getMessage(), request).build());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex, WebRequest request) {
        ErrorResponse errorResponse = base(HttpStatus.CONFLICT, ex.getMessage(), request)
            .conflictingId(ex.getConflictingId())
            .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    @ExceptionHandler(OcrException.class)
    public ResponseEntity<ErrorResponse> handleOcr(OcrException ex, WebRequest request) {
        log.warn("[API] OCR failed | error={}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(base(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request).build());
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorResponse> handleProvider(ProviderException ex, WebRequest request) {
        log.error("[API] AI provider unavailable | provider={} | statusCode={} | error={}",
            ex.getProvider(), ex.getStatusCode(), ex.getMessage());
        ErrorResponse errorResponse = base(HttpStatus.SERVICE_UNAVAILABLE,
                "The AI service is temporarily unavailable, please try again", request)
            .retryable(true)
            .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(base(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request).build());
    }

    private static ErrorResponse.ErrorResponseBuilder base(HttpStatus status, String message, WebRequest request) {
        return ErrorResponse.builder()
            .error(status.getReasonPhrase())
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""));
    }
}
