package com.booking.shared.web;

import com.booking.shared.error.BookingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Translates the booking error taxonomy into HTTP responses.
 *
 * <pre>
 *   InvalidArgument, MalformedPageToken   400
 *   FailedPrecondition                    412
 *   NotFound                              404
 *   AlreadyExists, Conflict               409
 *   EventPublish                          503
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ErrorResponse> handleBooking(BookingException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Request failed: category={}, internalCode={}", ex.getCategory(), ex.getInternalCode(), ex);
        } else {
            log.debug("Request rejected: category={}, internalCode={}, message={}",
                    ex.getCategory(), ex.getInternalCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(ex.getCategory().name())
                .message(ex.getMessage())
                .internalCode(ex.getInternalCode())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message(message)
                .internalCode("REQUEST_VALIDATION_FAILED")
                .build());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message("missing header " + ex.getHeaderName())
                .internalCode("MISSING_HEADER")
                .build());
    }

    static HttpStatus statusOf(BookingException ex) {
        switch (ex.getCategory()) {
            case INVALID_ARGUMENT:
                return HttpStatus.BAD_REQUEST;
            case FAILED_PRECONDITION:
                return HttpStatus.PRECONDITION_FAILED;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS:
            case CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
