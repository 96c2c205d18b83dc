package io.contimg.pipeline.exception.handler;

import io.contimg.pipeline.dto.common.ApiResponse;
import io.contimg.pipeline.exception.ArtifactNotFoundException;
import io.contimg.pipeline.exception.CircuitBreakerOpenException;
import io.contimg.pipeline.exception.DeadLetterReplayException;
import io.contimg.pipeline.exception.LockTimeoutException;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the operator API.
 * It converts exceptions thrown from controllers into the standardized ApiResponse format
 * with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles invalid pipeline input. (400 Bad Request)
     */
    @ExceptionHandler({ValidationException.class, JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed."),
                       HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return respond(ApiResponse.error("Required parameter is missing.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies and query objects. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatches such as an unknown artifact type in the path. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return respond(ApiResponse.error("Invalid parameter type provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(ArtifactNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * NOTE: Requires 'spring.mvc.throw-exception-if-no-handler-found=true' in properties.
     */
    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoHandlerFound(NoHandlerFoundException ex) {
        String errorMessage = String.format("No endpoint %s found for %s", ex.getHttpMethod(), ex.getRequestURL());
        log.warn("Handling NoHandlerFoundException: {}", errorMessage);
        return respond(ApiResponse.error("Resource not found.", errorMessage), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(ApiResponse.error("Method not allowed.", errorMessage), HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles operator actions on entries that are no longer pending, and contended resources. (409 Conflict)
     */
    @ExceptionHandler({DeadLetterReplayException.class, LockTimeoutException.class})
    public ResponseEntity<ApiResponse<Object>> handleConflict(RuntimeException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles an unavailable engine. (503 Service Unavailable)
     */
    @ExceptionHandler({CircuitBreakerOpenException.class, TransientProcessingException.class})
    public ResponseEntity<ApiResponse<Object>> handleServiceUnavailable(RuntimeException ex) {
        log.error("Service Unavailable Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond(ApiResponse.error("An unexpected internal error occurred. Please contact the pipeline operators.",
                                         ex.getClass().getSimpleName()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ApiResponse<Object>> respond(ApiResponse<Object> body, HttpStatus status) {
        ApiResponse<Object> response = ApiResponse.builder()
                .displayMessage(body.getDisplayMessage())
                .errorDetail(body.getErrorDetail())
                .showMessage(body.getShowMessage())
                .statusCode(status.value())
                .build();
        return new ResponseEntity<>(response, status);
    }
}
