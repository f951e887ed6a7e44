package com.launchpad.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.launchpad.dto.response.FieldViolation;
import com.launchpad.monitoring.ErrorMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts exceptions into RFC 7807 (Problem Details for HTTP APIs) responses.
 *
 * <p>RFC 7807 Response Format:
 * <pre>
 * {
 *   "type": "https://api.launchpad.dev/errors/validation-failed",
 *   "title": "Validation Failed",
 *   "status": 422,
 *   "detail": "Request validation failed. Please check the 'errors' property for details.",
 *   "instance": "/api/v1/verifications",
 *   "timestamp": "2024-02-26T10:30:00",
 *   "errors": [{"property": "identifier", "constraints": ["must not be blank"]}]
 * }
 * </pre>
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Validation errors (422): constraint violations, unknown properties, wrong property types</li>
 *   <li>Malformed requests (400): unparseable JSON, invalid or mismatched verification codes</li>
 *   <li>Expired verification (410)</li>
 *   <li>Rate limiting (429): too many verification codes issued</li>
 *   <li>Not found (404): unknown endpoints and queues</li>
 *   <li>Server errors (500): anything else, reported to Sentry with the event id as errorId</li>
 * </ul>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    public static final String BASE_ERROR_URI = "https://api.launchpad.dev/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

    private final ErrorMonitor errorMonitor;

    /**
     * Handles VerificationException. The status comes from the exception's reason.
     *
     * @param ex the VerificationException
     * @param request the web request context
     * @return RFC 7807 problem details with 400, 410 or 429 status
     */
    @ExceptionHandler(VerificationException.class)
    public ResponseEntity<ProblemDetail> handleVerificationException(
            VerificationException ex,
            WebRequest request
    ) {
        VerificationException.Reason reason = ex.getReason();
        log.warn("Verification rejected for {}: {}", ex.getIdentifier(), reason);

        ProblemDetail problemDetail = createProblemDetail(
                reason.getStatus(),
                reason.getStatus().getReasonPhrase(),
                ex.getMessage(),
                request,
                reason.getErrorType()
        );

        return ResponseEntity.status(reason.getStatus()).body(problemDetail);
    }

    /**
     * Handles ResourceNotFoundException - unknown queue or other named resource.
     *
     * @param ex the ResourceNotFoundException
     * @param request the web request context
     * @return RFC 7807 problem details with 404 status
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.warn("Resource not found: {} {}", ex.getResourceType(), ex.getResourceName());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request,
                "resource-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles MethodArgumentNotValidException - bean validation failures.
     *
     * @param ex the MethodArgumentNotValidException
     * @param request the web request context
     * @return RFC 7807 problem details with 422 status and validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {} field error(s)", ex.getBindingResult().getFieldErrorCount());

        Map<String, List<String>> constraintsByField = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.groupingBy(
                        FieldError::getField,
                        LinkedHashMap::new,
                        Collectors.mapping(FieldError::getDefaultMessage, Collectors.toList())
                ));

        List<FieldViolation> violations = new ArrayList<>();
        constraintsByField.forEach((field, constraints) -> violations.add(new FieldViolation(field, constraints)));

        return validationFailed(violations, request);
    }

    /**
     * Handles HttpMessageNotReadableException - the body could not be turned into the request DTO.
     *
     * Unknown properties and values of the wrong type are validation failures (422);
     * anything else, such as broken JSON syntax or a missing body, is a malformed request (400).
     *
     * @param ex the HttpMessageNotReadableException
     * @param request the web request context
     * @return RFC 7807 problem details with 422 or 400 status
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        Throwable cause = ex.getMostSpecificCause();

        if (cause instanceof UnrecognizedPropertyException unrecognized) {
            log.warn("Rejected unknown property '{}'", unrecognized.getPropertyName());
            return validationFailed(List.of(new FieldViolation(
                    unrecognized.getPropertyName(),
                    List.of(String.format("property %s should not exist", unrecognized.getPropertyName()))
            )), request);
        }

        if (cause instanceof MismatchedInputException mismatched && !mismatched.getPath().isEmpty()) {
            String property = propertyPath(mismatched);
            log.warn("Rejected property '{}' with wrong type", property);
            return validationFailed(List.of(new FieldViolation(
                    property,
                    List.of(String.format("%s has an invalid type or format", property))
            )), request);
        }

        log.warn("Request body parsing failed: {}", cause.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles MethodArgumentTypeMismatchException - a path or query parameter of the wrong type.
     *
     * @param ex the MethodArgumentTypeMismatchException
     * @param request the web request context
     * @return RFC 7807 problem details with 422 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Parameter '{}' has wrong type", ex.getName());
        return validationFailed(List.of(new FieldViolation(
                ex.getName(),
                List.of(String.format("%s has an invalid type or format", ex.getName()))
        )), request);
    }

    /**
     * Handles IllegalArgumentException - invalid arguments that passed bean validation.
     *
     * @param ex the IllegalArgumentException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles NoResourceFoundException - invalid endpoint.
     *
     * @param ex the NoResourceFoundException
     * @param request the web request context
     * @return RFC 7807 problem details with 404 status
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoResourceFoundException(
            NoResourceFoundException ex,
            WebRequest request
    ) {
        log.warn("Endpoint not found: {} {}", ex.getHttpMethod(), ex.getResourcePath());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Endpoint Not Found",
                String.format("The requested endpoint '%s /%s' does not exist.", ex.getHttpMethod(), ex.getResourcePath()),
                request,
                "endpoint-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMethodNotSupportedException(
            HttpRequestMethodNotSupportedException ex,
            WebRequest request
    ) {
        log.warn("Method not allowed: {}", ex.getMethod());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.METHOD_NOT_ALLOWED,
                "Method Not Allowed",
                ex.getMessage(),
                request,
                "method-not-allowed"
        );

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * Framework exceptions that already carry a 4xx status keep it. Everything
     * else is reported to Sentry; the Sentry event id doubles as the errorId so a
     * support request can be traced to the captured event.
     *
     * @param ex the unhandled exception
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        if (ex instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            log.warn("Request rejected by framework: {}", ex.getMessage());
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            ProblemDetail problemDetail = createProblemDetail(
                    status,
                    status.getReasonPhrase(),
                    errorResponse.getBody().getDetail(),
                    request,
                    "request-rejected"
            );
            return ResponseEntity.status(status).body(problemDetail);
        }

        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );

        String errorId = errorMonitor.capture(ex).orElseGet(this::generateErrorId);
        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ResponseEntity<ProblemDetail> validationFailed(List<FieldViolation> violations, WebRequest request) {
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                request,
                "validation-failed"
        );
        problemDetail.setProperty("errors", violations);

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problemDetail);
    }

    /**
     * Creates a ProblemDetail object with RFC 7807 compliant fields.
     *
     * @param status the HTTP status code
     * @param title a short, human-readable title
     * @param detail a detailed explanation
     * @param request the web request context
     * @param errorType the error type identifier for the type URI
     * @return a populated ProblemDetail object
     */
    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);

        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));
        return problemDetail;
    }

    private static String propertyPath(JsonMappingException ex) {
        String path = ex.getPath().stream()
                .map(reference -> reference.getFieldName() != null
                        ? reference.getFieldName()
                        : String.valueOf(reference.getIndex()))
                .collect(Collectors.joining("."));
        return path;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
