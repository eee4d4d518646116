package uk.gegc.creatorbilling.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.creatorbilling.shared.api.problem.ErrorTypes;
import uk.gegc.creatorbilling.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.creatorbilling.shared.exception.ForbiddenException;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.creatorbilling.shared.exception.UnauthorizedException;
import uk.gegc.creatorbilling.shared.exception.ValidationException;

import java.net.URI;
import java.util.List;

/**
 * Fallback mapping of shared and framework exceptions to problem details.
 * Billing domain errors are handled first by the billing API advice.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response =
                respond(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Validation Failed", ex.getMessage(), request);
        if (!ex.getErrors().isEmpty()) {
            response.getBody().setProperty("errors", ex.getErrors());
        }
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.INVALID_ARGUMENT, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorized(UnauthorizedException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler({AccessDeniedException.class, AuthorizationDeniedException.class, ForbiddenException.class})
    public ResponseEntity<ProblemDetail> handleAccessDenied(Exception ex, HttpServletRequest request) {
        // Spring's own denials carry a generic "Access Denied" message; ours name the resource
        String detail = ex instanceof ForbiddenException
                ? ex.getMessage()
                : "You do not have permission to access this resource";
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED, "Access Denied", detail, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.error("Data integrity violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage(), ex);
        return respond(HttpStatus.CONFLICT, ErrorTypes.DATA_CONFLICT, "Data Conflict",
                "The request conflicts with existing data", request);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ProblemDetail> handleConcurrencyFailure(ConcurrencyFailureException ex, HttpServletRequest request) {
        log.warn("Concurrent update on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorTypes.CONCURRENT_UPDATE, "Concurrent Update",
                "The resource was modified concurrently, retry the request", request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = respond(HttpStatus.BAD_REQUEST, ErrorTypes.CONSTRAINT_VIOLATION,
                "Constraint Violation", "One or more validation constraints were violated", request);
        List<FieldError> violations = ex.getConstraintViolations().stream()
                .map(v -> new FieldError(lastNode(v.getPropertyPath().toString()), v.getMessage(), v.getInvalidValue()))
                .toList();
        response.getBody().setProperty("violations", violations);
        return response;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ResponseEntity<ProblemDetail> response = respond(HttpStatus.BAD_REQUEST, ErrorTypes.TYPE_MISMATCH, "Type Mismatch",
                "Parameter '" + ex.getName() + "' must be a valid " + requiredType, request);
        response.getBody().setProperty("parameter", ex.getName());
        response.getBody().setProperty("expectedType", requiredType);
        return response;
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.MALFORMED_JSON,
                "Malformed JSON", "Request body is malformed or cannot be read", request);
        problem.setProperty("parseError", ex.getMostSpecificCause().getMessage());
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED,
                "Validation Failed", "Validation failed for one or more fields", request);
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request);
    }

    private static ResponseEntity<ProblemDetail> respond(HttpStatus status, URI type, String title, String detail,
                                                         HttpServletRequest request) {
        return ResponseEntity.status(status).body(ProblemDetailBuilder.create(status, type, title, detail, request));
    }

    // "getChurnRate.windowDays" -> "windowDays"
    private static String lastNode(String path) {
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }

    private record FieldError(String field, String message, Object rejectedValue) {
    }
}
