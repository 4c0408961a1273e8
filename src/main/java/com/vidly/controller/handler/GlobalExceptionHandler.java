package com.vidly.controller.handler;

import com.vidly.dto.response.ErrorResponse;
import com.vidly.exception.DuplicateEmailException;
import com.vidly.exception.GenreInUseException;
import com.vidly.exception.InvalidReferenceException;
import com.vidly.exception.OutOfStockException;
import com.vidly.exception.RentalTransactionException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.exception.ReturnAlreadyProcessedException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TRANSACTION_FAILED_MESSAGE = "Something failed.";

    private static final Set<String> PRESENCE_CODES = Set.of("NotNull", "NotBlank", "NotEmpty");

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex,
                                                        HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex,
                                                                HttpServletRequest request) {
        log.debug("Unknown {} referenced on {}", ex.getReference(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(OutOfStockException.class)
    public ResponseEntity<ErrorResponse> handleOutOfStock(OutOfStockException ex,
                                                          HttpServletRequest request) {
        log.info("Rental refused: movie {} is out of stock", ex.getMovieId());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(ReturnAlreadyProcessedException.class)
    public ResponseEntity<ErrorResponse> handleReturnAlreadyProcessed(ReturnAlreadyProcessedException ex,
                                                                      HttpServletRequest request) {
        log.info("Return refused: rental {} was already returned", ex.getRentalId());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(DuplicateEmailException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateEmail(DuplicateEmailException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(GenreInUseException.class)
    public ResponseEntity<ErrorResponse> handleGenreInUse(GenreInUseException ex,
                                                          HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(RentalTransactionException.class)
    public ResponseEntity<ErrorResponse> handleRentalTransaction(RentalTransactionException ex,
                                                                 HttpServletRequest request) {
        log.error("Rental transaction failed on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, TRANSACTION_FAILED_MESSAGE, request);
    }

    /**
     * The first field error becomes the message; all of them are listed in
     * {@code fieldErrors}. Errors follow the order the fields are declared in the request
     * body type, and within one field a missing value is reported before a malformed one.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<String> declared = declaredFieldNames(ex.getBindingResult().getTarget());
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors()
            .stream()
            .sorted(Comparator
                .comparingInt((FieldError fe) -> declarationIndex(declared, fe.getField()))
                .thenComparingInt(fe -> PRESENCE_CODES.contains(fe.getCode()) ? 0 : 1)
                .thenComparing(fe -> String.valueOf(fe.getCode())))
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList();
        String message = fieldErrors.isEmpty() ? "Validation failed" : fieldErrors.get(0).message();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            ErrorResponse.of(HttpStatus.BAD_REQUEST, message, request.getRequestURI(), fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    /**
     * A path id that is not a number cannot name any resource, so it is a 404 like any
     * other unknown id. Malformed query parameters stay a 400.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        if (ex.getParameter().hasParameterAnnotation(PathVariable.class)) {
            return respond(HttpStatus.NOT_FOUND,
                           "Resource not found with " + ex.getName() + " " + ex.getValue(), request);
        }
        String msg = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        return respond(HttpStatus.BAD_REQUEST, msg, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        String constraintName = extractConstraintName(ex);
        if ("idx_users_email".equals(constraintName)) {
            return respond(HttpStatus.CONFLICT, "Email already registered", request);
        }
        if ("fk_movies_genre".equals(constraintName)) {
            return respond(HttpStatus.CONFLICT, "Genre is referenced by movies", request);
        }
        if ("chk_movies_stock_non_negative".equals(constraintName)) {
            return respond(HttpStatus.BAD_REQUEST, "Movie not in stock.", request);
        }
        return respond(HttpStatus.BAD_REQUEST, "Data integrity violation", request);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Resource was modified by another request. Please retry.", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                               HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    /** Framework errors carrying a 4xx status (unknown route, wrong method) keep it; the rest is a logged 500. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return respond(status, status.getReasonPhrase(), request);
            }
        }
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message,
                                                  HttpServletRequest request) {
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(status, message, request.getRequestURI()));
    }

    private static List<String> declaredFieldNames(Object target) {
        if (target == null) {
            return List.of();
        }
        Class<?> type = target.getClass();
        if (type.isRecord()) {
            return Arrays.stream(type.getRecordComponents()).map(RecordComponent::getName).toList();
        }
        return Arrays.stream(type.getDeclaredFields()).map(Field::getName).toList();
    }

    private static int declarationIndex(List<String> declared, String path) {
        String root = path.split("[.\\[]", 2)[0];
        int index = declared.indexOf(root);
        return index < 0 ? declared.size() : index;
    }

    private String extractConstraintName(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve) {
            return cve.getConstraintName();
        }
        return null;
    }
}
