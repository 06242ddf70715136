package com.project.scratch.analysis.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.validation.ConstraintViolationException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({ImageNotFoundException.class, ExperimentNotFoundException.class})
    public ProblemDetail handleNotFound(AnalysisException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not found", ex.getMessage());
    }

    @ExceptionHandler(InvalidRegionException.class)
    public ProblemDetail handleInvalidRegion(InvalidRegionException ex) {
        log.warn("Invalid region: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid region", ex.getMessage());
    }

    @ExceptionHandler(DecodeException.class)
    public ProblemDetail handleDecode(DecodeException ex) {
        log.warn("Decode error: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Image cannot be decoded", ex.getMessage());
    }

    @ExceptionHandler(MissingReferenceImageException.class)
    public ProblemDetail handleMissingReference(MissingReferenceImageException ex) {
        log.warn("Missing reference: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Missing reference image", ex.getMessage());
    }

    @ExceptionHandler(RecomputeAbortedException.class)
    public ProblemDetail handleRecomputeAborted(RecomputeAbortedException ex) {
        log.warn("Recalculation aborted: {}", ex.getMessage());
        ProblemDetail pd = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Recalculation aborted", ex.getMessage());
        pd.setProperty("experiment_id", ex.getExperimentId());
        pd.setProperty("image_id", ex.getImageId());
        pd.setProperty("reason", ex.getReason());
        return pd;
    }

    @ExceptionHandler(StorageException.class)
    public ProblemDetail handleStorage(StorageException ex) {
        log.error("Storage error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Storage error", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return problem(HttpStatus.PAYLOAD_TOO_LARGE, "Upload too large", "Maximum file size is 10MB");
    }

    @ExceptionHandler({ConstraintViolationException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class})
    public ProblemDetail handleBadRequest(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnknownException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework errors (missing parameter, bad path variable, ...) already carry a status
            log.warn("Request error: {}", ex.getMessage());
            return errorResponse.getBody();
        }
        log.error("Unhandled error occurred", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", "Unexpected error, see server logs");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(title);
        return pd;
    }
}
