package com.example.prospectus.interfaces.api.error;

import com.example.prospectus.application.exception.AnalysisCancelledException;
import com.example.prospectus.application.exception.AnalysisFailedException;
import com.example.prospectus.application.exception.ApplicationException;
import com.example.prospectus.domain.exception.DocumentNotFoundException;
import com.example.prospectus.domain.exception.DomainException;
import com.example.prospectus.domain.exception.SummaryUnavailableException;
import com.example.prospectus.infrastructure.exception.InfrastructureException;
import com.example.prospectus.infrastructure.exception.UnreadablePdfException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps domain, application and infrastructure failures of the insight pipeline to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link DocumentNotFoundException} to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDocumentNotFound(DocumentNotFoundException ex,
                                                                HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND",
                ex.getMessage(), request.getRequestURI()).withDetail("fileId", ex.getFileId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    /**
     * Maps a missing summary to a 404 response; the rest of the analysis may still be available.
     */
    @ExceptionHandler(SummaryUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSummaryUnavailable(SummaryUnavailableException ex,
                                                                  HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "SUMMARY_UNAVAILABLE");
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex,
                                                           HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "FILE_REQUIRED");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex,
                                                              HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE");
    }

    @ExceptionHandler(AnalysisFailedException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisFailed(AnalysisFailedException ex,
                                                              HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "ANALYSIS_FAILED");
    }

    @ExceptionHandler(AnalysisCancelledException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisCancelled(AnalysisCancelledException ex,
                                                                 HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "ANALYSIS_CANCELLED");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    @ExceptionHandler(UnreadablePdfException.class)
    public ResponseEntity<ErrorResponse> handleUnreadablePdf(UnreadablePdfException ex, HttpServletRequest request) {
        log.warn("Unreadable PDF on {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNREADABLE_PDF");
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status, errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
