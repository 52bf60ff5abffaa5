package com.fightsight.analysis.api;

import com.fightsight.analysis.dto.ErrorResponse;
import com.fightsight.common.exception.IllegalSessionTransitionException;
import com.fightsight.common.exception.PipelineException;
import com.fightsight.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.NoSuchElementException;

/**
 * Maps the pipeline's error taxonomy onto HTTP status codes for the intake API.
 */
@RestControllerAdvice
public class PipelineExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> notFound(NoSuchElementException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({IllegalSessionTransitionException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> conflict(RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> pipelineFailure(PipelineException e) {
        log.error("[Api] Pipeline error. sessionId={} type={}", e.getSessionId(), e.getClass().getSimpleName(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, RuntimeException e) {
        Long sessionId = e instanceof PipelineException pe ? pe.getSessionId() : null;
        log.warn("[Api] Request failed. status={} type={} reason={}",
                 status.value(), e.getClass().getSimpleName(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(status.getReasonPhrase(), e.getMessage(), sessionId));
    }
}
