package com.zzf.pdfsandbox.api;

import com.zzf.pdfsandbox.model.ConflictException;
import com.zzf.pdfsandbox.model.ErrorResponse;
import com.zzf.pdfsandbox.model.NotFoundException;
import com.zzf.pdfsandbox.model.PathViolationException;
import com.zzf.pdfsandbox.model.ProtectedFileException;
import com.zzf.pdfsandbox.model.SandboxException;
import com.zzf.pdfsandbox.model.StorageException;
import com.zzf.pdfsandbox.render.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SandboxException.class)
    public ResponseEntity<ErrorResponse> handleSandboxException(SandboxException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("api.error code={} msg={}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.debug("api.reject code={} msg={}", e.getErrorCode(), e.getMessage());
        }
        return body(status, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(TemplateException.class)
    public ResponseEntity<ErrorResponse> handleTemplateException(TemplateException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "TEMPLATE_ERROR", e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknownException(Exception e) {
        String msg = e.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            msg = e.getClass().getSimpleName();
        } else {
            msg = e.getClass().getSimpleName() + ": " + msg;
        }
        log.error("api.error code=INTERNAL_ERROR", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", msg);
    }

    static HttpStatus statusOf(SandboxException e) {
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof PathViolationException || e instanceof ProtectedFileException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof ConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof StorageException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(code, message));
    }
}
