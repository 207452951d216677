package com.work.txpipeline.web;

import com.work.txpipeline.core.exception.IntentNotFoundException;
import com.work.txpipeline.core.exception.InvalidTransitionException;
import com.work.txpipeline.core.exception.TxPipelineException;
import com.work.txpipeline.web.dto.ErrorView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 错误映射。节点/密码学的原始错误只写日志，响应里只有通用描述。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IntentNotFoundException.class)
    public ResponseEntity<ErrorView> handleNotFound(IntentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorView("not_found", e.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorView> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorView("invalid_transition", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorView> handleValidation(MethodArgumentNotValidException e) {
        FieldError fe = e.getBindingResult().getFieldError();
        String msg = fe == null ? "invalid request" : fe.getField() + ": " + fe.getDefaultMessage();
        return ResponseEntity.badRequest().body(new ErrorView("bad_request", msg));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorView> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorView("bad_request", e.getMessage()));
    }

    @ExceptionHandler(TxPipelineException.class)
    public ResponseEntity<ErrorView> handlePipeline(TxPipelineException e) {
        log.warn("request failed err={}", e.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorView("unavailable", "request could not be completed, retry later"));
    }
}
