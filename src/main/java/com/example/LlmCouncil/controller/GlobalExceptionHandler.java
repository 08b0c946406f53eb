package com.example.LlmCouncil.controller;

import com.example.LlmCouncil.exception.StageFatalException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    /**
     * Only reached outside the pipeline, e.g. the standalone auction endpoint.
     * Inside a run a stage failure becomes an "error" event instead.
     */
    @ExceptionHandler(StageFatalException.class)
    public ResponseEntity<Map<String, Object>> handleStageFailure(StageFatalException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "stage_failed");
        body.put("stage", ex.getStage().key());
        body.put("details", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_GATEWAY);
    }
}
