package com.finops.costengine.controller;

import com.finops.costengine.exception.ModelNotTrainedException;
import com.finops.costengine.exception.ModelPersistenceException;
import com.finops.costengine.exception.TrainingDataInsufficientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TrainingDataInsufficientException.class)
    public ResponseEntity<Map<String, Object>> insufficientData(TrainingDataInsufficientException e) {
        Map<String, Object> body = error("TRAINING_DATA_INSUFFICIENT", e.getMessage());
        body.put("supplied", e.getSupplied());
        body.put("required", e.getRequired());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ModelNotTrainedException.class)
    public ResponseEntity<Map<String, Object>> modelNotTrained(ModelNotTrainedException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("MODEL_NOT_TRAINED", e.getMessage()));
    }

    @ExceptionHandler(ModelPersistenceException.class)
    public ResponseEntity<Map<String, Object>> persistenceFailure(ModelPersistenceException e) {
        log.error("Model store failure", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error("MODEL_STORE_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(error("INVALID_INPUT", e.getMessage()));
    }

    private static Map<String, Object> error(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
