package com.onalog.discovery.lead.api;

import com.onalog.discovery.lead.service.InvalidSearchRequestException;
import com.onalog.discovery.lead.service.SearchJobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class LeadApiExceptionHandler {

    @ExceptionHandler(SearchJobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(SearchJobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "search_job_not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(InvalidSearchRequestException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_search_request", "message", ex.getMessage()));
    }
}
