package com.delta.jobharvest.crawl.api;

import com.delta.jobharvest.crawl.service.ActiveCrawlRunException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, Object>> conflictingRun(ActiveCrawlRunException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "active_crawl_run");
    body.put("activeCrawlRunId", ex.getActiveRunId());
    body.put("message", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  // Seed URLs that cannot be built (no search term and no start url) land here.
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> rejectedRequest(IllegalArgumentException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "invalid_request");
    body.put("message", ex.getMessage() == null ? "invalid request" : ex.getMessage());
    return ResponseEntity.badRequest().body(body);
  }
}
