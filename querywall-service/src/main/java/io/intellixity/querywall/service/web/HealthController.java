package io.intellixity.querywall.service.web;

import io.intellixity.querywall.cache.ResultCache;
import io.intellixity.querywall.engine.Backend;
import io.intellixity.querywall.engine.ConnectionStatus;
import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.engine.exec.QueryExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
public final class HealthController {
  private final ResultCache<QueryExecutionResult> cache;
  private final QueryExecutor executor;

  public HealthController(ResultCache<QueryExecutionResult> cache, QueryExecutor executor) {
    this.cache = cache;
    this.executor = executor;
  }

  /** 200 when the cache and every configured store answer; 503 otherwise. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean cacheUp = cache.healthCheck();
    ConnectionStatus stores = executor.testConnection();
    boolean columnarEnabled = executor.hasBackend(Backend.COLUMNAR);

    Map<String, Object> components = new LinkedHashMap<>();
    components.put("cache", up(cacheUp));
    components.put(Backend.ROW_STORE.id(), up(stores.rowStore()));
    components.put(Backend.COLUMNAR.id(), columnarEnabled ? up(stores.columnar()) : "disabled");

    boolean healthy = cacheUp && stores.rowStore() && (!columnarEnabled || stores.columnar());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", healthy ? "UP" : "DOWN");
    body.put("components", components);
    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  private static String up(boolean ok) {
    return ok ? "UP" : "DOWN";
  }
}
