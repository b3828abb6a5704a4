package io.intellixity.querywall.engine.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querywall.engine.Backend;
import io.intellixity.querywall.engine.ConnectionStatus;
import io.intellixity.querywall.engine.ExecutionOptions;
import io.intellixity.querywall.engine.ExecutionRequest;
import io.intellixity.querywall.engine.QueryBackend;
import io.intellixity.querywall.engine.QueryExecutionException;
import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.engine.QueryTimeoutException;
import io.intellixity.querywall.engine.TooManyRowsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs validated statements against the row or columnar store.\n
 *
 * Each attempt runs on a worker thread and the caller waits at most {@code timeoutMs}; on timeout the
 * attempt is cancelled (worker interrupted) and no partial rows are returned. There is no retry.\n
 */
public final class QueryExecutor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

  private final Map<Backend, QueryBackend> backends = new EnumMap<>(Backend.class);
  private final ExecutorService workers;
  private final boolean ownsWorkers;
  private final ObjectMapper mapper;

  /** Creates an executor with its own daemon worker pool. {@code columnar} may be null. */
  public QueryExecutor(QueryBackend rowStore, QueryBackend columnar) {
    this(rowStore, columnar, newWorkerPool(), new ObjectMapper(), true);
  }

  public QueryExecutor(QueryBackend rowStore, QueryBackend columnar, ExecutorService workers, ObjectMapper mapper) {
    this(rowStore, columnar, workers, mapper, false);
  }

  private QueryExecutor(QueryBackend rowStore, QueryBackend columnar, ExecutorService workers, ObjectMapper mapper,
                        boolean ownsWorkers) {
    register(Backend.ROW_STORE, Objects.requireNonNull(rowStore, "rowStore"));
    if (columnar != null) register(Backend.COLUMNAR, columnar);
    this.workers = Objects.requireNonNull(workers, "workers");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.ownsWorkers = ownsWorkers;
  }

  private void register(Backend expected, QueryBackend b) {
    if (b.backend() != expected) {
      throw new IllegalArgumentException("Expected a " + expected + " backend, got " + b.backend());
    }
    backends.put(expected, b);
  }

  public boolean hasBackend(Backend backend) {
    return backends.containsKey(backend);
  }

  public QueryExecutionResult execute(ExecutionRequest request) {
    return execute(request, ExecutionOptions.defaults());
  }

  public QueryExecutionResult execute(ExecutionRequest request, ExecutionOptions options) {
    Objects.requireNonNull(request, "request");
    ExecutionOptions opts = options == null ? ExecutionOptions.defaults() : options;
    Backend target = request.target();
    QueryBackend backend = backends.get(target);
    if (backend == null) {
      throw new QueryExecutionException(target, "No " + target.id() + " backend configured");
    }

    // read one row past the cap so overflow is detectable without draining the result
    int rowLimit = opts.maxRows() == Integer.MAX_VALUE ? Integer.MAX_VALUE : opts.maxRows() + 1;
    String statement = request.statement();

    if (log.isDebugEnabled()) {
      log.debug("querywall.exec op=execute backend={} requestId={} timeoutMs={} maxRows={} sqlLen={}",
          target.id(), opts.requestId(), opts.timeoutMs(), opts.maxRows(), statement.length());
    }

    long t0 = System.nanoTime();
    List<Map<String, Object>> raw = runWithTimeout(backend, statement, rowLimit, opts);
    long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

    if (raw.size() > opts.maxRows()) {
      log.warn("querywall.exec op=row_cap backend={} requestId={} maxRows={}", target.id(), opts.requestId(),
          opts.maxRows());
      throw new TooManyRowsException(target, opts.maxRows());
    }

    List<Map<String, Object>> rows = ResultNormalizer.normalizeRows(raw);
    var meta = new QueryExecutionResult.Metadata(rows.size(), elapsedMs, estimateBytes(rows), target, false,
        opts.requestId());

    if (log.isDebugEnabled()) {
      log.debug("querywall.exec_done op=execute backend={} requestId={} rowCount={} durationMs={} estimatedBytes={}",
          target.id(), opts.requestId(), meta.rowCount(), elapsedMs, meta.estimatedBytes());
    }
    return new QueryExecutionResult(rows, meta);
  }

  private List<Map<String, Object>> runWithTimeout(QueryBackend backend, String statement, int rowLimit,
                                                   ExecutionOptions opts) {
    Backend target = backend.backend();
    Future<List<Map<String, Object>>> attempt;
    try {
      attempt = workers.submit(() -> backend.fetch(statement, rowLimit, opts.timeout()));
    } catch (RejectedExecutionException e) {
      throw new QueryExecutionException(target, null, "Executor is not accepting work", e);
    }

    try {
      List<Map<String, Object>> rows = attempt.get(opts.timeoutMs(), TimeUnit.MILLISECONDS);
      return rows == null ? List.of() : rows;
    } catch (TimeoutException e) {
      attempt.cancel(true);
      log.warn("querywall.exec op=timeout backend={} requestId={} timeoutMs={}", target.id(), opts.requestId(),
          opts.timeoutMs());
      throw new QueryTimeoutException(target, opts.timeoutMs());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof QueryExecutionException qe) throw qe;
      throw new QueryExecutionException(target, null, "Backend failure on " + target.id() + ": " + cause, cause);
    } catch (InterruptedException e) {
      attempt.cancel(true);
      Thread.currentThread().interrupt();
      throw new QueryExecutionException(target, null, "Interrupted while waiting for " + target.id(), e);
    }
  }

  /** JSON size of the first row times the row count. */
  long estimateBytes(List<Map<String, Object>> rows) {
    if (rows.isEmpty()) return 0L;
    try {
      return (long) mapper.writeValueAsBytes(rows.get(0)).length * rows.size();
    } catch (JsonProcessingException e) {
      log.warn("querywall.exec op=estimate_bytes error={}", e.getOriginalMessage());
      return 0L;
    }
  }

  /** Probes both stores independently. Never throws. */
  public ConnectionStatus testConnection() {
    return new ConnectionStatus(probe(Backend.ROW_STORE), probe(Backend.COLUMNAR));
  }

  private boolean probe(Backend b) {
    QueryBackend backend = backends.get(b);
    if (backend == null) return false;
    try {
      return backend.ping();
    } catch (RuntimeException e) {
      log.warn("querywall.exec op=ping backend={} error={}", b.id(), e.toString());
      return false;
    }
  }

  @Override
  public void close() {
    if (ownsWorkers) workers.shutdownNow();
  }

  private static ExecutorService newWorkerPool() {
    AtomicInteger n = new AtomicInteger();
    return Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "querywall-exec-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }
}
