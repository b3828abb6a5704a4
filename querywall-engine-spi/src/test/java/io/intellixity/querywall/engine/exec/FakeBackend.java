package io.intellixity.querywall.engine.exec;

import io.intellixity.querywall.engine.Backend;
import io.intellixity.querywall.engine.QueryBackend;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Capturing backend: records each fetch and answers from a supplier. */
final class FakeBackend implements QueryBackend {
  record Call(String sql, int rowLimit, Duration timeout) {}

  private final Backend backend;
  final List<Call> calls = new ArrayList<>();
  Supplier<List<Map<String, Object>>> answer = List::of;
  Supplier<Boolean> ping = () -> true;

  FakeBackend(Backend backend) {
    this.backend = backend;
  }

  static List<Map<String, Object>> rows(int n) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (int i = 0; i < n; i++) out.add(Map.of("id", (long) i, "name", "row" + i));
    return out;
  }

  @Override public Backend backend() { return backend; }

  @Override
  public synchronized List<Map<String, Object>> fetch(String sql, int rowLimit, Duration timeout) {
    calls.add(new Call(sql, rowLimit, timeout));
    List<Map<String, Object>> all = answer.get();
    return all.size() > rowLimit ? all.subList(0, rowLimit) : all;
  }

  @Override public boolean ping() { return ping.get(); }
}
