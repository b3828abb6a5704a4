package io.intellixity.querywall.cache.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link CacheStore} on a shared Redis server, so every service instance sees the same entries, locks
 * and counters.\n
 *
 * - SET PX / SET NX PX / SET XX PX for plain, lock and refresh writes\n
 * - SCAN MATCH for key listing; KEYS is never issued\n
 * - INCR, then PEXPIRE when the counter was created\n
 * - INFO memory for {@code used_memory}\n
 */
public final class RedisCacheStore implements CacheStore {
  private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

  public static final int DEFAULT_TIMEOUT_MS = 2_000;
  private static final int SCAN_BATCH = 500;

  private final JedisPool pool;

  public RedisCacheStore(String redisUrl) {
    this(redisUrl, DEFAULT_TIMEOUT_MS);
  }

  public RedisCacheStore(String redisUrl, int timeoutMs) {
    this(new JedisPool(new JedisPoolConfig(), URI.create(Objects.requireNonNull(redisUrl, "redisUrl")), timeoutMs));
    log.info("querywall.cache.store op=open backend=redis host={}", URI.create(redisUrl).getHost());
  }

  public RedisCacheStore(JedisPool pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  @Override
  public Optional<String> get(String key) {
    return call("get", jedis -> Optional.ofNullable(jedis.get(key)));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    call("set", jedis -> jedis.set(key, value, withTtl(SetParams.setParams(), ttl)));
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    return call("set_nx", jedis -> jedis.set(key, value, withTtl(SetParams.setParams().nx(), ttl)) != null);
  }

  @Override
  public boolean setIfPresent(String key, String value, Duration ttl) {
    return call("set_xx", jedis -> jedis.set(key, value, withTtl(SetParams.setParams().xx(), ttl)) != null);
  }

  @Override
  public boolean exists(String key) {
    return call("exists", jedis -> jedis.exists(key));
  }

  @Override
  public long delete(Collection<String> keys) {
    if (keys.isEmpty()) return 0;
    return call("del", jedis -> jedis.del(keys.toArray(new String[0])));
  }

  @Override
  public List<String> keys(String glob) {
    Objects.requireNonNull(glob, "glob");
    return call("scan", jedis -> {
      ScanParams params = new ScanParams().match(glob).count(SCAN_BATCH);
      List<String> out = new ArrayList<>();
      String cursor = ScanParams.SCAN_POINTER_START;
      do {
        ScanResult<String> page = jedis.scan(cursor, params);
        out.addAll(page.getResult());
        cursor = page.getCursor();
      } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
      return out;
    });
  }

  @Override
  public long increment(String key, Duration ttlIfCreated) {
    return call("incr", jedis -> {
      long n = jedis.incr(key);
      long ms = millis(ttlIfCreated);
      if (n == 1 && ms > 0) jedis.pexpire(key, ms);
      return n;
    });
  }

  @Override
  public long memoryUsedBytes() {
    return call("info", jedis -> parseUsedMemory(jedis.info("memory")));
  }

  @Override
  public boolean ping() {
    try (Jedis jedis = pool.getResource()) {
      return "PONG".equalsIgnoreCase(jedis.ping());
    } catch (JedisException e) {
      log.warn("querywall.cache.store op=ping backend=redis err={}", e.toString());
      return false;
    }
  }

  @Override
  public void close() {
    pool.close();
    log.info("querywall.cache.store op=close backend=redis");
  }

  static long parseUsedMemory(String info) {
    for (String line : info.split("\r?\n")) {
      if (line.startsWith("used_memory:")) {
        return Long.parseLong(line.substring("used_memory:".length()).trim());
      }
    }
    return 0;
  }

  private <R> R call(String op, Function<Jedis, R> command) {
    try (Jedis jedis = pool.getResource()) {
      return command.apply(jedis);
    } catch (JedisException e) {
      throw new CacheStoreException("redis " + op + " failed: " + e.getMessage(), e);
    }
  }

  private static SetParams withTtl(SetParams params, Duration ttl) {
    long ms = millis(ttl);
    return ms > 0 ? params.px(ms) : params;
  }

  private static long millis(Duration ttl) {
    if (ttl == null || ttl.isZero()) return 0;
    if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    return ttl.toMillis();
  }
}
