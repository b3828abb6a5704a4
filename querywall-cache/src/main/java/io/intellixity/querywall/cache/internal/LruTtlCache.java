package io.intellixity.querywall.cache.internal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;
import java.util.function.ToLongBiFunction;
import java.util.function.UnaryOperator;

/**
 * Synchronized LRU map with a per-entry expiry.\n
 *
 * - LRU eviction: access-order LinkedHashMap bounded by {@code maxEntries} and by the summed weight of
 *   its entries; an entry heavier than the whole budget is not retained\n
 * - TTL: expire-after-write, chosen per entry; 0 means no expiry\n
 * - Updates in place keep the entry's original expiry\n
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long maxWeight;
  private final ToLongBiFunction<? super K, ? super V> weigher;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);
  private long totalWeight;

  private static final class Entry<V> {
    V value;
    long weight;
    final long expireAt;

    Entry(V value, long weight, long expireAt) {
      this.value = value;
      this.weight = weight;
      this.expireAt = expireAt;
    }
  }

  public LruTtlCache(int maxEntries) {
    this(maxEntries, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, LongSupplier nowMillis) {
    this(maxEntries, Long.MAX_VALUE, (k, v) -> 0L, nowMillis);
  }

  public LruTtlCache(int maxEntries, long maxWeight, ToLongBiFunction<? super K, ? super V> weigher,
                     LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (maxWeight <= 0) throw new IllegalArgumentException("maxWeight must be > 0");
    this.maxEntries = maxEntries;
    this.maxWeight = maxWeight;
    this.weigher = Objects.requireNonNull(weigher, "weigher");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    Entry<V> e = live(key, nowMillis.getAsLong());
    return e == null ? null : e.value;
  }

  public synchronized boolean containsKey(K key) {
    Objects.requireNonNull(key, "key");
    return live(key, nowMillis.getAsLong()) != null;
  }

  public synchronized void put(K key, V value, long ttlMillis) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    insert(key, value, expiry(now, ttlMillis));
    evictIfNeeded(now);
  }

  /** Stores only when no live entry exists; true when stored. */
  public synchronized boolean putIfAbsent(K key, V value, long ttlMillis) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    if (live(key, now) != null) return false;
    insert(key, value, expiry(now, ttlMillis));
    evictIfNeeded(now);
    return true;
  }

  /** Stores only when a live entry exists, with a fresh expiry; true when stored. */
  public synchronized boolean replace(K key, V value, long ttlMillis) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    if (live(key, now) == null) return false;
    insert(key, value, expiry(now, ttlMillis));
    evictIfNeeded(now);
    return true;
  }

  /**
   * Atomically replaces the value. {@code fn} receives null when there is no live entry, in which case
   * the new entry gets {@code ttlMillisIfAbsent}; an existing entry keeps its expiry.
   */
  public synchronized V update(K key, UnaryOperator<V> fn, long ttlMillisIfAbsent) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fn, "fn");
    long now = nowMillis.getAsLong();
    Entry<V> e = live(key, now);
    V next = fn.apply(e == null ? null : e.value);
    Objects.requireNonNull(next, "next");
    if (e != null) {
      long w = weigher.applyAsLong(key, next);
      totalWeight += w - e.weight;
      e.value = next;
      e.weight = w;
    } else {
      insert(key, next, expiry(now, ttlMillisIfAbsent));
    }
    evictIfNeeded(now);
    return next;
  }

  public synchronized boolean remove(K key) {
    Objects.requireNonNull(key, "key");
    Entry<V> e = map.remove(key);
    if (e == null) return false;
    totalWeight -= e.weight;
    return !isExpired(e, nowMillis.getAsLong());
  }

  /** Snapshot of live keys, least recently used first. */
  public synchronized List<K> keys() {
    pruneExpired(nowMillis.getAsLong());
    return new ArrayList<>(map.keySet());
  }

  /** Visits live entries without touching their recency. */
  public synchronized void forEach(BiConsumer<? super K, ? super V> visitor) {
    pruneExpired(nowMillis.getAsLong());
    for (Map.Entry<K, Entry<V>> me : map.entrySet()) visitor.accept(me.getKey(), me.getValue().value);
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  /** Summed weight of live entries. */
  public synchronized long weight() {
    pruneExpired(nowMillis.getAsLong());
    return totalWeight;
  }

  public synchronized void clear() {
    map.clear();
    totalWeight = 0;
  }

  private void insert(K key, V value, long expireAt) {
    long w = weigher.applyAsLong(key, value);
    if (w < 0) throw new IllegalStateException("negative weight for " + key);
    Entry<V> prev = map.put(key, new Entry<>(value, w, expireAt));
    if (prev != null) totalWeight -= prev.weight;
    totalWeight += w;
  }

  private Entry<V> live(K key, long now) {
    Entry<V> e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, now)) {
      map.remove(key);
      totalWeight -= e.weight;
      return null;
    }
    return e;
  }

  private static long expiry(long now, long ttlMillis) {
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    return ttlMillis == 0 ? Long.MAX_VALUE : now + ttlMillis;
  }

  private static boolean isExpired(Entry<?> e, long now) {
    return now >= e.expireAt;
  }

  private void pruneExpired(long now) {
    if (map.isEmpty()) return;
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      Entry<V> e = it.next().getValue();
      if (isExpired(e, now)) {
        totalWeight -= e.weight;
        it.remove();
      }
    }
  }

  private void evictIfNeeded(long now) {
    if (map.size() <= maxEntries && totalWeight <= maxWeight) return;
    pruneExpired(now);
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while ((map.size() > maxEntries || totalWeight > maxWeight) && it.hasNext()) {
      totalWeight -= it.next().getValue().weight;
      it.remove();
    }
  }
}
