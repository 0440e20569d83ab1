package io.intellixity.sqlgate.gateway.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Small synchronized LRU map with expire-after-write.\n
 *
 * Values are computed by callers outside the lock; the cache only stores them.\n
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry<V>(V value, long writtenAt) {}

  public LruTtlCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis <= 0) throw new IllegalArgumentException("ttlMillis must be > 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    Entry<V> e = map.get(key);
    if (e == null) return null;
    if (expired(e, nowMillis.getAsLong())) {
      map.remove(key);
      return null;
    }
    return e.value();
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    map.put(key, new Entry<>(value, nowMillis.getAsLong()));
    while (map.size() > maxEntries) {
      Iterator<K> eldest = map.keySet().iterator();
      eldest.next();
      eldest.remove();
    }
  }

  public synchronized boolean invalidate(K key) {
    return map.remove(key) != null;
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    long now = nowMillis.getAsLong();
    map.values().removeIf(e -> expired(e, now));
    return map.size();
  }

  private boolean expired(Entry<V> e, long now) {
    return now - e.writtenAt() >= ttlMillis;
  }
}
