package io.intellixity.querywall.cache.store;

/** Transport or protocol failure talking to a {@link CacheStore}. */
public final class CacheStoreException extends RuntimeException {
  public CacheStoreException(String message) {
    super(message);
  }

  public CacheStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
