package io.intellixity.querywall.cache;

/** A cached payload with its metadata. */
public record CacheEntry<T>(String key, T data, CacheMetadata metadata) {}
