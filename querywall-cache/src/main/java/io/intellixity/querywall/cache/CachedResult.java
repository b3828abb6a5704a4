package io.intellixity.querywall.cache;

/** Outcome of a read-through call: the payload and whether it came from the cache. */
public record CachedResult<T>(T data, boolean cached) {}
