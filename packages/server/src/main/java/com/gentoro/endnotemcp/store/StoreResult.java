package com.gentoro.endnotemcp.store;

import com.gentoro.endnotemcp.exception.StateException;
import com.gentoro.endnotemcp.exception.StoreException;
import java.util.Objects;
import java.util.Optional;

/**
 * Value of a repository operation, or the {@link StoreException} that prevented it. Repository
 * operations return this instead of throwing so callers decide how a failure is reported.
 */
public final class StoreResult<T> {
  private final T value;
  private final StoreException error;

  private StoreResult(T value, StoreException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> StoreResult<T> success(T value) {
    return new StoreResult<>(value, null);
  }

  public static <T> StoreResult<T> failure(StoreException error) {
    return new StoreResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public T value() {
    if (error != null) {
      throw new StateException("No value available, operation failed: " + error.getMessage());
    }
    return value;
  }

  public Optional<StoreException> error() {
    return Optional.ofNullable(error);
  }

  public T orElse(T fallback) {
    return error == null ? value : fallback;
  }
}
