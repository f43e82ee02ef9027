package com.gentoro.opregistry.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. Code and context of an {@link
   * OperationRegistryException} are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t, Instant timestamp) {
    if (t instanceof OperationRegistryException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          timestamp,
          isRetryable(ex.getCode()));
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        RegistryErrorCode.UNKNOWN,
        null,
        timestamp,
        false);
  }

  // a bad manifest may be republished, so it counts as retryable too
  private static boolean isRetryable(RegistryErrorCode code) {
    return code == RegistryErrorCode.NETWORK_ERROR || code == RegistryErrorCode.INVALID_MANIFEST;
  }

  /** Strip the wrappers added by {@code CompletableFuture} to reach the original failure. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static OperationRegistryException rethrowIfUnchecked(
      Throwable t, Function<Throwable, OperationRegistryException> supplier) {
    if (t instanceof OperationRegistryException) {
      return (OperationRegistryException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
