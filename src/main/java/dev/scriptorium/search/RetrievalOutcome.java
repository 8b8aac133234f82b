package dev.scriptorium.search;

import java.util.Objects;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Result of a retrieval step that is allowed to fail without failing the query: either a value or
 * a tagged {@link FailureReason}. The orchestrating service decides what to do on failure.
 *
 * @param <T> value type
 */
public final class RetrievalOutcome<T> {

  private final @Nullable T value;
  private final @Nullable FailureReason reason;
  private final @Nullable String detail;

  private RetrievalOutcome(
      @Nullable T value, @Nullable FailureReason reason, @Nullable String detail) {
    this.value = value;
    this.reason = reason;
    this.detail = detail;
  }

  public static <T> RetrievalOutcome<T> success(T value) {
    return new RetrievalOutcome<>(
        Objects.requireNonNull(value, "value must not be null"), null, null);
  }

  public static <T> RetrievalOutcome<T> failure(FailureReason reason, @Nullable String detail) {
    return new RetrievalOutcome<>(
        null, Objects.requireNonNull(reason, "reason must not be null"), detail);
  }

  public boolean isSuccess() {
    return reason == null;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this is a failure
   */
  public T value() {
    if (value == null) {
      throw new IllegalStateException("No value: " + reason + " (" + detail + ")");
    }
    return value;
  }

  public T valueOr(T fallback) {
    return value != null ? value : fallback;
  }

  public T valueOrGet(Supplier<T> fallback) {
    return value != null ? value : fallback.get();
  }

  /** The failure reason, null on success. */
  public @Nullable FailureReason reason() {
    return reason;
  }

  /** Human-readable failure detail, null on success. */
  public @Nullable String detail() {
    return detail;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success[" + value + "]" : "Failure[" + reason + ": " + detail + "]";
  }
}
