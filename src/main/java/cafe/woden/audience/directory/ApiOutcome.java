package cafe.woden.audience.directory;

/**
 * Result of one REST call.
 *
 * <p>Rate limiting is an expected outcome, not an exception: callers branch on the variant and
 * reschedule their remaining work on {@link RateLimited}.
 */
public sealed interface ApiOutcome<T>
    permits ApiOutcome.Success, ApiOutcome.RateLimited, ApiOutcome.Failed {

  record Success<T>(T value) implements ApiOutcome<T> {}

  /** HTTP 429; {@code resetEpochSeconds} is 0 when the endpoint did not say. */
  record RateLimited<T>(long resetEpochSeconds) implements ApiOutcome<T> {}

  /** Any other non-success status; {@code status} is -1 for IO errors and timeouts. */
  record Failed<T>(int status, String detail) implements ApiOutcome<T> {}

  static <T> ApiOutcome<T> success(T value) {
    return new Success<>(value);
  }

  static <T> ApiOutcome<T> rateLimited(long resetEpochSeconds) {
    return new RateLimited<>(resetEpochSeconds);
  }

  static <T> ApiOutcome<T> failed(int status, String detail) {
    return new Failed<>(status, detail);
  }
}
