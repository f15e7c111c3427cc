package cafe.woden.audience.irc;

/** Exponential reconnect delay: {@code min(max, 2^retryCount)} seconds. */
public final class ReconnectBackoff {

  public static final int DEFAULT_MAX_SECONDS = 30;

  private ReconnectBackoff() {}

  public static long delaySeconds(int retryCount) {
    return delaySeconds(retryCount, DEFAULT_MAX_SECONDS);
  }

  public static long delaySeconds(int retryCount, int maxSeconds) {
    long cap = Math.max(1, maxSeconds);
    int attempt = Math.max(0, retryCount);
    // 2^62 is the last power that fits; anything past the cap is clamped anyway.
    if (attempt >= 62) return cap;
    return Math.min(cap, 1L << attempt);
  }
}
