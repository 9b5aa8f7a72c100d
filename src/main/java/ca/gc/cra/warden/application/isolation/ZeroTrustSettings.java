package ca.gc.cra.warden.application.isolation;

/**
 * Limits used by {@link ZeroTrustIsolation}.
 *
 * @param activityHistoryLimit per-project capacity of the activity ring
 * @param rateLimitPerMinute accesses per minute allowed once a project is rate limited
 * @since 0.1.0
 */
public record ZeroTrustSettings(int activityHistoryLimit, int rateLimitPerMinute) {
  public ZeroTrustSettings {
    if (activityHistoryLimit <= 0) {
      throw new IllegalArgumentException("activityHistoryLimit must be positive");
    }
    if (rateLimitPerMinute <= 0) {
      throw new IllegalArgumentException("rateLimitPerMinute must be positive");
    }
  }

  public static ZeroTrustSettings defaults() {
    return new ZeroTrustSettings(1000, 60);
  }
}
