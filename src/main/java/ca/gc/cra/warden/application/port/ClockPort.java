package ca.gc.cra.warden.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the security core.
 * <p><strong>Why:</strong> Debounce windows, verification windows and incident timestamps must be controllable
 * in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the security loop and caller threads
 * read the clock concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
