package ca.gc.cra.warden.application.util;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates prefixed, time-sortable identifiers such as {@code INC-01J2...}.
 *
 * <p>The suffix is a 26-character Crockford base32 ULID: 48 bits of epoch milliseconds followed by 80 random
 * bits.</p>
 *
 * @since 0.1.0
 */
public final class Ids {
  private static final char[] CROCKFORD = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

  private Ids() {}

  /**
   * Creates a new identifier.
   *
   * @param prefix short type prefix such as {@code INC}
   * @param epochMillis timestamp encoded in the leading characters
   * @return identifier formatted as {@code prefix-ULID}
   */
  public static String next(String prefix, long epochMillis) {
    Objects.requireNonNull(prefix, "prefix");
    return prefix + '-' + ulid(epochMillis);
  }

  static String ulid(long epochMillis) {
    char[] chars = new char[26];
    for (int i = 9; i >= 0; i--) {
      chars[i] = CROCKFORD[(int) (epochMillis & 0x1F)];
      epochMillis >>>= 5;
    }
    byte[] randomness = new byte[10];
    ThreadLocalRandom.current().nextBytes(randomness);
    int buffer = 0;
    int bits = 0;
    int out = 10;
    for (byte b : randomness) {
      buffer = (buffer << 8) | (b & 0xFF);
      bits += 8;
      while (bits >= 5) {
        bits -= 5;
        chars[out++] = CROCKFORD[(buffer >> bits) & 0x1F];
      }
    }
    return new String(chars);
  }
}
