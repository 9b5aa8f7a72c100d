package ca.gc.cra.warden.application.path;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes a raw path through percent-decoding rounds and Unicode normalization, keeping every stage.
 *
 * <p>Percent-decoding is lenient: malformed escapes stay as-is and {@code +} is not treated as a space. The
 * overlong UTF-8 forms {@code %c0%ae}, {@code %c0%af} and {@code %c1%9c} decode to {@code .}, {@code /} and
 * {@code \}. Decoding stops once a round changes nothing or {@link #MAX_DECODE_ROUNDS} is reached.</p>
 *
 * @since 0.1.0
 */
final class PathDecoder {
  static final int MAX_DECODE_ROUNDS = 4;

  private PathDecoder() {}

  static Decoding decode(String raw) {
    Objects.requireNonNull(raw, "raw");
    List<String> stages = new ArrayList<>();
    stages.add(raw);
    String current = raw;
    for (int round = 0; round < MAX_DECODE_ROUNDS; round++) {
      String next = percentDecodeOnce(current);
      if (next.equals(current)) {
        break;
      }
      stages.add(next);
      current = next;
    }
    String unicode = Normalizer.normalize(decodeUnicodeEscapes(current), Normalizer.Form.NFKC);
    return new Decoding(List.copyOf(stages), unicode);
  }

  static String percentDecodeOnce(String input) {
    if (input.indexOf('%') < 0) {
      return input;
    }
    StringBuilder out = new StringBuilder(input.length());
    ByteArrayOutputStream pending = new ByteArrayOutputStream();
    int i = 0;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '%' && i + 2 < input.length()
          && hex(input.charAt(i + 1)) >= 0 && hex(input.charAt(i + 2)) >= 0) {
        pending.write(hex(input.charAt(i + 1)) << 4 | hex(input.charAt(i + 2)));
        i += 3;
        continue;
      }
      flush(pending, out);
      out.append(c);
      i++;
    }
    flush(pending, out);
    return out.toString();
  }

  static String decodeUnicodeEscapes(String input) {
    if (input.indexOf("\\u") < 0 && input.indexOf("\\U") < 0) {
      return input;
    }
    StringBuilder out = new StringBuilder(input.length());
    int i = 0;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '\\' && i + 5 < input.length()
          && (input.charAt(i + 1) == 'u' || input.charAt(i + 1) == 'U')
          && allHex(input, i + 2, i + 6)) {
        out.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
        i += 6;
        continue;
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private static void flush(ByteArrayOutputStream pending, StringBuilder out) {
    if (pending.size() == 0) {
      return;
    }
    byte[] bytes = replaceOverlong(pending.toByteArray());
    pending.reset();
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      out.append(decoder.decode(ByteBuffer.wrap(bytes)));
    } catch (CharacterCodingException ex) {
      out.append(new String(bytes, StandardCharsets.ISO_8859_1));
    }
  }

  private static byte[] replaceOverlong(byte[] bytes) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
    int i = 0;
    while (i < bytes.length) {
      int b0 = bytes[i] & 0xFF;
      int b1 = i + 1 < bytes.length ? bytes[i + 1] & 0xFF : -1;
      if (b0 == 0xC0 && b1 == 0xAE) {
        out.write('.');
        i += 2;
      } else if (b0 == 0xC0 && b1 == 0xAF) {
        out.write('/');
        i += 2;
      } else if (b0 == 0xC1 && b1 == 0x9C) {
        out.write('\\');
        i += 2;
      } else {
        out.write(b0);
        i++;
      }
    }
    return out.toByteArray();
  }

  private static boolean allHex(String input, int from, int to) {
    if (to > input.length()) {
      return false;
    }
    for (int i = from; i < to; i++) {
      if (hex(input.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  private static int hex(char c) {
    if (c >= '0' && c <= '9') {
      return c - '0';
    }
    if (c >= 'a' && c <= 'f') {
      return c - 'a' + 10;
    }
    if (c >= 'A' && c <= 'F') {
      return c - 'A' + 10;
    }
    return -1;
  }

  /**
   * Decoding stages of one input.
   *
   * @param percentStages raw input followed by each percent-decoding round that changed the text
   * @param unicodeDecoded final percent stage after {@code \\uXXXX} unescaping and NFKC normalization
   */
  record Decoding(List<String> percentStages, String unicodeDecoded) {
    String raw() {
      return percentStages.get(0);
    }

    String percentDecoded() {
      return percentStages.get(percentStages.size() - 1);
    }

    int decodeRounds() {
      return percentStages.size() - 1;
    }

    /**
     * Index of the first percent stage containing a {@code ..} segment.
     *
     * @return stage index (0 is raw), or -1 when no percent stage contains one
     */
    int firstTraversalStage() {
      for (int i = 0; i < percentStages.size(); i++) {
        if (PathSegments.hasParentSegment(percentStages.get(i))) {
          return i;
        }
      }
      return -1;
    }

    boolean containsNul() {
      if (unicodeDecoded.indexOf('\0') >= 0) {
        return true;
      }
      for (String stage : percentStages) {
        if (stage.indexOf('\0') >= 0) {
          return true;
        }
      }
      return false;
    }
  }
}
