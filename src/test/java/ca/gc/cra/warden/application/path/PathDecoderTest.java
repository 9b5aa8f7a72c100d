package ca.gc.cra.warden.application.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PathDecoderTest {

  @Test
  void percentDecodingIsLenient() {
    assertEquals("../", PathDecoder.percentDecodeOnce("%2e%2e%2f"));
    assertEquals("a+b%zz", PathDecoder.percentDecodeOnce("a+b%zz"));
    assertEquals("trailing%2", PathDecoder.percentDecodeOnce("trailing%2"));
  }

  @Test
  void overlongUtf8FormsDecodeToSeparators() {
    assertEquals("../", PathDecoder.percentDecodeOnce("%c0%ae%c0%ae%c0%af"));
    assertEquals("..\\", PathDecoder.percentDecodeOnce("%c0%ae%c0%ae%c1%9c"));
  }

  @Test
  void decodingStopsWhenNothingChanges() {
    PathDecoder.Decoding decoding = PathDecoder.decode("%252e%252e%252fsecret");

    assertEquals(2, decoding.decodeRounds());
    assertEquals("../secret", decoding.percentDecoded());
    assertEquals(2, decoding.firstTraversalStage());
  }

  @Test
  void decodingRoundsAreCapped() {
    PathDecoder.Decoding decoding = PathDecoder.decode("%25252525252e");

    assertEquals(PathDecoder.MAX_DECODE_ROUNDS, decoding.decodeRounds());
    assertEquals("%252e", decoding.percentDecoded());
  }

  @Test
  void unicodeEscapesAndCompatibilityFormsNormalize() {
    assertEquals("../etc", PathDecoder.decode("\\u002e\\u002e/etc").unicodeDecoded());
    assertEquals("../etc", PathDecoder.decode("．．/etc").unicodeDecoded());
    assertEquals(-1, PathDecoder.decode("\\u002e\\u002e/etc").firstTraversalStage());
  }

  @Test
  void nulIsFoundInAnyStage() {
    assertTrue(PathDecoder.decode("file%00.txt").containsNul());
    assertTrue(PathDecoder.decode("file%2500.txt").containsNul());
    assertFalse(PathDecoder.decode("file.txt").containsNul());
  }
}
