package ca.gc.cra.warden.application.path;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FilenameSanitizerTest {

  @Test
  void replacesIllegalCharactersAndWhitespace() {
    assertEquals("my_file_.txt", FilenameSanitizer.sanitize("my file?.txt"));
    assertEquals("a_b_c_d", FilenameSanitizer.sanitize("a<b>c|d"));
    assertEquals("tab_name", FilenameSanitizer.sanitize("tab\tname"));
  }

  @Test
  void stripsTraversalTokensAndLeadingDots() {
    assertEquals("__etc_passwd", FilenameSanitizer.sanitize("../../etc/passwd"));
    assertEquals("hidden", FilenameSanitizer.sanitize(".hidden"));
  }

  @Test
  void fallsBackWhenNothingRemains() {
    assertEquals("safe_file", FilenameSanitizer.sanitize(null));
    assertEquals("safe_file", FilenameSanitizer.sanitize(""));
    assertEquals("safe_file", FilenameSanitizer.sanitize("....."));
  }

  @Test
  void capsLength() {
    assertEquals(255, FilenameSanitizer.sanitize("x".repeat(300)).length());
  }
}
