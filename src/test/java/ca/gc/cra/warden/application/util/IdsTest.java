package ca.gc.cra.warden.application.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IdsTest {

  @Test
  void idsCarryPrefixAndUlid() {
    String id = Ids.next("INC", 1_714_564_800_000L);

    assertTrue(id.startsWith("INC-"));
    assertEquals(30, id.length());
    assertTrue(id.substring(4).matches("[0-9A-HJKMNP-TV-Z]{26}"));
  }

  @Test
  void idsSortByTime() {
    String earlier = Ids.next("INC", 1_000L);
    String later = Ids.next("INC", 2_000L);

    assertTrue(earlier.compareTo(later) < 0);
    assertNotEquals(Ids.next("INC", 1_000L), Ids.next("INC", 1_000L));
  }
}
