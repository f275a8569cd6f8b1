package playlog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlushResultTest {

  @Test
  void skippedResultIsFlaggedAndEmpty() {
    FlushResult result = FlushResult.skippedResult();

    assertTrue(result.skipped());
    assertEquals(0, result.total());
    assertNotEquals(FlushResult.empty(), result);
  }

  @Test
  void writtenResultsAreNotSkipped() {
    FlushResult result = FlushResult.of(3, 1);

    assertFalse(result.skipped());
    assertEquals(4, result.total());
    assertFalse(FlushResult.empty().skipped());
  }

  @Test
  void rejectsNegativeCounts() {
    assertThrows(IllegalArgumentException.class, () -> FlushResult.of(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> FlushResult.of(0, -1));
  }
}
