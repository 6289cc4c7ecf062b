package scribe.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IndexTest {

  @Test
  public void ordersRowFirstThenColumn() {
    assertTrue(Index.of(0, 9).isBefore(Index.of(1, 0)));
    assertTrue(Index.of(2, 3).isAfter(Index.of(2, 1)));
    assertEquals(0, Index.of(4, 4).compareTo(new Index(4, 4)));
  }

  @Test
  public void negativeCoordinatesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Index.of(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> Index.of(0, 2).translated(0, -3));
  }
}
