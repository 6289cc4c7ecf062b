package scribe;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AffectedAreaTest {

  @Test
  public void unboundedCoversEveryRow() {
    assertTrue(AffectedArea.UNBOUNDED.isUnbounded());
    assertTrue(AffectedArea.UNBOUNDED.intersectsRow(0));
    assertTrue(AffectedArea.UNBOUNDED.intersectsRow(1_000_000));
  }

  @Test
  public void rowRanges() {
    AffectedArea area = AffectedArea.rows(2, 4);
    assertFalse(area.isUnbounded());
    assertTrue(area.intersectsRow(2));
    assertTrue(area.intersectsRow(4));
    assertFalse(area.intersectsRow(5));
    assertThrows(IllegalArgumentException.class, () -> AffectedArea.rows(3, 1));
  }
}
