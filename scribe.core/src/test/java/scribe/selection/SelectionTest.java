package scribe.selection;

import scribe.TextDocument;
import scribe.text.Index;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionTest {

  @Test
  public void orientedSwapsBackwardSelections() {
    Selection backward = new Selection(2, 1, 0, 4);
    assertFalse(backward.isOriented());
    assertEquals(new Selection(0, 4, 2, 1), backward.oriented());
    Selection forward = new Selection(0, 1, 0, 3);
    assertSame(forward, forward.oriented());
  }

  @Test
  public void singularAndSingleLine() {
    assertTrue(Selection.caret(3, 2).isSingular());
    assertTrue(new Selection(1, 0, 1, 5).isSingleLine());
    assertFalse(new Selection(1, 0, 2, 0).isSingleLine());
  }

  @Test
  public void columnRangesCoverInteriorRowsEntirely() {
    Selection s = new Selection(3, 2, 1, 4);
    assertTrue(s.intersectsRow(2));
    assertFalse(s.intersectsRow(0));
    assertArrayEquals(new int[]{4, 10}, s.getColumnRangeOnRow(1, 10));
    assertArrayEquals(new int[]{0, 7}, s.getColumnRangeOnRow(2, 7));
    assertArrayEquals(new int[]{0, 2}, s.getColumnRangeOnRow(3, 8));
    assertArrayEquals(new int[]{0, 0}, s.getColumnRangeOnRow(4, 8));
  }

  @Test
  public void horizontallyMaximizedFollowsOrientation() {
    TextDocument document = TextDocument.of("abc\ndefg\nhi");
    assertEquals(new Selection(0, 0, 1, 4), new Selection(0, 2, 1, 1).horizontallyMaximized(document));
    assertEquals(new Selection(1, 4, 0, 0), new Selection(1, 1, 0, 2).horizontallyMaximized(document));
    assertEquals(new Selection(2, 0, 2, 2), Selection.caret(2, 1).horizontallyMaximized(document));
  }

  @Test
  public void measuringTakesTheShapeOfContent() {
    assertEquals(new Selection(0, 0, 0, 3), Selection.measuring("abc"));
    assertEquals(new Selection(0, 0, 2, 1), Selection.measuring("ab\n\nc"));
    assertEquals(new Selection(0, 0, 1, 0), Selection.measuring("\n"));
    assertTrue(Selection.measuring("").isSingular());
  }

  @Test
  public void startingFromAnchorsTheShape() {
    assertEquals(new Selection(2, 5, 2, 8), Selection.measuring("abc").startingFrom(Index.of(2, 5)));
    assertEquals(new Selection(2, 5, 4, 1), Selection.measuring("ab\n\nc").startingFrom(Index.of(2, 5)));
  }

  @Test
  public void pullShiftsIndexesAfterTheRemovedText() {
    Selection removed = new Selection(1, 2, 1, 5);
    assertEquals(Index.of(1, 1), removed.pull(Index.of(1, 1)));
    assertEquals(Index.of(1, 4), removed.pull(Index.of(1, 7)));
    assertEquals(Index.of(3, 7), removed.pull(Index.of(3, 7)));
    assertEquals(Index.of(1, 2), removed.pull(Index.of(1, 3)));
  }

  @Test
  public void pullAcrossRowsJoinsTheTailRowOntoTheHeadRow() {
    Selection removed = new Selection(3, 1, 1, 4);
    assertEquals(Index.of(1, 6), removed.pull(Index.of(3, 3)));
    assertEquals(Index.of(2, 3), removed.pull(Index.of(4, 3)));
    assertEquals(Index.of(1, 2), removed.pull(Index.of(1, 2)));
    assertEquals(Index.of(0, 9), removed.pull(Index.of(0, 9)));
  }

  @Test
  public void pushShiftsIndexesAtOrAfterTheInsertionPoint() {
    Selection inserted = new Selection(0, 1, 0, 2);
    assertEquals(Index.of(0, 4), inserted.push(Index.of(0, 3)));
    assertEquals(Index.of(0, 2), inserted.push(Index.of(0, 1)));
    assertEquals(Index.of(0, 0), inserted.push(Index.of(0, 0)));
    assertEquals(Index.of(5, 0), inserted.push(Index.of(5, 0)));
  }

  @Test
  public void pushAcrossRowsMovesTheRestOfTheLineDown() {
    Selection inserted = new Selection(1, 3, 3, 2);
    assertEquals(Index.of(3, 4), inserted.push(Index.of(1, 5)));
    assertEquals(Index.of(4, 1), inserted.push(Index.of(2, 1)));
    assertEquals(Index.of(1, 2), inserted.push(Index.of(1, 2)));
  }

  @Test
  public void pullUndoesPushOutsideTheSpan() {
    Selection text = new Selection(1, 3, 3, 2);
    Index[] probes = {Index.of(0, 7), Index.of(1, 2), Index.of(1, 9), Index.of(2, 0), Index.of(6, 6)};
    for (Index probe : probes) {
      assertEquals(probe, text.pull(text.push(probe)), probe.toString());
    }
  }

  @Test
  public void pullByAndPushByMoveBothEnds() {
    Selection other = new Selection(0, 6, 0, 4);
    Selection removed = new Selection(0, 1, 0, 3);
    assertEquals(new Selection(0, 4, 0, 2), other.pullBy(removed));
    assertEquals(new Selection(0, 8, 0, 6), other.pushBy(removed));
  }
}
