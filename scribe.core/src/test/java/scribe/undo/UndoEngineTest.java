package scribe.undo;

import scribe.TextDocument;
import scribe.Transaction;
import scribe.selection.Selection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class UndoEngineTest {

  /*
   * adds its transaction to a running total; the reciprocal of x is -x
   * */
  private static final class Accumulator implements Fulfiller<Integer> {
    int total;

    @Override
    public Integer fulfill(Integer transaction) {
      total += transaction;
      return -transaction;
    }
  }

  private final AtomicLong now = new AtomicLong(1_000);
  private Accumulator accumulator;
  private UndoEngine<Integer> engine;

  @BeforeEach
  public void setUp() {
    accumulator = new Accumulator();
    engine = new UndoEngine<>(accumulator, 400, now::get);
  }

  @Test
  public void emptyHistoryReportsFailure() {
    assertFalse(engine.canUndo());
    assertFalse(engine.undo());
    assertFalse(engine.redo());
  }

  @Test
  public void editsWithinTheWindowUndoTogether() {
    for (int i = 1; i <= 5; i++) {
      engine.perform(i);
      now.addAndGet(100);
    }
    assertEquals(15, accumulator.total);
    assertEquals(1, engine.getNumUndoGroups());
    assertTrue(engine.undo());
    assertEquals(0, accumulator.total);
    assertFalse(engine.undo());
  }

  @Test
  public void aPauseStartsANewGroup() {
    engine.perform(1);
    now.addAndGet(401);
    engine.perform(2);
    assertEquals(2, engine.getNumUndoGroups());
    engine.undo();
    assertEquals(1, accumulator.total);
  }

  @Test
  public void beginNewGroupBreaksCoalescing() {
    engine.perform(1);
    engine.beginNewGroup();
    engine.perform(2);
    assertEquals(2, engine.getNumUndoGroups());
  }

  @Test
  public void redoReappliesAndNewEditsDropTheRedoStack() {
    engine.perform(3);
    engine.perform(4);
    assertTrue(engine.undo());
    assertEquals(0, accumulator.total);
    assertTrue(engine.canRedo());
    assertTrue(engine.redo());
    assertEquals(7, accumulator.total);
    assertTrue(engine.undo());
    engine.perform(10);
    assertFalse(engine.canRedo());
    assertEquals(10, accumulator.total);
  }

  @Test
  public void performAllIsAlwaysOneGroup() {
    engine.perform(1);
    now.addAndGet(1_000);
    engine.performAll(3, i -> 10 * (i + 1));
    assertEquals(61, accumulator.total);
    assertEquals(2, engine.getNumUndoGroups());
    engine.undo();
    assertEquals(1, accumulator.total);
    engine.performAll(0, i -> 99);
    assertEquals(1, engine.getNumUndoGroups());
  }

  @Test
  public void clearForgetsEverything() {
    engine.perform(1);
    engine.undo();
    engine.clear();
    assertFalse(engine.canUndo());
    assertFalse(engine.canRedo());
  }

  @Test
  public void typingBurstOnADocumentUndoesAtOnce() {
    TextDocument document = TextDocument.of("ac");
    document.setSelections(Arrays.asList(Selection.caret(0, 1)));
    UndoEngine<Transaction> undo = new UndoEngine<>(document, 400, now::get);
    for (char c : "bbb".toCharArray()) {
      undo.perform(Transaction.forSlot(document, 0, String.valueOf(c)));
      now.addAndGet(50);
    }
    assertEquals("abbbc", document.getText());
    assertEquals(Arrays.asList(Selection.caret(0, 4)), document.getSelections());

    assertTrue(undo.undo());
    assertEquals("ac", document.getText());
    assertEquals(Arrays.asList(Selection.caret(0, 1)), document.getSelections());

    assertTrue(undo.redo());
    assertEquals("abbbc", document.getText());
    assertEquals(Arrays.asList(Selection.caret(0, 4)), document.getSelections());
  }

  @Test
  public void editsThatChangeNothingAreNotRecorded() {
    TextDocument document = TextDocument.of("ab");
    UndoEngine<Transaction> undo = new UndoEngine<>(document, 400, now::get);
    undo.perform(Transaction.forSlot(document, 0, String.valueOf(Transaction.BACKSPACE)));
    undo.performAll(1, slot -> Transaction.forSlot(document, slot, ""));
    assertFalse(undo.canUndo());

    undo.perform(Transaction.forSlot(document, 0, "x"));
    undo.perform(Transaction.forSlot(document, 0, ""));
    assertEquals(1, undo.getNumUndoGroups());
    assertTrue(undo.undo());
    assertEquals("ab", document.getText());
  }
}
