package scribe.undo;

import io.lacuna.bifurcan.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.LongSupplier;

/**
 * Undo history over a {@link Fulfiller}.
 * <p>
 * Every performed transaction is fulfilled right away and only its reciprocal is kept. Reciprocals
 * are collected in groups; a group is undone or redone as a single step. A new group starts when the
 * previous edit is older than the coalescing window or after {@link #beginNewGroup()}.
 */
public class UndoEngine<T> {
  private static final Logger log = LoggerFactory.getLogger(UndoEngine.class);

  /*
   * reciprocals in the order they were produced; replayed last to first
   * */
  static final class Group<T> {
    final List<T> reciprocals;

    Group(List<T> reciprocals) {
      this.reciprocals = reciprocals;
    }

    Group<T> add(T reciprocal) {
      return new Group<>(this.reciprocals.addLast(reciprocal));
    }

    int size() {
      return (int)this.reciprocals.size();
    }
  }

  private final Fulfiller<T> fulfiller;
  private final long coalesceMillis;
  private final LongSupplier clock;

  private List<Group<T>> undoStack = new List<>();
  private List<Group<T>> redoStack = new List<>();
  private boolean groupOpen = false;
  private long lastPerformed;

  public UndoEngine(Fulfiller<T> fulfiller, long coalesceMillis) {
    this(fulfiller, coalesceMillis, System::currentTimeMillis);
  }

  public UndoEngine(Fulfiller<T> fulfiller, long coalesceMillis, LongSupplier clock) {
    this.fulfiller = Objects.requireNonNull(fulfiller);
    this.coalesceMillis = coalesceMillis;
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * Fulfills {@code transaction} and records its reciprocal, joining the current group when the
   * last edit happened within the coalescing window.
   */
  public T perform(T transaction) {
    startGroupIfStale();
    return record(transaction);
  }

  /**
   * Performs {@code count} transactions as one step, e.g. a keystroke applied at every caret.
   * The i-th transaction is built only after the previous one has been fulfilled, so it sees the
   * document as the previous edits left it.
   */
  public void performAll(int count, IntFunction<T> transactionAt) {
    if (count <= 0) {
      return;
    }
    startGroupIfStale();
    for (int i = 0; i < count; i++) {
      record(transactionAt.apply(i));
    }
  }

  /*
   * navigation and other non-editing actions call this, so the next edit gets its own undo step
   * */
  public void beginNewGroup() {
    if (this.groupOpen) {
      log.debug("undo group closed, {} groups", this.undoStack.size());
    }
    this.groupOpen = false;
  }

  public boolean undo() {
    if (this.undoStack.size() == 0) {
      return false;
    }
    Group<T> group = this.undoStack.last();
    this.undoStack = this.undoStack.removeLast();
    this.redoStack = this.redoStack.addLast(replay(group));
    this.groupOpen = false;
    log.debug("undo of {} transactions, {} groups left", group.size(), this.undoStack.size());
    return true;
  }

  public boolean redo() {
    if (this.redoStack.size() == 0) {
      return false;
    }
    Group<T> group = this.redoStack.last();
    this.redoStack = this.redoStack.removeLast();
    this.undoStack = this.undoStack.addLast(replay(group));
    this.groupOpen = false;
    log.debug("redo of {} transactions, {} groups left", group.size(), this.redoStack.size());
    return true;
  }

  public boolean canUndo() {
    return this.undoStack.size() > 0;
  }

  public boolean canRedo() {
    return this.redoStack.size() > 0;
  }

  public int getNumUndoGroups() {
    return (int)this.undoStack.size();
  }

  public int getNumRedoGroups() {
    return (int)this.redoStack.size();
  }

  public void clear() {
    this.undoStack = new List<>();
    this.redoStack = new List<>();
    this.groupOpen = false;
  }

  private void startGroupIfStale() {
    long now = this.clock.getAsLong();
    if (now - this.lastPerformed > this.coalesceMillis) {
      this.groupOpen = false;
    }
    this.lastPerformed = now;
  }

  /*
   * the group itself is pushed by the first edit that changes something
   * */
  private T record(T transaction) {
    T reciprocal = this.fulfiller.fulfill(transaction);
    if (this.fulfiller.isEmpty(reciprocal)) {
      return reciprocal;
    }
    if (!this.groupOpen) {
      this.undoStack = this.undoStack.addLast(new Group<>(new List<>()));
      this.groupOpen = true;
    }
    Group<T> current = this.undoStack.last();
    this.undoStack = this.undoStack.set(this.undoStack.size() - 1, current.add(reciprocal));
    this.redoStack = new List<>();
    return reciprocal;
  }

  private Group<T> replay(Group<T> group) {
    Group<T> replayed = new Group<>(new List<>());
    for (long i = group.reciprocals.size() - 1; i >= 0; i--) {
      replayed = replayed.add(this.fulfiller.fulfill(group.reciprocals.nth(i)));
    }
    return replayed;
  }
}
