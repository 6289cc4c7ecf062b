package scribe.selection;

import scribe.TextDocument;
import scribe.text.Index;

import java.util.Objects;

/**
 * A pair of indexes into a document. The head is where the caret is drawn; the tail is the anchor
 * of the highlighted extent. A selection whose head equals its tail is a plain caret.
 */
public final class Selection {
  public final Index head;
  public final Index tail;

  public Selection(Index head, Index tail) {
    this.head = Objects.requireNonNull(head);
    this.tail = Objects.requireNonNull(tail);
  }

  public Selection(int headRow, int headColumn, int tailRow, int tailColumn) {
    this(new Index(headRow, headColumn), new Index(tailRow, tailColumn));
  }

  public static Selection caret(Index index) {
    return new Selection(index, index);
  }

  public static Selection caret(int row, int column) {
    return caret(new Index(row, column));
  }

  /**
   * A selection from {@code (0, 0)} shaped like {@code content}: one row per newline, and the final
   * column is the length of the text after the last newline.
   */
  public static Selection measuring(String content) {
    int rows = 0;
    int lastNewline = -1;
    for (int i = 0; i < content.length(); i++) {
      if (content.charAt(i) == '\n') {
        rows += 1;
        lastNewline = i;
      }
    }
    return new Selection(Index.ZERO, new Index(rows, content.length() - lastNewline - 1));
  }

  /**
   * The same shape, moved so that the head sits on {@code index}. Only meaningful for oriented
   * selections headed at {@code (0, 0)}, i.e. the ones {@link #measuring} returns.
   */
  public Selection startingFrom(Index index) {
    Index t = this.tail.row == this.head.row
              ? new Index(index.row, index.column + this.tail.column - this.head.column)
              : new Index(index.row + this.tail.row - this.head.row, this.tail.column);
    return new Selection(index, t);
  }

  public Selection withHead(Index head) {
    return new Selection(head, this.tail);
  }

  public Selection withTail(Index tail) {
    return new Selection(this.head, tail);
  }

  public Selection swapped() {
    return new Selection(this.tail, this.head);
  }

  public boolean isOriented() {
    return this.head.compareTo(this.tail) <= 0;
  }

  public Selection oriented() {
    return isOriented() ? this : swapped();
  }

  public boolean isSingular() {
    return this.head.equals(this.tail);
  }

  public boolean isSingleLine() {
    return this.head.row == this.tail.row;
  }

  public boolean intersectsRow(int row) {
    Selection s = oriented();
    return s.head.row <= row && row <= s.tail.row;
  }

  /**
   * Columns {@code [from, to)} covered on {@code row}, whose length is {@code numColumns}.
   * Interior rows of a multi-line selection are covered entirely; an untouched row yields {@code [0, 0)}.
   */
  public int[] getColumnRangeOnRow(int row, int numColumns) {
    Selection s = oriented();
    if (!s.intersectsRow(row)) {
      return new int[]{0, 0};
    }
    int from = row == s.head.row ? s.head.column : 0;
    int to = row == s.tail.row ? s.tail.column : numColumns;
    return new int[]{from, to};
  }

  /**
   * Columns pushed out to the line start and line end, away from the orientation, so that the
   * result covers every character of every line this selection touches.
   */
  public Selection horizontallyMaximized(TextDocument document) {
    if (isOriented()) {
      return new Selection(this.head.withColumn(0),
                           this.tail.withColumn(document.getNumColumns(this.tail.row)));
    }
    else {
      return new Selection(this.head.withColumn(document.getNumColumns(this.head.row)),
                           this.tail.withColumn(0));
    }
  }

  /*
   * The text spanned by this selection is disappearing: shift index back over it.
   * Indexes inside the span collapse onto its start.
   * */
  public Index pull(Index index) {
    Selection s = oriented();
    if (index.compareTo(s.head) <= 0) {
      return index;
    }
    if (index.compareTo(s.tail) <= 0) {
      return s.head;
    }
    if (index.row == s.tail.row) {
      return new Index(s.head.row, index.column - s.tail.column + s.head.column);
    }
    return new Index(index.row - (s.tail.row - s.head.row), index.column);
  }

  /*
   * The text spanned by this selection is appearing: shift index forward over it.
   * An index sitting exactly on the insertion point is pushed past the new text.
   * */
  public Index push(Index index) {
    Selection s = oriented();
    if (index.compareTo(s.head) < 0) {
      return index;
    }
    if (index.row == s.head.row) {
      return new Index(s.tail.row, index.column - s.head.column + s.tail.column);
    }
    return new Index(index.row + (s.tail.row - s.head.row), index.column);
  }

  public Selection pullBy(Selection other) {
    return new Selection(other.pull(this.head), other.pull(this.tail));
  }

  public Selection pushBy(Selection other) {
    return new Selection(other.push(this.head), other.push(this.tail));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Selection selection = (Selection)o;
    return head.equals(selection.head) &&
           tail.equals(selection.tail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(head, tail);
  }

  @Override
  public String toString() {
    return "Selection{" +
           "head=" + head +
           ", tail=" + tail +
           '}';
  }
}
