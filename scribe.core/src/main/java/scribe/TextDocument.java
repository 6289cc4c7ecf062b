package scribe;

import scribe.selection.Selection;
import scribe.text.Index;
import scribe.text.LineStore;
import scribe.text.StyleTokens;
import scribe.undo.Fulfiller;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lines of text, their style tokens, and the selections placed on them.
 * <p>
 * {@link #fulfill} is the only way to change the text. Every other selection is re-anchored by
 * {@link Selection#pullBy} and {@link Selection#pushBy} as part of the same call, so edits made on
 * behalf of sibling carets in one keystroke leave all of them where they belong.
 */
public class TextDocument implements Fulfiller<Transaction> {
  private static final Logger log = LoggerFactory.getLogger(TextDocument.class);

  private final int tabWidth;
  private LineStore lines;
  private StyleTokens tokens;
  private final List<Selection> selections = new ArrayList<>();

  public TextDocument() {
    this(EditorSettings.DEFAULT);
  }

  public TextDocument(EditorSettings settings) {
    this.tabWidth = settings.tabWidth;
    replaceAll("");
  }

  public static TextDocument of(String content) {
    TextDocument document = new TextDocument();
    document.replaceAll(content);
    return document;
  }

  /**
   * Replaces the whole text and drops every selection in favour of one caret at {@code (0, 0)}.
   */
  public void replaceAll(String content) {
    this.lines = LineStore.of(content);
    this.tokens = new StyleTokens(this.lines);
    this.selections.clear();
    this.selections.add(Selection.caret(Index.ZERO));
    log.debug("document reset to {} rows", this.lines.getNumRows());
  }

  public String getText() {
    return String.join("\n", this.lines.lines());
  }

  public List<String> getLines() {
    return this.lines.lines();
  }

  public int getNumRows() {
    return this.lines.getNumRows();
  }

  public int getNumColumns(int row) {
    return this.lines.getNumColumns(row);
  }

  public String getLine(int row) {
    return this.lines.getLine(row);
  }

  public Index getEnd() {
    return new Index(getNumRows(), 0);
  }

  /*
   * the end sentinel and the end of every line read as a virtual '\n'
   * */
  public char getCharacter(Index index) {
    if (index.row == getNumRows() && index.column == 0) {
      return '\n';
    }
    String line = getLine(index.row);
    if (index.column > line.length()) {
      throw new IndexOutOfBoundsException("column: " + index.column + ", row " + index.row + " length: " + line.length());
    }
    return index.column == line.length() ? '\n' : line.charAt(index.column);
  }

  private char getCharacterBefore(Index index) {
    Index p = prev(index);
    return p.equals(index) ? '\n' : getCharacter(p);
  }

  // Movement primitives. Each returns its argument unchanged when it cannot move.

  public Index next(Index index) {
    if (index.row >= getNumRows()) {
      return index;
    }
    if (index.column < getNumColumns(index.row)) {
      return index.withColumn(index.column + 1);
    }
    return new Index(index.row + 1, 0);
  }

  public Index prev(Index index) {
    if (index.column > 0) {
      return index.withColumn(index.column - 1);
    }
    if (index.row > 0) {
      return new Index(index.row - 1, getNumColumns(index.row - 1));
    }
    return index;
  }

  public Index nextRow(Index index) {
    if (index.row >= getNumRows()) {
      return index;
    }
    if (index.row < getNumRows() - 1) {
      return new Index(index.row + 1, Math.min(index.column, getNumColumns(index.row + 1)));
    }
    return lineEnd(index);
  }

  public Index prevRow(Index index) {
    if (index.row > 0) {
      int row = Math.min(index.row, getNumRows()) - 1;
      return new Index(row, Math.min(index.column, getNumColumns(row)));
    }
    return Index.ZERO;
  }

  /*
   * skip the whitespace run under the index, then stop on the next whitespace character
   * */
  public Index nextWord(Index index) {
    Index i = index;
    while (Character.isWhitespace(getCharacter(i))) {
      Index n = next(i);
      if (n.equals(i)) return i;
      i = n;
    }
    while (!Character.isWhitespace(getCharacter(i))) {
      Index n = next(i);
      if (n.equals(i)) return i;
      i = n;
    }
    return i;
  }

  public Index prevWord(Index index) {
    Index i = index;
    while (Character.isWhitespace(getCharacterBefore(i))) {
      Index p = prev(i);
      if (p.equals(i)) return i;
      i = p;
    }
    return wordStart(i);
  }

  private Index wordStart(Index index) {
    Index i = index;
    while (!Character.isWhitespace(getCharacterBefore(i))) {
      i = prev(i);
    }
    return i;
  }

  private Index wordEnd(Index index) {
    Index i = index;
    while (!Character.isWhitespace(getCharacter(i))) {
      i = next(i);
    }
    return i;
  }

  public Index lineStart(Index index) {
    return index.row >= getNumRows() ? index : index.withColumn(0);
  }

  public Index lineEnd(Index index) {
    return index.row >= getNumRows() ? index : index.withColumn(getNumColumns(index.row));
  }

  /**
   * Pulls an arbitrary (row, column) pair into the document. Meant for input coming from outside,
   * e.g. a hit-test; never applied to transactions.
   */
  public Index clamp(int row, int column) {
    int r = Math.max(0, Math.min(row, getNumRows() - 1));
    int c = Math.max(0, Math.min(column, getNumColumns(r)));
    return new Index(r, c);
  }

  // Selections

  public List<Selection> getSelections() {
    return Collections.unmodifiableList(new ArrayList<>(this.selections));
  }

  public int getNumSelections() {
    return this.selections.size();
  }

  public Selection getSelection(int slot) {
    return this.selections.get(slot);
  }

  public void setSelections(List<Selection> selections) {
    if (selections.isEmpty()) {
      throw new IllegalArgumentException("a document needs at least one selection");
    }
    for (Selection selection : selections) {
      checkSelection(selection);
    }
    this.selections.clear();
    this.selections.addAll(selections);
  }

  public void setSelection(int slot, Selection selection) {
    checkSelection(selection);
    this.selections.set(slot, selection);
  }

  public void addSelection(Selection selection) {
    checkSelection(selection);
    this.selections.add(selection);
  }

  private void checkSelection(Selection selection) {
    checkIndex(selection.head);
    checkIndex(selection.tail);
  }

  private void checkIndex(Index index) {
    if (index.column > getNumColumns(index.row)) {
      throw new IndexOutOfBoundsException("index " + index + " is past the end of its row");
    }
  }

  /**
   * Computes where every selection would be after {@code navigation}, without storing anything.
   * With {@code fixingTail} the tails stay put and only heads move (shift-extend); otherwise each
   * result collapses to a caret. Whole-document, whole-line and whole-word navigations always
   * produce their own tail.
   */
  public List<Selection> getSelections(Navigation navigation, boolean fixingTail) {
    List<Selection> result = new ArrayList<>(this.selections.size());
    for (Selection selection : this.selections) {
      result.add(navigate(selection, navigation, fixingTail));
    }
    return Collections.unmodifiableList(result);
  }

  private Selection navigate(Selection selection, Navigation navigation, boolean fixingTail) {
    Index head = selection.head;
    Index tail = selection.tail;
    switch (navigation) {
      case IDENTITY:
        return selection;
      case WHOLE_DOCUMENT:
        head = getEnd();
        tail = Index.ZERO;
        break;
      case WHOLE_LINE:
        tail = lineStart(head);
        head = next(lineEnd(head));
        break;
      case WHOLE_WORD:
        tail = wordStart(head);
        head = wordEnd(head);
        break;
      case FORWARD_BY_CHAR:
        head = next(head);
        break;
      case BACKWARD_BY_CHAR:
        head = prev(head);
        break;
      case FORWARD_BY_WORD:
        head = nextWord(head);
        break;
      case BACKWARD_BY_WORD:
        head = prevWord(head);
        break;
      case FORWARD_BY_LINE:
        head = nextRow(head);
        break;
      case BACKWARD_BY_LINE:
        head = prevRow(head);
        break;
      case TO_LINE_START:
        head = lineStart(head);
        break;
      case TO_LINE_END:
        head = lineEnd(head);
        break;
      default:
        throw new AssertionError(navigation);
    }
    if (head.equals(getEnd())) {
      head = prev(head);
    }
    if (navigation.isExpansion()) {
      return new Selection(head, tail);
    }
    return fixingTail ? new Selection(head, tail) : Selection.caret(head);
  }

  /**
   * The text spanned by {@code selection}, lines joined with {@code '\n'}.
   */
  public String getSelectionContent(Selection selection) {
    Selection s = selection.oriented();
    if (s.isSingleLine()) {
      return getLine(s.head.row).substring(s.head.column, s.tail.column);
    }
    StringBuilder sb = new StringBuilder(getLine(s.head.row).substring(s.head.column));
    for (int row = s.head.row + 1; row < s.tail.row; row++) {
      sb.append('\n').append(getLine(row));
    }
    sb.append('\n').append(getLine(s.tail.row), 0, s.tail.column);
    return sb.toString();
  }

  // Style tokens

  public int getToken(Index index) {
    return this.tokens.getToken(index.row, index.column);
  }

  /**
   * Marks every character under {@code zone} with {@code token}.
   */
  public void applyTokens(Selection zone, int token) {
    Selection s = zone.oriented();
    for (int row = s.head.row; row <= s.tail.row && row < getNumRows(); row++) {
      int[] columns = s.getColumnRangeOnRow(row, getNumColumns(row));
      this.tokens.setTokens(row, columns[0], columns[1], token);
    }
  }

  public void clearTokens() {
    this.tokens.reset(this.lines);
  }

  /**
   * Applies {@code transaction} and returns its reciprocal.
   * <p>
   * The edited slot (if the transaction names one that still exists) becomes a caret after the
   * inserted text on a forward edit, or the restored text's selection when replaying a reciprocal.
   * Every other selection is shifted over the removed and the inserted text.
   */
  @NotNull
  @Override
  public Transaction fulfill(@NotNull Transaction transaction) {
    Transaction t = transaction.normalized(this, this.tabWidth);
    Selection s = t.selection.oriented();
    String replaced = getSelectionContent(s.horizontallyMaximized(this));

    int i = s.head.column;
    int j = replaced.lastIndexOf('\n') + s.tail.column + 1;
    String merged = replaced.substring(0, i) + t.content + replaced.substring(j);
    Selection inserted = Selection.measuring(t.content).startingFrom(s.head);

    boolean hasSlot = 0 <= t.slot && t.slot < this.selections.size();
    for (int k = 0; k < this.selections.size(); k++) {
      if (!hasSlot || k != t.slot) {
        this.selections.set(k, this.selections.get(k).pullBy(s).pushBy(inserted));
      }
    }

    List<String> rows = LineStore.splitLines(merged);
    this.lines.replaceRows(s.head.row, s.tail.row, rows);
    this.tokens.replaceRows(s.head.row, s.tail.row, rows);

    Transaction reciprocal = new Transaction(inserted,
                                             replaced.substring(i, j),
                                             t.direction.flipped(),
                                             t.slot,
                                             AffectedArea.UNBOUNDED,
                                             true);
    if (hasSlot) {
      this.selections.set(t.slot, reciprocal.direction == Transaction.Direction.REVERSE
                                  ? Selection.caret(inserted.tail)
                                  : inserted);
    }
    log.trace("fulfilled {}, reciprocal {}", t, reciprocal);
    return reciprocal;
  }

  /*
   * nothing was removed and nothing was inserted
   * */
  @Override
  public boolean isEmpty(@NotNull Transaction reciprocal) {
    return reciprocal.selection.isSingular() && reciprocal.content.isEmpty();
  }

  @Override
  public String toString() {
    return "TextDocument{" +
           "lines=" + this.lines.lines() +
           ", selections=" + this.selections +
           '}';
  }
}
