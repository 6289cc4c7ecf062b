package scribe;

import scribe.selection.Selection;
import scribe.text.Index;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A request to replace the text under {@link #selection} with {@link #content}.
 * <p>
 * {@link TextDocument#fulfill} applies a transaction and hands back its reciprocal, the transaction
 * that exactly undoes it. Content may contain {@code '\n'}; a trailing {@link #BACKSPACE},
 * {@link #DELETE} or {@link #TAB} code is normalized into plain replacement text before applying,
 * unless the transaction is {@link #literal}. Reciprocals are always literal.
 */
public final class Transaction {

  public static final char BACKSPACE = '\b';
  public static final char DELETE = '\u007f';
  public static final char TAB = '\t';

  public static final int NO_SLOT = -1;

  public enum Direction {
    FORWARD,
    REVERSE;

    public Direction flipped() {
      return this == FORWARD ? REVERSE : FORWARD;
    }
  }

  @NotNull public final Selection selection;
  @NotNull public final String content;
  @NotNull public final Direction direction;
  /*
   * position of the edited selection in the document's selection list, or NO_SLOT
   * */
  public final int slot;
  @NotNull public final AffectedArea affectedArea;
  /*
   * content is inserted as is, control characters included
   * */
  public final boolean literal;

  public Transaction(@NotNull Selection selection,
                     @NotNull String content,
                     @NotNull Direction direction,
                     int slot,
                     @NotNull AffectedArea affectedArea) {
    this(selection, content, direction, slot, affectedArea, false);
  }

  public Transaction(@NotNull Selection selection,
                     @NotNull String content,
                     @NotNull Direction direction,
                     int slot,
                     @NotNull AffectedArea affectedArea,
                     boolean literal) {
    this.selection = Objects.requireNonNull(selection);
    this.content = Objects.requireNonNull(content);
    this.direction = Objects.requireNonNull(direction);
    this.slot = slot;
    this.affectedArea = Objects.requireNonNull(affectedArea);
    this.literal = literal;
  }

  public static Transaction replacing(Selection selection, String content) {
    return new Transaction(selection, content, Direction.FORWARD, NO_SLOT, AffectedArea.UNBOUNDED);
  }

  public static Transaction forSlot(TextDocument document, int slot, String content) {
    return new Transaction(document.getSelection(slot), content, Direction.FORWARD, slot, AffectedArea.UNBOUNDED);
  }

  public Transaction withSelection(Selection selection) {
    return new Transaction(selection, this.content, this.direction, this.slot, this.affectedArea, this.literal);
  }

  public Transaction withContent(String content) {
    return new Transaction(this.selection, content, this.direction, this.slot, this.affectedArea, this.literal);
  }

  public boolean endsWith(char code) {
    return !content.isEmpty() && content.charAt(content.length() - 1) == code;
  }

  /**
   * Rewrites special trailing codes into plain replacement semantics.
   * A trailing tab becomes {@code tabWidth} spaces. A trailing backspace or delete clears the
   * content and, on a caret, first widens the selection by one position backward or forward.
   * Literal transactions are returned unchanged.
   */
  public Transaction normalized(TextDocument document, int tabWidth) {
    if (literal) {
      return this;
    }
    if (endsWith(TAB)) {
      return withContent(content.substring(0, content.length() - 1) + " ".repeat(tabWidth));
    }
    if (endsWith(BACKSPACE)) {
      Selection s = selection.isSingular() ? selection.withHead(document.prev(selection.head)) : selection;
      return new Transaction(s, "", direction, slot, affectedArea);
    }
    if (endsWith(DELETE)) {
      Selection s = selection;
      if (selection.isSingular()) {
        Index next = document.next(selection.head);
        if (!next.equals(document.getEnd())) {
          s = selection.withHead(next);
        }
      }
      return new Transaction(s, "", direction, slot, affectedArea);
    }
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Transaction that = (Transaction)o;
    return slot == that.slot &&
           literal == that.literal &&
           selection.equals(that.selection) &&
           content.equals(that.content) &&
           direction == that.direction &&
           affectedArea.equals(that.affectedArea);
  }

  @Override
  public int hashCode() {
    return Objects.hash(selection, content, direction, slot, affectedArea, literal);
  }

  @Override
  public String toString() {
    return "Transaction{" +
           "selection=" + selection +
           ", content=\"" + content + "\"" +
           ", direction=" + direction +
           ", slot=" + slot +
           (literal ? ", literal" : "") +
           '}';
  }
}
