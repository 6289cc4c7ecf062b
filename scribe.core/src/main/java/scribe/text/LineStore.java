package scribe.text;

import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;

import java.util.Collections;
import java.util.Objects;

/**
 * Document text as an ordered sequence of lines, without their terminating newlines.
 * <p>
 * Knows nothing about selections. Row arguments out of range throw {@link IndexOutOfBoundsException}.
 */
public class LineStore {

  private List<String> lines;

  public LineStore() {
    this.lines = new List<String>().addLast("");
  }

  private LineStore(List<String> lines) {
    this.lines = lines;
  }

  public static LineStore of(String content) {
    return new LineStore(toRows(splitLines(content)));
  }

  /*
   * keeps trailing empty lines: "a\n" -> ["a", ""], "" -> [""]
   * */
  public static java.util.List<String> splitLines(String content) {
    return java.util.Arrays.asList(content.split("\n", -1));
  }

  private static List<String> toRows(Iterable<String> rows) {
    List<String> result = new List<>();
    for (String row : rows) {
      result = result.addLast(row);
    }
    return result;
  }

  public int getNumRows() {
    return (int)this.lines.size();
  }

  public int getNumColumns(int row) {
    return getLine(row).length();
  }

  public String getLine(int row) {
    checkRow(row, getNumRows());
    return this.lines.nth(row);
  }

  public java.util.List<String> lines() {
    return Collections.unmodifiableList(Lists.toList(this.lines));
  }

  /**
   * Replaces rows {@code [fromRow, toRow]} (inclusive) with {@code rows}.
   */
  public void replaceRows(int fromRow, int toRow, java.util.List<String> rows) {
    checkRow(fromRow, getNumRows());
    checkRow(toRow, getNumRows());
    if (toRow < fromRow) {
      throw new IllegalArgumentException("row range [" + fromRow + ", " + toRow + "]");
    }
    this.lines = List.from(this.lines.slice(0, fromRow)
      .concat(toRows(rows))
      .concat(this.lines.slice(toRow + 1, this.lines.size())));
  }

  public void insertRows(int row, java.util.List<String> rows) {
    checkRow(row, getNumRows() + 1);
    this.lines = List.from(this.lines.slice(0, row)
      .concat(toRows(rows))
      .concat(this.lines.slice(row, this.lines.size())));
  }

  public void removeRows(int fromRow, int toRow) {
    checkRow(fromRow, getNumRows());
    checkRow(toRow, getNumRows());
    this.lines = List.from(this.lines.slice(0, fromRow)
      .concat(this.lines.slice(toRow + 1, this.lines.size())));
  }

  private static void checkRow(int row, int numRows) {
    if (row < 0 || row >= numRows) {
      throw new IndexOutOfBoundsException("row: " + row + ", rows count: " + numRows);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    LineStore store = (LineStore)o;
    return Objects.equals(lines, store.lines);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lines);
  }

  @Override
  public String toString() {
    return "LineStore" + lines();
  }
}
