package scribe.text;

import io.lacuna.bifurcan.List;

import java.util.Arrays;

/*
 * One opaque integer style token per character, kept row-parallel to a LineStore.
 * Rows that get replaced come back with DEFAULT_TOKEN everywhere until rescanned.
 * */
public class StyleTokens {

  public static final int DEFAULT_TOKEN = 0;

  private List<int[]> rows;

  public StyleTokens(LineStore lines) {
    this.rows = blankRows(lines.lines());
  }

  private static List<int[]> blankRows(java.util.List<String> lines) {
    List<int[]> result = new List<>();
    for (String line : lines) {
      result = result.addLast(new int[line.length()]);
    }
    return result;
  }

  public int getToken(int row, int column) {
    if (row < 0 || row >= this.rows.size()) {
      throw new IndexOutOfBoundsException("row: " + row + ", rows count: " + this.rows.size());
    }
    int[] tokens = this.rows.nth(row);
    return column < tokens.length ? tokens[column] : DEFAULT_TOKEN;
  }

  public void setTokens(int row, int fromColumn, int toColumn, int token) {
    int[] tokens = this.rows.nth(row).clone();
    Arrays.fill(tokens, Math.min(fromColumn, tokens.length), Math.min(toColumn, tokens.length), token);
    this.rows = this.rows.set(row, tokens);
  }

  public void replaceRows(int fromRow, int toRow, java.util.List<String> lines) {
    this.rows = List.from(this.rows.slice(0, fromRow)
      .concat(blankRows(lines))
      .concat(this.rows.slice(toRow + 1, this.rows.size())));
  }

  public void reset(LineStore lines) {
    this.rows = blankRows(lines.lines());
  }
}
