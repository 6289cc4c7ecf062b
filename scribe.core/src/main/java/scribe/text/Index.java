package scribe.text;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/*
 * A (row, column) position in a document.
 * (numRows, 0) is the end sentinel: one past the last character.
 * */
public final class Index implements Comparable<Index> {

  public static final Index ZERO = new Index(0, 0);

  public final int row;
  public final int column;

  public Index(int row, int column) {
    if (row < 0 || column < 0) {
      throw new IllegalArgumentException("negative index: (" + row + ", " + column + ")");
    }
    this.row = row;
    this.column = column;
  }

  public static Index of(int row, int column) {
    return new Index(row, column);
  }

  public Index withRow(int row) {
    return new Index(row, this.column);
  }

  public Index withColumn(int column) {
    return new Index(this.row, column);
  }

  public Index translated(int deltaRows, int deltaColumns) {
    return new Index(this.row + deltaRows, this.column + deltaColumns);
  }

  public boolean isBefore(Index other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(Index other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(@NotNull Index o) {
    if (this.row != o.row) {
      return Integer.compare(this.row, o.row);
    }
    return Integer.compare(this.column, o.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Index index = (Index)o;
    return row == index.row &&
           column == index.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(row, column);
  }

  @Override
  public String toString() {
    return "(" + row + ", " + column + ")";
  }
}
