package scribe;

import java.util.Objects;

/*
 * Invalidation hint for whatever renders the document. Consumers should treat it as opaque.
 * */
public final class AffectedArea {

  public static final AffectedArea UNBOUNDED = new AffectedArea(0, Integer.MAX_VALUE);

  public final int fromRow;
  public final int toRow;

  private AffectedArea(int fromRow, int toRow) {
    this.fromRow = fromRow;
    this.toRow = toRow;
  }

  public static AffectedArea rows(int fromRow, int toRow) {
    if (fromRow < 0 || toRow < fromRow) {
      throw new IllegalArgumentException("rows [" + fromRow + ", " + toRow + "]");
    }
    return new AffectedArea(fromRow, toRow);
  }

  public boolean isUnbounded() {
    return this.equals(UNBOUNDED);
  }

  public boolean intersectsRow(int row) {
    return fromRow <= row && row <= toRow;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AffectedArea area = (AffectedArea)o;
    return fromRow == area.fromRow &&
           toRow == area.toRow;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromRow, toRow);
  }

  @Override
  public String toString() {
    return isUnbounded() ? "AffectedArea{unbounded}" : "AffectedArea{rows=[" + fromRow + ", " + toRow + "]}";
  }
}
