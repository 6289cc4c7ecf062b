package scribe;

import scribe.selection.Selection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything needed to put a document back exactly as it was: its lines and, per selection,
 * a {@code (headRow, headColumn, tailRow, tailColumn)} tuple. Style tokens are not part of it;
 * they are derived and get rescanned.
 */
public final class DocumentSnapshot {
  public final List<String> lines;
  public final List<Selection> selections;

  public DocumentSnapshot(List<String> lines, List<Selection> selections) {
    if (lines.isEmpty() || selections.isEmpty()) {
      throw new IllegalArgumentException("a snapshot needs at least one line and one selection");
    }
    this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    this.selections = Collections.unmodifiableList(new ArrayList<>(selections));
  }

  public static DocumentSnapshot capture(TextDocument document) {
    return new DocumentSnapshot(document.getLines(), document.getSelections());
  }

  public static DocumentSnapshot fromTuples(List<String> lines, int[][] tuples) {
    List<Selection> selections = new ArrayList<>(tuples.length);
    for (int[] t : tuples) {
      if (t.length != 4) {
        throw new IllegalArgumentException("expected (headRow, headCol, tailRow, tailCol), got " + Arrays.toString(t));
      }
      selections.add(new Selection(t[0], t[1], t[2], t[3]));
    }
    return new DocumentSnapshot(lines, selections);
  }

  public int[][] toTuples() {
    int[][] tuples = new int[selections.size()][];
    for (int i = 0; i < tuples.length; i++) {
      Selection s = selections.get(i);
      tuples[i] = new int[]{s.head.row, s.head.column, s.tail.row, s.tail.column};
    }
    return tuples;
  }

  public void restore(TextDocument document) {
    document.replaceAll(String.join("\n", lines));
    document.setSelections(selections);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DocumentSnapshot snapshot = (DocumentSnapshot)o;
    return lines.equals(snapshot.lines) &&
           selections.equals(snapshot.selections);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lines, selections);
  }

  @Override
  public String toString() {
    return "DocumentSnapshot{" +
           "lines=" + lines +
           ", selections=" + selections +
           '}';
  }
}
