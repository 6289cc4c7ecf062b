package scribe;

import scribe.undo.UndoEngine;

import java.util.function.LongSupplier;

public class Editor {
  public final TextDocument document;
  public final UndoEngine<Transaction> undo;
  public final EditorSettings settings;

  /*
   * settings come from /scribe.properties when it is on the classpath
   * */
  public Editor() {
    this(EditorSettings.load());
  }

  public Editor(EditorSettings settings) {
    this(settings, System::currentTimeMillis);
  }

  public Editor(EditorSettings settings, LongSupplier clock) {
    this.settings = settings;
    this.document = new TextDocument(settings);
    this.undo = new UndoEngine<>(this.document, settings.undoCoalesceMillis, clock);
  }
}
