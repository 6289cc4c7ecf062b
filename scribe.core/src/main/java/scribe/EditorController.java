package scribe;

import scribe.selection.Selection;

import java.util.ArrayList;
import java.util.List;

/**
 * What the host's key and clipboard layer calls into. Edits run at every selection and undo as one
 * step; navigations close the current undo group.
 */
public class EditorController {

  private EditorController() {}

  public static void setText(Editor editor, String text) {
    editor.document.replaceAll(text);
    editor.undo.clear();
  }

  public static void insert(Editor editor, String text) {
    TextDocument document = editor.document;
    editor.undo.performAll(document.getNumSelections(), slot -> Transaction.forSlot(document, slot, text));
  }

  public static void insertLineBreak(Editor editor) {
    insert(editor, "\n");
  }

  public static void insertTab(Editor editor) {
    insert(editor, String.valueOf(Transaction.TAB));
  }

  public static void deleteBackward(Editor editor) {
    insert(editor, String.valueOf(Transaction.BACKSPACE));
  }

  public static void deleteForward(Editor editor) {
    insert(editor, String.valueOf(Transaction.DELETE));
  }

  public static void navigate(Editor editor, Navigation navigation, boolean extend) {
    editor.document.setSelections(editor.document.getSelections(navigation, extend));
    editor.undo.beginNewGroup();
  }

  public static void selectAll(Editor editor) {
    navigate(editor, Navigation.WHOLE_DOCUMENT, false);
  }

  public static void addCaret(Editor editor, Selection selection) {
    editor.document.addSelection(selection);
    editor.undo.beginNewGroup();
  }

  public static void dropSelections(Editor editor) {
    List<Selection> carets = new ArrayList<>();
    for (Selection selection : editor.document.getSelections()) {
      carets.add(Selection.caret(selection.head));
    }
    editor.document.setSelections(carets);
    editor.undo.beginNewGroup();
  }

  public static List<String> getSelectedText(Editor editor) {
    List<String> result = new ArrayList<>();
    for (Selection selection : editor.document.getSelections()) {
      result.add(editor.document.getSelectionContent(selection));
    }
    return result;
  }

  public static boolean undo(Editor editor) {
    return editor.undo.undo();
  }

  public static boolean redo(Editor editor) {
    return editor.undo.redo();
  }
}
