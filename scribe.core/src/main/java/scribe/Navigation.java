package scribe;

/**
 * Abstract caret movements. The host's key layer maps key presses onto these; the document never
 * sees raw key codes.
 */
public enum Navigation {
  IDENTITY,
  WHOLE_DOCUMENT,
  WHOLE_LINE,
  WHOLE_WORD,
  FORWARD_BY_CHAR,
  BACKWARD_BY_CHAR,
  FORWARD_BY_WORD,
  BACKWARD_BY_WORD,
  FORWARD_BY_LINE,
  BACKWARD_BY_LINE,
  TO_LINE_START,
  TO_LINE_END;

  /*
   * these produce a selection of their own instead of moving a caret
   * */
  public boolean isExpansion() {
    return this == WHOLE_DOCUMENT || this == WHOLE_LINE || this == WHOLE_WORD;
  }
}
