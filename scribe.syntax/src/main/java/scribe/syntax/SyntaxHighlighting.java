package scribe.syntax;

import scribe.TextDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SyntaxHighlighting {
  private static final Logger log = LoggerFactory.getLogger(SyntaxHighlighting.class);

  private SyntaxHighlighting() {}

  /**
   * Clears the document's style tokens and writes the scanner's tokens over it.
   * Returns the number of tokens applied.
   */
  public static int highlight(TextDocument document, Scanner scanner) {
    document.clearTokens();
    scanner.reset();
    int count = 0;
    while (scanner.next()) {
      document.applyTokens(scanner.getZone(), scanner.getToken());
      count++;
    }
    log.debug("applied {} tokens over {} rows", count, document.getNumRows());
    return count;
  }
}
