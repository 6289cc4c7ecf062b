package scribe.syntax;

import scribe.TextDocument;
import scribe.selection.Selection;
import scribe.text.Index;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a document line by line and reports the tokens matched by registered regular expressions.
 * <p>
 * At each position the pattern matching earliest on the line wins; on a tie the one registered
 * first. Tokens never span lines and empty matches are ignored.
 */
public class Scanner {

  public static final int NO_TOKEN = -1;

  private static final class TokenPattern {
    final int token;
    final Pattern pattern;

    TokenPattern(int token, Pattern pattern) {
      this.token = token;
      this.pattern = pattern;
    }
  }

  private final TextDocument document;
  private final List<TokenPattern> patterns = new ArrayList<>();

  private Index index = Index.ZERO;
  private Index tokenIndex = Index.ZERO;
  private int token = NO_TOKEN;

  public Scanner(TextDocument document) {
    this.document = document;
  }

  /**
   * @throws java.util.regex.PatternSyntaxException if {@code regex} does not compile
   */
  public Scanner addPattern(int token, String regex) {
    this.patterns.add(new TokenPattern(token, Pattern.compile(regex)));
    return this;
  }

  public void clear() {
    this.patterns.clear();
  }

  public void reset() {
    this.index = Index.ZERO;
    this.tokenIndex = Index.ZERO;
    this.token = NO_TOKEN;
  }

  /**
   * Advances to the next token. Returns {@code false} once the document is exhausted.
   */
  public boolean next() {
    while (this.index.row < this.document.getNumRows()) {
      String line = this.document.getLine(this.index.row);
      int[] match = searchMany(line, this.index.column);
      if (match != null) {
        this.tokenIndex = new Index(this.index.row, match[0]);
        this.token = match[2];
        this.index = new Index(this.index.row, match[1]);
        return true;
      }
      this.index = new Index(this.index.row + 1, 0);
    }
    this.token = NO_TOKEN;
    return false;
  }

  /*
   * {start, end, token} of the earliest non-empty match at or after column, or null.
   * the search region starts at column, so '^' anchors there
   * */
  @Nullable
  private int[] searchMany(String line, int column) {
    int[] best = null;
    for (TokenPattern p : this.patterns) {
      Matcher m = p.pattern.matcher(line);
      int from = column;
      while (from <= line.length() && m.region(from, line.length()).find()) {
        if (m.end() > m.start()) {
          if (best == null || m.start() < best[0]) {
            best = new int[]{m.start(), m.end(), p.token};
          }
          break;
        }
        from = m.start() + 1;
      }
    }
    return best;
  }

  public int getToken() {
    return this.token;
  }

  public Index getIndex() {
    return this.tokenIndex;
  }

  public Selection getZone() {
    return new Selection(this.tokenIndex, this.index);
  }
}
