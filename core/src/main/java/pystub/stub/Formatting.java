//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/**
 * The line terminator and indentation unit used when writing a stub. These are normally taken from
 * the source file the stub describes, so that the stub matches its style.
 */
public final class Formatting {

  /** Unix line endings and four space indentation. */
  public static final Formatting DEFAULT = new Formatting("\n", "    ");

  /** The line terminator: {@code "\n"}, {@code "\r\n"} or {@code "\r"}. */
  public final String lineEnd;

  /** The text written once per level of indentation. */
  public final String indent;

  public Formatting (String lineEnd, String indent) {
    Preconditions.checkArgument(lineEnd.equals("\n") || lineEnd.equals("\r\n") ||
                                lineEnd.equals("\r"), "Invalid line terminator");
    Preconditions.checkArgument(!indent.isEmpty() && CharMatcher.anyOf(" \t").matchesAllOf(indent),
                                "Indent must be non-empty whitespace: '%s'", indent);
    this.lineEnd = lineEnd;
    this.indent = indent;
  }

  /**
   * Determines the predominant line terminator and indentation unit of {@code source}. Ties
   * between line terminators go to {@code "\n"}. The indentation unit is a tab if most indented
   * lines start with one, otherwise the most frequent increase in leading spaces between
   * successive non-blank lines (the smaller wins a tie). Falls back to {@link #DEFAULT}'s choices
   * where the source gives no evidence.
   */
  public static Formatting detect (CharSequence source) {
    int lf = 0, crlf = 0, cr = 0;
    int tabbed = 0, spaced = 0, prevSpaces = 0;
    Multiset<Integer> steps = HashMultiset.create();

    int lineStart = 0;
    for (int ii = 0, ll = source.length(); ii <= ll; ii++) {
      char c = (ii < ll) ? source.charAt(ii) : '\n';
      if (c != '\n' && c != '\r') continue;
      if (ii < ll) {
        if (c == '\n') lf++;
        else if (ii+1 < ll && source.charAt(ii+1) == '\n') crlf++;
        else cr++;
      }

      CharSequence line = source.subSequence(lineStart, ii);
      if (!CharMatcher.whitespace().matchesAllOf(line)) {
        if (line.charAt(0) == '\t') tabbed++;
        else {
          int spaces = CharMatcher.isNot(' ').indexIn(line);
          if (spaces > 0) spaced++;
          if (spaces > prevSpaces) steps.add(spaces - prevSpaces);
          prevSpaces = spaces;
        }
      }

      if (c == '\r' && ii+1 < ll && source.charAt(ii+1) == '\n') ii++;
      lineStart = ii+1;
    }

    String lineEnd;
    if (crlf > lf && crlf >= cr) lineEnd = "\r\n";
    else if (cr > lf && cr > crlf) lineEnd = "\r";
    else lineEnd = "\n";

    String indent = DEFAULT.indent;
    if (tabbed > spaced) indent = "\t";
    else if (!steps.isEmpty()) {
      int best = 0, bestCount = 0;
      for (Multiset.Entry<Integer> step : steps.entrySet()) {
        int size = step.getElement(), count = step.getCount();
        if (count > bestCount || (count == bestCount && size < best)) {
          best = size;
          bestCount = count;
        }
      }
      indent = Strings.repeat(" ", best);
    }
    return new Formatting(lineEnd, indent);
  }

  @Override public boolean equals (Object other) {
    return (other instanceof Formatting) && lineEnd.equals(((Formatting)other).lineEnd) &&
      indent.equals(((Formatting)other).indent);
  }
  @Override public int hashCode () {
    return lineEnd.hashCode() ^ indent.hashCode();
  }
  @Override public String toString () {
    return "Formatting[lineEnd=" + lineEnd.replace("\r", "\\r").replace("\n", "\\n") +
      ", indent='" + indent.replace("\t", "\\t") + "']";
  }
}
