package dtj;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * One lexed slice of a template. Tokens are identified by their occurrence {@link #index()} in the
 * stream, never by their contents.
 */
@AutoValue
public abstract class Token {
  // Whitespace-separated bits; quoted sections (with escapes) never split.
  private static final Pattern SMART_SPLIT =
      Pattern.compile(
          "(?:[^\\s'\"]*(?:(?:\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*')[^\\s'\"]*)+)|\\S+");

  public enum Kind {
    TEXT("", ""),
    VARIABLE("{{", "}}"),
    BLOCK("{%", "%}"),
    COMMENT("{#", "#}");

    private final String start;
    private final String end;

    Kind(String start, String end) {
      this.start = start;
      this.end = end;
    }

    public String start() {
      return start;
    }

    public String end() {
      return end;
    }

    public String wrap(String inner) {
      return start + inner + end;
    }
  }

  public static class Pos {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public abstract Kind kind();

  public abstract String rawContents();

  public abstract int index();

  public abstract Pos pos();

  public static Token create(Kind kind, String rawContents, int index, Pos pos) {
    return new AutoValue_Token(kind, rawContents, index, pos);
  }

  public String contents() {
    return kind() == Kind.TEXT ? rawContents() : rawContents().strip();
  }

  public String source() {
    return kind().wrap(rawContents());
  }

  public String command() {
    String contents = contents();
    int space = indexOfWhitespace(contents);
    return space < 0 ? contents : contents.substring(0, space);
  }

  // Splits the contents on whitespace the way tag arguments are split: quoted strings stay whole,
  // and a translated literal such as _("a b") is one bit. The command is the first bit.
  public ImmutableList<String> splitContents() {
    List<String> bits = new ArrayList<>();
    Matcher m = SMART_SPLIT.matcher(contents());
    while (m.find()) {
      String bit = m.group();
      if (bit.startsWith("_(\"") || bit.startsWith("_('")) {
        String sentinel = bit.charAt(2) + ")";
        StringBuilder translated = new StringBuilder(bit);
        while (!bit.endsWith(sentinel) && m.find()) {
          bit = m.group();
          translated.append(' ').append(bit);
        }
        bit = translated.toString();
      }
      bits.add(bit);
    }
    return ImmutableList.copyOf(bits);
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) return i;
    }
    return -1;
  }
}
