package dtj;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Splits Django template source into {@link Token}s. The tokens cover the input without gaps:
 * concatenating {@link Token#source()} over the result yields the input.
 */
public class Lexer {
  private static final String VERBATIM = "verbatim";

  private final String file;
  private final String content;
  private int offset = 0;
  private int line = 0;
  private int col = 0;

  private StringBuilder text = new StringBuilder();
  private Token.Pos textPos = null;
  // While inside {% verbatim %}, the exact contents of the closing tag.
  private Optional<String> verbatimEnd = Optional.empty();

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();
  private int nextIndex = 0;

  public Lexer(String file, String content) {
    this.file = file;
    this.content = content;
  }

  public ImmutableList<Token> tokenize() throws TemplateSyntaxException {
    while (offset < content.length()) {
      Optional<Token.Kind> kind = openerAt(offset);
      if (!kind.isPresent()) {
        appendText(offset + 1);
        continue;
      }

      int close = findClose(kind.get());
      if (close < 0) {
        if (verbatimEnd.isPresent()) {
          appendText(offset + kind.get().start().length());
          continue;
        }
        throw new TemplateSyntaxException(
            pos(), String.format("unclosed '%s' tag", kind.get().start()));
      }

      String inner = content.substring(offset + kind.get().start().length(), close);
      int end = close + kind.get().end().length();
      if (verbatimEnd.isPresent()) {
        if (kind.get() == Token.Kind.BLOCK && inner.strip().equals(verbatimEnd.get())) {
          verbatimEnd = Optional.empty();
          emitTag(kind.get(), inner, end);
        } else {
          appendText(end);
        }
        continue;
      }

      emitTag(kind.get(), inner, end);
      if (kind.get() == Token.Kind.BLOCK) {
        String stripped = inner.strip();
        if (stripped.equals(VERBATIM) || stripped.startsWith(VERBATIM + " ")) {
          verbatimEnd = Optional.of("end" + stripped);
        }
      }
    }

    flushText();
    return tokensBuilder.build();
  }

  private Optional<Token.Kind> openerAt(int at) {
    if (at + 1 >= content.length() || content.charAt(at) != '{') return Optional.empty();
    for (Token.Kind kind : Token.Kind.values()) {
      if (kind != Token.Kind.TEXT && content.startsWith(kind.start(), at)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  // Tags never span lines.
  private int findClose(Token.Kind kind) {
    int from = offset + kind.start().length();
    int close = content.indexOf(kind.end(), from);
    if (close < 0) return -1;

    int newline = content.indexOf('\n', from);
    return newline >= 0 && newline < close ? -1 : close;
  }

  private void appendText(int upTo) {
    if (text.length() == 0) {
      textPos = pos();
    }
    text.append(content, offset, upTo);
    advanceTo(upTo);
  }

  private void emitTag(Token.Kind kind, String inner, int end) {
    flushText();
    tokensBuilder.add(Token.create(kind, inner, nextIndex++, pos()));
    advanceTo(end);
  }

  private void flushText() {
    if (text.length() == 0) return;

    tokensBuilder.add(Token.create(Token.Kind.TEXT, text.toString(), nextIndex++, textPos));
    text = new StringBuilder();
    textPos = null;
  }

  private void advanceTo(int newOffset) {
    for (; offset < newOffset; offset++) {
      if (content.charAt(offset) == '\n') {
        line++;
        col = 0;
      } else {
        col++;
      }
    }
  }

  private Token.Pos pos() {
    return new Token.Pos(file, line, col);
  }
}
