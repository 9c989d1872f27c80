package dtj;

public class TemplateSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Token.Pos pos;
  private final String errorMsg;

  public TemplateSyntaxException(Token.Pos pos, String errorMsg) {
    super(String.format("%s %s", pos, errorMsg));
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public TemplateSyntaxException(Token token, String errorMsg) {
    this(token.pos(), String.format("%s: %s", errorMsg, token.source()));
  }

  public Token.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    System.out.println(
        String.format(
            "ERROR: %s@%d:%d %s", pos.file(), pos.lineNumber() + 1, pos.column() + 1, errorMsg));
  }
}
