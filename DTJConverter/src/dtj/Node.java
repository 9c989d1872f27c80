package dtj;

import java.util.OptionalInt;

public abstract class Node implements ASTNodeInterface {
  private final OptionalInt tokenIndex;

  protected Node(OptionalInt tokenIndex) {
    this.tokenIndex = tokenIndex;
  }

  protected Node(Token token) {
    this(OptionalInt.of(token.index()));
  }

  public final OptionalInt tokenIndex() {
    return tokenIndex;
  }

  public abstract String kindName();

  @Override
  public String toString() {
    return tokenIndex.isPresent()
        ? String.format("[%s@%d]", kindName(), tokenIndex.getAsInt())
        : String.format("[%s]", kindName());
  }
}
