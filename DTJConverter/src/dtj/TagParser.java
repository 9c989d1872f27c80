package dtj;

@FunctionalInterface
public interface TagParser {
  Node parse(Parser parser, Token token) throws TemplateSyntaxException;
}
