package dtj;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Recursive descent parser over a token stream, following the Django template grammar. Block tags
 * are dispatched to the {@link TagParser}s of the active {@link TagLibrary}s; the built-in library
 * is always active and named libraries are activated by {@code {% load %}}.
 *
 * <p>Every expression the grammar compiles is reported to the {@link ExpressionListener} together
 * with the token it came from.
 */
public class Parser {
  private static final Logger logger = LogManager.getLogger(Parser.class);

  public static final String SYNTHETIC_FILTER_BASE = "var";

  // Intermediate tags that are only valid inside the tag that owns them.
  private static final ImmutableSet<String> INTERMEDIATE_TAGS =
      ImmutableSet.of("else", "elif", "empty");

  @FunctionalInterface
  public interface ExpressionListener {
    void expressionParsed(Token token, FilterExpression expression, boolean synthetic)
        throws TemplateSyntaxException;
  }

  private final String file;
  private final ImmutableList<Token> tokens;
  private final ImmutableMap<String, TagLibrary> loadableLibraries;
  private final ExpressionListener listener;

  private final Map<String, TagParser> activeTags = new HashMap<>();
  private final Deque<Token> openTags = new ArrayDeque<>();
  private final Set<String> blockNames = new HashSet<>();
  private final Set<String> namedCycles = new HashSet<>();
  private int next = 0;

  public Parser(
      String file,
      List<Token> tokens,
      ImmutableMap<String, TagLibrary> loadableLibraries,
      ExpressionListener listener) {
    this.file = file;
    this.tokens = ImmutableList.copyOf(tokens);
    this.loadableLibraries = loadableLibraries;
    this.listener = listener;
    addLibrary(BuiltinTags.builtins());
  }

  public Nodes.Template parse() throws TemplateSyntaxException {
    return new Nodes.Template(parse(ImmutableSet.of()));
  }

  public ImmutableList<Node> parse(Set<String> until) throws TemplateSyntaxException {
    List<Node> nodes = new ArrayList<>();
    while (hasNextToken()) {
      Token token = nextToken();
      switch (token.kind()) {
        case TEXT:
          nodes.add(new Nodes.Text(token));
          break;
        case VARIABLE:
          if (token.contents().isEmpty()) {
            throw new TemplateSyntaxException(token, "empty variable tag");
          }
          nodes.add(new Nodes.Variable(token, compileFilter(token.contents(), token)));
          break;
        case COMMENT:
          break;
        case BLOCK:
          {
            String command = token.command();
            if (command.isEmpty()) {
              throw new TemplateSyntaxException(token, "empty block tag");
            }
            if (until.contains(command)) {
              prependToken(token);
              return ImmutableList.copyOf(nodes);
            }

            Node node = parseTag(command, token, until);
            if (node instanceof Nodes.Extends && nodes.stream().anyMatch(n -> !isText(n))) {
              throw new TemplateSyntaxException(token, "'extends' must be the first tag");
            }
            nodes.add(node);
            break;
          }
      }
    }

    if (!until.isEmpty()) {
      throw unclosedTag(until);
    }
    return ImmutableList.copyOf(nodes);
  }

  private static boolean isText(Node node) {
    return node instanceof Nodes.Text;
  }

  private Node parseTag(String command, Token token, Set<String> until)
      throws TemplateSyntaxException {
    TagParser tagParser = activeTags.get(command);
    if (tagParser == null) {
      if (command.startsWith("end") || INTERMEDIATE_TAGS.contains(command)) {
        throw invalidTag(token, command, until);
      }
      // Not registered anywhere: keep it as an opaque tag.
      tagParser = (parser, t) -> parser.parseCustom(t, parser.hasUpcomingBlock("end" + command));
    }

    openTags.push(token);
    try {
      return tagParser.parse(this, token);
    } finally {
      openTags.pop();
    }
  }

  private TemplateSyntaxException invalidTag(Token token, String command, Set<String> until) {
    if (until.isEmpty()) {
      return new TemplateSyntaxException(
          token,
          String.format(
              "invalid block tag '%s'; did you forget to register or load this tag?", command));
    }
    return new TemplateSyntaxException(
        token,
        String.format("invalid block tag '%s', expected %s", command, quotedList(until)));
  }

  private TemplateSyntaxException unclosedTag(Set<String> until) {
    Token opener = openTags.peek();
    if (opener == null) {
      return endOfTemplate();
    }
    return new TemplateSyntaxException(
        opener,
        String.format("unclosed tag '%s', looking for %s", opener.command(), quotedList(until)));
  }

  private static String quotedList(Set<String> names) {
    return "'" + Joiner.on("' or '").join(names) + "'";
  }

  public boolean hasNextToken() {
    return next < tokens.size();
  }

  public Token nextToken() throws TemplateSyntaxException {
    if (!hasNextToken()) {
      throw endOfTemplate();
    }
    return tokens.get(next++);
  }

  private TemplateSyntaxException endOfTemplate() {
    Token.Pos pos =
        tokens.isEmpty() ? new Token.Pos(file, 0, 0) : tokens.get(tokens.size() - 1).pos();
    return new TemplateSyntaxException(pos, "unexpected end of template");
  }

  public void prependToken(Token token) {
    Preconditions.checkArgument(
        next > 0 && tokens.get(next - 1).index() == token.index(),
        "%s was not the last token read",
        token);
    next--;
  }

  public void skipPast(String endTag) throws TemplateSyntaxException {
    while (hasNextToken()) {
      Token token = nextToken();
      if (token.kind() == Token.Kind.BLOCK && token.contents().equals(endTag)) {
        return;
      }
    }
    throw unclosedTag(ImmutableSet.of(endTag));
  }

  public boolean hasUpcomingBlock(String command) {
    for (int i = next; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.kind() == Token.Kind.BLOCK && token.command().equals(command)) {
        return true;
      }
    }
    return false;
  }

  public Token consumeEndTag(String command) throws TemplateSyntaxException {
    Token token = nextToken();
    if (token.kind() != Token.Kind.BLOCK || !token.command().equals(command)) {
      throw new TemplateSyntaxException(token, "expected '" + command + "'");
    }
    return token;
  }

  public FilterExpression compileFilter(String text, Token token) throws TemplateSyntaxException {
    FilterExpression expression = FilterExpression.parse(text, token.pos());
    listener.expressionParsed(token, expression, false);
    return expression;
  }

  public FilterExpression compileSyntheticFilter(String chain, Token token)
      throws TemplateSyntaxException {
    FilterExpression expression =
        FilterExpression.parse(SYNTHETIC_FILTER_BASE + "|" + chain, token.pos());
    listener.expressionParsed(token, expression, true);
    return expression;
  }

  public Node parseCustom(Token token, boolean hasBody) throws TemplateSyntaxException {
    String name = token.command();
    ImmutableList<Node> body = ImmutableList.of();
    if (hasBody) {
      body = parse(ImmutableSet.of("end" + name));
      consumeEndTag("end" + name);
    }
    return new Nodes.Custom(token, name, hasBody, body);
  }

  public void declareBlock(Token token, String name) throws TemplateSyntaxException {
    if (!blockNames.add(name)) {
      throw new TemplateSyntaxException(
          token, String.format("'block' tag with name '%s' appears more than once", name));
    }
  }

  public void declareCycle(String name) {
    namedCycles.add(name);
  }

  public boolean isCycleDeclared(String name) {
    return namedCycles.contains(name);
  }

  // Activates name, or only the tags in subset when it is non-empty. Loading a library that is not
  // known is not an error: its tags stay unregistered.
  public void loadLibrary(String name, Token token, Set<String> subset) {
    TagLibrary library = loadableLibraries.get(name);
    if (library == null) {
      logger.warn("{} unknown tag library '{}'", token.pos(), name);
      return;
    }

    if (subset.isEmpty()) {
      addLibrary(library);
      return;
    }
    for (String tagName : subset) {
      TagParser tagParser = library.tags().get(tagName);
      if (tagParser != null) {
        activeTags.put(tagName, tagParser);
      }
    }
  }

  private void addLibrary(TagLibrary library) {
    activeTags.putAll(library.tags());
  }
}
