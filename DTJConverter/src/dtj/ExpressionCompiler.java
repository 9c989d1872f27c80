package dtj;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Rewrites filter expressions into Jinja2 syntax as the parser compiles them. Each rewrite that
 * changes an expression is recorded in the {@link RewriteMap} against the token the expression was
 * read from.
 */
public class ExpressionCompiler implements Parser.ExpressionListener {
  private static final Logger logger = LogManager.getLogger(ExpressionCompiler.class);

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(input|escaped|raw)\\}");

  private final ConversionRules rules;
  private final RewriteMap rewriteMap;
  private final Set<String> unknownFilters = new TreeSet<>();
  private final Set<String> usedVariables = new TreeSet<>();
  private final List<String> warnings = new ArrayList<>();

  public ExpressionCompiler(ConversionRules rules, RewriteMap rewriteMap) {
    this.rules = rules;
    this.rewriteMap = rewriteMap;
  }

  @Override
  public void expressionParsed(Token token, FilterExpression expression, boolean synthetic)
      throws TemplateSyntaxException {
    String compiled = compile(expression, token.pos(), synthetic);
    // A filter tag takes a plain chain; anything else keeps its Django spelling.
    if (synthetic && !isChain(expression)) {
      String message =
          String.format(
              "%s filter chain has no Jinja2 filter tag form (%s): %s",
              token.pos(), compiled, token.source());
      logger.warn("{}", message);
      warnings.add(message);
      return;
    }
    if (!compiled.equals(expression.source())) {
      rewriteMap.add(token, expression.source(), compiled);
    }
  }

  public ImmutableList<String> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  public ImmutableSortedSet<String> unknownFilters() {
    return ImmutableSortedSet.copyOf(unknownFilters);
  }

  public ImmutableSortedSet<String> usedVariables() {
    return ImmutableSortedSet.copyOf(usedVariables);
  }

  // Every filter either stays a filter or rewrites to one applied to its input.
  private boolean isChain(FilterExpression expression) {
    for (FilterExpression.Filter filter : expression.filters()) {
      Optional<String> template = rules.filterRules().get(filter.name());
      if (template != null && template.isPresent() && !template.get().startsWith("{input}|")) {
        return false;
      }
    }
    return true;
  }

  String compile(FilterExpression expression, Token.Pos pos, boolean synthetic)
      throws TemplateSyntaxException {
    String compiled = synthetic ? expression.base().source() : compileOperand(expression.base());
    for (FilterExpression.Filter filter : expression.filters()) {
      compiled = compileFilter(compiled, filter, pos);
    }
    return compiled;
  }

  private String compileFilter(String input, FilterExpression.Filter filter, Token.Pos pos)
      throws TemplateSyntaxException {
    Optional<String> template = rules.filterRules().get(filter.name());
    if (template == null) {
      unknownFilters.add(filter.name());
      template = Optional.empty();
    }
    if (!template.isPresent()) {
      String arg = filter.arg().isPresent() ? "(" + compileOperand(filter.arg().get()) + ")" : "";
      return input + "|" + filter.name() + arg;
    }

    Matcher m = PLACEHOLDER.matcher(template.get());
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String replacement;
      switch (m.group(1)) {
        case "input":
          replacement = input;
          break;
        case "escaped":
          replacement = compileOperand(requireArg(filter, pos));
          break;
        default:
          replacement = rawText(requireArg(filter, pos));
          break;
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static FilterExpression.Operand requireArg(FilterExpression.Filter filter, Token.Pos pos)
      throws TemplateSyntaxException {
    if (!filter.arg().isPresent()) {
      throw new TemplateSyntaxException(
          pos, String.format("filter '%s' requires an argument", filter.name()));
    }
    return filter.arg().get();
  }

  private String compileOperand(FilterExpression.Operand operand) {
    switch (operand.type()) {
      case VARIABLE:
        usedVariables.add(operand.value());
        return rewritePath(operand.value());
      case STRING:
        return quote(operand.value(), operand.translated());
      default:
        return operand.source();
    }
  }

  String rewritePath(String path) {
    for (PathRule rule : rules.pathRules()) {
      path = rule.apply(path);
    }
    return path;
  }

  // String arguments are used unquoted.
  private static String rawText(FilterExpression.Operand operand) {
    return operand.type() == FilterExpression.Operand.Type.STRING
        ? operand.value()
        : operand.source();
  }

  static String quote(String value, boolean translated) {
    char quote =
        CharMatcher.is('\'').countIn(value) < CharMatcher.is('"').countIn(value) ? '\'' : '"';
    String literal =
        quote
            + value.replace("\\", "\\\\").replace(String.valueOf(quote), "\\" + quote)
            + quote;
    return translated ? "_(" + literal + ")" : literal;
  }
}
