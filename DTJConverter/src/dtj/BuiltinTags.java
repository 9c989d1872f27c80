package dtj;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

public final class BuiltinTags {

  private static final Pattern KWARG = Pattern.compile("(?:(\\w+)=)?(.+)");
  private static final Pattern LOOP_VAR_SEPARATOR = Pattern.compile(" *, *");

  private static final ImmutableSet<String> IF_OPERATORS =
      ImmutableSet.of("and", "or", "not", "in", "is", "==", "!=", "<", ">", "<=", ">=");

  private static final ImmutableSet<String> TEMPLATE_TAG_TYPES =
      ImmutableSet.of(
          "openblock",
          "closeblock",
          "openvariable",
          "closevariable",
          "openbrace",
          "closebrace",
          "opencomment",
          "closecomment");

  private static final TagLibrary BUILTINS =
      TagLibrary.builder("builtins")
          .tag("autoescape", BuiltinTags::parseAutoEscape)
          .tag("block", BuiltinTags::parseBlock)
          .tag("comment", BuiltinTags::parseComment)
          .tag("csrf_token", (parser, token) -> new Nodes.CsrfToken(token))
          .tag("cycle", BuiltinTags::parseCycle)
          .tag("extends", BuiltinTags::parseExtends)
          .tag("filter", BuiltinTags::parseFilter)
          .tag("firstof", BuiltinTags::parseFirstOf)
          .tag("for", BuiltinTags::parseFor)
          .tag("if", BuiltinTags::parseIf)
          .tag("include", BuiltinTags::parseInclude)
          .tag("load", BuiltinTags::parseLoad)
          .tag("spaceless", BuiltinTags::parseSpaceless)
          .tag("templatetag", BuiltinTags::parseTemplateTag)
          .tag("url", BuiltinTags::parseUrl)
          .tag("verbatim", BuiltinTags::parseVerbatim)
          .tag("widthratio", BuiltinTags::parseWidthRatio)
          .tag("with", BuiltinTags::parseWith)
          .build();

  private static final ImmutableMap<String, TagLibrary> STANDARD_LIBRARIES =
      ImmutableList.of(
              TagLibrary.builder("static")
                  .tag("static", BuiltinTags::parseStatic)
                  .tag("get_static_prefix", prefixTag("STATIC_URL"))
                  .tag("get_media_prefix", prefixTag("MEDIA_URL"))
                  .build(),
              TagLibrary.builder("i18n").tag("trans", BuiltinTags::parseTrans).build(),
              TagLibrary.builder("humanize").build(),
              TagLibrary.builder("markdown_deux_tags").blockTag("markdown").build(),
              TagLibrary.builder("compress").blockTag("compress").build())
          .stream()
          .collect(ImmutableMap.toImmutableMap(TagLibrary::name, l -> l));

  public static TagLibrary builtins() {
    return BUILTINS;
  }

  public static ImmutableMap<String, TagLibrary> standardLibraries() {
    return STANDARD_LIBRARIES;
  }

  private static Node parseAutoEscape(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw new TemplateSyntaxException(token, "'autoescape' tag requires exactly one argument");
    }
    String arg = bits.get(1);
    if (!arg.equals("on") && !arg.equals("off")) {
      throw new TemplateSyntaxException(token, "'autoescape' argument should be 'on' or 'off'");
    }
    ImmutableList<Node> body = parser.parse(ImmutableSet.of("endautoescape"));
    parser.consumeEndTag("endautoescape");
    return new Nodes.AutoEscape(token, arg.equals("on"), body);
  }

  private static Node parseBlock(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw new TemplateSyntaxException(token, "'block' tag takes only one argument");
    }
    String name = bits.get(1);
    parser.declareBlock(token, name);

    ImmutableList<Node> body = parser.parse(ImmutableSet.of("endblock"));
    Token end = parser.consumeEndTag("endblock");
    if (!end.contents().equals("endblock") && !end.contents().equals("endblock " + name)) {
      throw new TemplateSyntaxException(
          end, String.format("mismatched end tag, expected 'endblock' or 'endblock %s'", name));
    }
    return new Nodes.Block(token, name, body);
  }

  private static Node parseComment(Parser parser, Token token) throws TemplateSyntaxException {
    String contents = token.contents();
    Optional<String> note =
        contents.equals("comment")
            ? Optional.empty()
            : Optional.of(contents.substring("comment".length()).strip());
    parser.skipPast("endcomment");
    return new Nodes.Comment(token, note);
  }

  private static Node parseCycle(Parser parser, Token token) throws TemplateSyntaxException {
    List<String> args = new ArrayList<>(token.splitContents());
    if (args.size() < 2) {
      throw new TemplateSyntaxException(token, "'cycle' tag requires at least two arguments");
    }

    if (args.size() == 2) {
      String name = args.get(1);
      if (!parser.isCycleDeclared(name)) {
        throw new TemplateSyntaxException(
            token, String.format("named cycle '%s' does not exist", name));
      }
      return new Nodes.Cycle(token, ImmutableList.of(), Optional.of(name), false);
    }

    boolean asForm = false;
    boolean silent = false;
    if (args.size() > 4) {
      if (args.get(args.size() - 3).equals("as")) {
        String flag = args.get(args.size() - 1);
        if (!flag.equals("silent")) {
          throw new TemplateSyntaxException(
              token,
              String.format("only 'silent' flag is allowed after cycle's name, not '%s'", flag));
        }
        asForm = true;
        silent = true;
        args.remove(args.size() - 1);
      } else if (args.get(args.size() - 2).equals("as")) {
        asForm = true;
      }
    }

    if (asForm) {
      String name = args.get(args.size() - 1);
      List<FilterExpression> values =
          compileAll(parser, token, args.subList(1, args.size() - 2));
      parser.declareCycle(name);
      return new Nodes.Cycle(token, values, Optional.of(name), silent);
    }
    return new Nodes.Cycle(
        token, compileAll(parser, token, args.subList(1, args.size())), Optional.empty(), false);
  }

  private static Node parseExtends(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw new TemplateSyntaxException(token, "'extends' takes one argument");
    }
    return new Nodes.Extends(token, parser.compileFilter(bits.get(1), token));
  }

  private static Node parseFilter(Parser parser, Token token) throws TemplateSyntaxException {
    String contents = token.contents();
    if (contents.equals("filter")) {
      throw new TemplateSyntaxException(token, "'filter' tag requires an argument");
    }
    String chain = contents.substring("filter".length()).strip();
    FilterExpression expression = parser.compileSyntheticFilter(chain, token);
    for (FilterExpression.Filter filter : expression.filters()) {
      if (filter.name().equals("escape") || filter.name().equals("safe")) {
        throw new TemplateSyntaxException(
            token,
            String.format(
                "\"filter %s\" is not permitted; use the \"autoescape\" tag instead",
                filter.name()));
      }
    }
    ImmutableList<Node> body = parser.parse(ImmutableSet.of("endfilter"));
    parser.consumeEndTag("endfilter");
    return new Nodes.Filter(token, expression, body);
  }

  private static Node parseFirstOf(Parser parser, Token token) throws TemplateSyntaxException {
    List<String> bits = token.splitContents().subList(1, token.splitContents().size());
    if (bits.isEmpty()) {
      throw new TemplateSyntaxException(token, "'firstof' statement requires at least one argument");
    }
    Optional<String> asVar = Optional.empty();
    if (bits.size() >= 2 && bits.get(bits.size() - 2).equals("as")) {
      asVar = Optional.of(bits.get(bits.size() - 1));
      bits = bits.subList(0, bits.size() - 2);
    }
    return new Nodes.FirstOf(token, compileAll(parser, token, bits), asVar);
  }

  private static Node parseFor(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 4) {
      throw new TemplateSyntaxException(token, "'for' statements should have at least four words");
    }

    boolean reversed = bits.get(bits.size() - 1).equals("reversed");
    int inIndex = reversed ? bits.size() - 3 : bits.size() - 2;
    if (!bits.get(inIndex).equals("in")) {
      throw new TemplateSyntaxException(
          token, "'for' statements should use the format 'for x in y'");
    }

    List<String> loopVars = new ArrayList<>();
    for (String var :
        LOOP_VAR_SEPARATOR.split(String.join(" ", bits.subList(1, inIndex)), -1)) {
      if (var.isEmpty() || var.contains(" ") || var.contains("\"") || var.contains("'")
          || var.contains("|")) {
        throw new TemplateSyntaxException(token, "'for' tag received an invalid argument");
      }
      loopVars.add(var);
    }
    FilterExpression sequence = parser.compileFilter(bits.get(inIndex + 1), token);

    ImmutableList<Node> loop = parser.parse(ImmutableSet.of("empty", "endfor"));
    ImmutableList<Node> empty = ImmutableList.of();
    if (parser.nextToken().command().equals("empty")) {
      empty = parser.parse(ImmutableSet.of("endfor"));
      parser.consumeEndTag("endfor");
    }
    return new Nodes.For(token, loopVars, sequence, reversed, loop, empty);
  }

  private static Node parseIf(Parser parser, Token token) throws TemplateSyntaxException {
    List<Nodes.IfBranch> branches = new ArrayList<>();
    ImmutableSet<String> branchEnds = ImmutableSet.of("elif", "else", "endif");

    branches.add(
        new Nodes.IfBranch(
            token, parseCondition(parser, token), false, parser.parse(branchEnds)));
    Token next = parser.nextToken();
    while (next.command().equals("elif")) {
      branches.add(
          new Nodes.IfBranch(next, parseCondition(parser, next), false, parser.parse(branchEnds)));
      next = parser.nextToken();
    }

    if (next.command().equals("else")) {
      if (!next.contents().equals("else")) {
        throw new TemplateSyntaxException(next, "malformed 'else' tag");
      }
      branches.add(
          new Nodes.IfBranch(
              next, ImmutableList.of(), true, parser.parse(ImmutableSet.of("endif"))));
      next = parser.nextToken();
    }

    if (!next.contents().equals("endif")) {
      throw new TemplateSyntaxException(next, "malformed 'endif' tag");
    }
    return new Nodes.If(token, branches);
  }

  // Operators are kept aside; every other bit is an operand expression.
  private static ImmutableList<FilterExpression> parseCondition(Parser parser, Token token)
      throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 2) {
      throw new TemplateSyntaxException(token, "unexpected end of expression in if tag");
    }

    ImmutableList.Builder<FilterExpression> operands = ImmutableList.builder();
    boolean expectOperand = true;
    for (String bit : bits.subList(1, bits.size())) {
      if (IF_OPERATORS.contains(bit)) {
        if (bit.equals("not")) continue;
        if (expectOperand) {
          throw new TemplateSyntaxException(
              token, String.format("not expecting '%s' in this position in if tag", bit));
        }
        expectOperand = true;
        continue;
      }
      if (!expectOperand) {
        throw new TemplateSyntaxException(
            token, String.format("unused '%s' at end of if expression", bit));
      }
      operands.add(parser.compileFilter(bit, token));
      expectOperand = false;
    }
    if (expectOperand) {
      throw new TemplateSyntaxException(token, "unexpected end of expression in if tag");
    }
    return operands.build();
  }

  private static Node parseInclude(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 2) {
      throw new TemplateSyntaxException(
          token,
          "'include' tag takes at least one argument: the name of the template to be included");
    }

    Map<String, FilterExpression> extraContext = ImmutableMap.of();
    boolean isolated = false;
    List<String> seen = new ArrayList<>();
    List<String> remaining = new ArrayList<>(bits.subList(2, bits.size()));
    while (!remaining.isEmpty()) {
      String option = remaining.remove(0);
      if (seen.contains(option)) {
        throw new TemplateSyntaxException(
            token, String.format("the '%s' option was specified more than once", option));
      }
      if (option.equals("with")) {
        extraContext = tokenKwargs(parser, token, remaining, false);
        if (extraContext.isEmpty()) {
          throw new TemplateSyntaxException(
              token, "\"with\" in 'include' tag needs at least one keyword argument");
        }
      } else if (option.equals("only")) {
        isolated = true;
      } else {
        throw new TemplateSyntaxException(
            token, String.format("unknown argument for 'include' tag: '%s'", option));
      }
      seen.add(option);
    }
    return new Nodes.Include(
        token, parser.compileFilter(bits.get(1), token), extraContext, isolated);
  }

  private static Node parseLoad(Parser parser, Token token) throws TemplateSyntaxException {
    List<String> bits = ImmutableList.copyOf(token.contents().split("\\s+"));
    if (bits.size() >= 4 && bits.get(bits.size() - 2).equals("from")) {
      String name = bits.get(bits.size() - 1);
      parser.loadLibrary(name, token, ImmutableSet.copyOf(bits.subList(1, bits.size() - 2)));
      return new Nodes.Load(token, ImmutableList.of(name));
    }

    List<String> names = bits.subList(1, bits.size());
    for (String name : names) {
      parser.loadLibrary(name, token, ImmutableSet.of());
    }
    return new Nodes.Load(token, names);
  }

  private static Node parseSpaceless(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<Node> body = parser.parse(ImmutableSet.of("endspaceless"));
    parser.consumeEndTag("endspaceless");
    return new Nodes.Spaceless(token, body);
  }

  private static Node parseTemplateTag(Parser parser, Token token)
      throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw new TemplateSyntaxException(token, "'templatetag' statement takes one argument");
    }
    if (!TEMPLATE_TAG_TYPES.contains(bits.get(1))) {
      throw new TemplateSyntaxException(
          token,
          String.format(
              "invalid templatetag argument: '%s'; must be one of %s",
              bits.get(1),
              TEMPLATE_TAG_TYPES));
    }
    return new Nodes.TemplateTag(token, bits.get(1));
  }

  private static Node parseUrl(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> all = token.splitContents();
    if (all.size() < 2) {
      throw new TemplateSyntaxException(
          token, "'url' takes at least one argument, a URL pattern name");
    }
    FilterExpression viewName = parser.compileFilter(all.get(1), token);

    List<String> bits = all.subList(2, all.size());
    Optional<String> asVar = Optional.empty();
    if (bits.size() >= 2 && bits.get(bits.size() - 2).equals("as")) {
      asVar = Optional.of(bits.get(bits.size() - 1));
      bits = bits.subList(0, bits.size() - 2);
    }

    List<FilterExpression> args = new ArrayList<>();
    Map<String, FilterExpression> kwargs = new LinkedHashMap<>();
    for (String bit : bits) {
      Matcher m = KWARG.matcher(bit);
      if (!m.matches()) {
        throw new TemplateSyntaxException(token, "malformed arguments to url tag");
      }
      FilterExpression value = parser.compileFilter(m.group(2), token);
      if (m.group(1) != null) {
        kwargs.put(m.group(1), value);
      } else {
        args.add(value);
      }
    }
    return new Nodes.Url(token, viewName, args, kwargs, asVar);
  }

  private static Node parseVerbatim(Parser parser, Token token) throws TemplateSyntaxException {
    String contents = token.contents();
    Optional<String> name =
        contents.equals("verbatim")
            ? Optional.empty()
            : Optional.of(contents.substring("verbatim".length()).strip());
    ImmutableList<Node> body = parser.parse(ImmutableSet.of("endverbatim"));
    Token endToken = parser.consumeEndTag("endverbatim");
    return new Nodes.Verbatim(token, name, body, endToken);
  }

  private static Node parseWidthRatio(Parser parser, Token token)
      throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    Optional<String> asVar = Optional.empty();
    if (bits.size() == 6) {
      if (!bits.get(4).equals("as")) {
        throw new TemplateSyntaxException(
            token, "invalid syntax in widthratio tag; expecting 'as' keyword");
      }
      asVar = Optional.of(bits.get(5));
    } else if (bits.size() != 4) {
      throw new TemplateSyntaxException(token, "widthratio takes at least three arguments");
    }
    return new Nodes.WidthRatio(
        token,
        parser.compileFilter(bits.get(1), token),
        parser.compileFilter(bits.get(2), token),
        parser.compileFilter(bits.get(3), token),
        asVar);
  }

  private static Node parseWith(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    List<String> remaining = new ArrayList<>(bits.subList(1, bits.size()));
    Map<String, FilterExpression> extraContext = tokenKwargs(parser, token, remaining, true);
    if (extraContext.isEmpty()) {
      throw new TemplateSyntaxException(token, "'with' expected at least one variable assignment");
    }
    if (!remaining.isEmpty()) {
      throw new TemplateSyntaxException(
          token, String.format("'with' received an invalid token: '%s'", remaining.get(0)));
    }
    ImmutableList<Node> body = parser.parse(ImmutableSet.of("endwith"));
    parser.consumeEndTag("endwith");
    return new Nodes.With(token, extraContext, body);
  }

  private static Node parseStatic(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 2) {
      throw new TemplateSyntaxException(
          token, "'static' takes at least one argument (path to file)");
    }
    Optional<String> asVar = Optional.empty();
    if (bits.size() >= 4 && bits.get(bits.size() - 2).equals("as")) {
      asVar = Optional.of(bits.get(bits.size() - 1));
    }
    return new Nodes.Static(token, parser.compileFilter(bits.get(1), token), asVar);
  }

  private static TagParser prefixTag(String setting) {
    return (parser, token) -> {
      ImmutableList<String> bits = token.splitContents();
      Optional<String> asVar = Optional.empty();
      if (bits.size() > 1) {
        if (bits.size() != 3 || !bits.get(1).equals("as")) {
          throw new TemplateSyntaxException(
              token, String.format("first argument in '%s' must be 'as'", bits.get(0)));
        }
        asVar = Optional.of(bits.get(2));
      }
      return new Nodes.Prefix(token, bits.get(0), setting, asVar);
    };
  }

  private static Node parseTrans(Parser parser, Token token) throws TemplateSyntaxException {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 2) {
      throw new TemplateSyntaxException(token, "'trans' takes at least one argument");
    }
    FilterExpression message = parser.compileFilter(bits.get(1), token);

    boolean noop = false;
    Optional<FilterExpression> context = Optional.empty();
    Optional<String> asVar = Optional.empty();
    List<String> seen = new ArrayList<>();
    List<String> remaining = new ArrayList<>(bits.subList(2, bits.size()));
    while (!remaining.isEmpty()) {
      String option = remaining.remove(0);
      if (seen.contains(option)) {
        throw new TemplateSyntaxException(
            token, String.format("the '%s' option was specified more than once", option));
      }
      switch (option) {
        case "noop":
          noop = true;
          break;
        case "context":
          context = Optional.of(parser.compileFilter(optionValue(token, remaining, option), token));
          break;
        case "as":
          asVar = Optional.of(optionValue(token, remaining, option));
          break;
        default:
          throw new TemplateSyntaxException(
              token,
              String.format(
                  "unknown argument for 'trans' tag: '%s'; the options are 'noop', "
                      + "'context \"xxx\"' and 'as VAR'",
                  option));
      }
      seen.add(option);
    }
    return new Nodes.Trans(token, message, context, asVar, noop);
  }

  private static String optionValue(Token token, List<String> remaining, String option)
      throws TemplateSyntaxException {
    if (remaining.isEmpty()) {
      throw new TemplateSyntaxException(
          token, String.format("no argument provided to the 'trans' tag for the %s option", option));
    }
    String value = remaining.remove(0);
    if (value.equals("as") || value.equals("noop")) {
      throw new TemplateSyntaxException(
          token,
          String.format(
              "invalid argument '%s' provided to the 'trans' tag for the %s option",
              value,
              option));
    }
    return value;
  }

  // Reads a=b c=d bindings off the front of bits, or with supportLegacy the b as a and d as c form.
  // Consumed bits are removed; parsing stops at the first bit that does not continue the form.
  private static Map<String, FilterExpression> tokenKwargs(
      Parser parser, Token token, List<String> bits, boolean supportLegacy)
      throws TemplateSyntaxException {
    if (bits.isEmpty()) {
      return ImmutableMap.of();
    }

    Matcher first = KWARG.matcher(bits.get(0));
    boolean kwargFormat = first.matches() && first.group(1) != null;
    if (!kwargFormat) {
      if (!supportLegacy || bits.size() < 3 || !bits.get(1).equals("as")) {
        return ImmutableMap.of();
      }
    }

    Map<String, FilterExpression> kwargs = new LinkedHashMap<>();
    while (!bits.isEmpty()) {
      String key;
      String value;
      if (kwargFormat) {
        Matcher m = KWARG.matcher(bits.get(0));
        if (!m.matches() || m.group(1) == null) {
          return kwargs;
        }
        key = m.group(1);
        value = m.group(2);
        bits.remove(0);
      } else {
        if (bits.size() < 3 || !bits.get(1).equals("as")) {
          return kwargs;
        }
        key = bits.get(2);
        value = bits.get(0);
        bits.subList(0, 3).clear();
      }
      kwargs.put(key, parser.compileFilter(value, token));

      if (!bits.isEmpty() && !kwargFormat) {
        if (!bits.get(0).equals("and")) {
          return kwargs;
        }
        bits.remove(0);
      }
    }
    return kwargs;
  }

  private static List<FilterExpression> compileAll(Parser parser, Token token, List<String> bits)
      throws TemplateSyntaxException {
    List<FilterExpression> expressions = new ArrayList<>();
    for (String bit : bits) {
      expressions.add(parser.compileFilter(bit, token));
    }
    return expressions;
  }

  private BuiltinTags() {}
}
