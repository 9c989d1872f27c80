package dtj;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class FilterExpression {

  @AutoValue
  public abstract static class Operand {
    public enum Type {
      VARIABLE,
      STRING,
      NUMBER;
    }

    public abstract Type type();

    public abstract String source();

    public abstract String value();

    public abstract boolean translated();

    public boolean isVariable() {
      return type() == Type.VARIABLE;
    }

    public static Operand variable(String path) {
      return new AutoValue_FilterExpression_Operand(Type.VARIABLE, path, path, false);
    }

    public static Operand number(String source) {
      return new AutoValue_FilterExpression_Operand(Type.NUMBER, source, source, false);
    }

    public static Operand string(String source, String value, boolean translated) {
      return new AutoValue_FilterExpression_Operand(Type.STRING, source, value, translated);
    }

    @Override
    public String toString() {
      return source();
    }
  }

  @AutoValue
  public abstract static class Filter {
    public abstract String name();

    public abstract Optional<Operand> arg();

    public static Filter create(String name, Optional<Operand> arg) {
      return new AutoValue_FilterExpression_Filter(name, arg);
    }
  }

  private static final String STR_DQ = "\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\"";
  private static final String STR_SQ = "'[^'\\\\]*(?:\\\\.[^'\\\\]*)*'";
  private static final String CONSTANT =
      "(?:_\\(" + STR_DQ + "\\)|_\\(" + STR_SQ + "\\)|" + STR_DQ + "|" + STR_SQ + ")";
  private static final String NUM = "[-+.]?\\d[\\d.e]*";
  private static final String VAR = "[\\w.]+|" + NUM;
  private static final Pattern NUMBER = Pattern.compile(NUM);

  private static final Pattern FILTER_PATTERN =
      Pattern.compile(
          "^(?<constant>"
              + CONSTANT
              + ")|^(?<var>"
              + VAR
              + ")|(?:\\s*\\|\\s*(?<filterName>\\w+)(?::(?:(?<constantArg>"
              + CONSTANT
              + ")|(?<varArg>"
              + VAR
              + ")))?)");

  public abstract String source();

  public abstract Operand base();

  public abstract ImmutableList<Filter> filters();

  public static FilterExpression create(String source, Operand base, Iterable<Filter> filters) {
    return new AutoValue_FilterExpression(source, base, ImmutableList.copyOf(filters));
  }

  public static FilterExpression parse(String text, Token.Pos pos) throws TemplateSyntaxException {
    String source = text.strip();
    if (source.isEmpty()) {
      throw new TemplateSyntaxException(pos, "empty variable expression");
    }

    Operand base = null;
    ImmutableList.Builder<Filter> filters = ImmutableList.builder();
    Matcher m = FILTER_PATTERN.matcher(source);
    int upto = 0;
    while (m.find()) {
      if (m.start() != upto) {
        throw new TemplateSyntaxException(
            pos,
            String.format(
                "could not parse some characters: %s|%s|%s",
                source.substring(0, upto),
                source.substring(upto, m.start()),
                source.substring(m.start())));
      }

      if (base == null) {
        if (m.group("constant") != null) {
          base = constant(m.group("constant"));
        } else if (m.group("var") != null) {
          base = variable(m.group("var"), pos);
        } else {
          throw new TemplateSyntaxException(
              pos, "could not find variable at start of '" + source + "'");
        }
      } else {
        Optional<Operand> arg = Optional.empty();
        if (m.group("constantArg") != null) {
          arg = Optional.of(constant(m.group("constantArg")));
        } else if (m.group("varArg") != null) {
          arg = Optional.of(variable(m.group("varArg"), pos));
        }
        filters.add(Filter.create(m.group("filterName"), arg));
      }
      upto = m.end();
    }

    if (upto != source.length()) {
      throw new TemplateSyntaxException(
          pos,
          String.format(
              "could not parse the remainder: '%s' from '%s'", source.substring(upto), source));
    }
    return create(source, base, filters.build());
  }

  private static Operand constant(String source) {
    boolean translated = source.startsWith("_(");
    String quoted = translated ? source.substring(2, source.length() - 1) : source;
    return Operand.string(source, unescape(quoted), translated);
  }

  private static Operand variable(String source, Token.Pos pos) throws TemplateSyntaxException {
    if (NUMBER.matcher(source).matches()) {
      return Operand.number(source);
    }
    if (source.startsWith("_") || source.contains("._")) {
      throw new TemplateSyntaxException(
          pos, "variables and attributes may not begin with underscores: '" + source + "'");
    }
    return Operand.variable(source);
  }

  private static String unescape(String quoted) {
    char quote = quoted.charAt(0);
    return quoted
        .substring(1, quoted.length() - 1)
        .replace("\\" + quote, String.valueOf(quote))
        .replace("\\\\", "\\");
  }
}
