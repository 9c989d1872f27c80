package dtj;

import java.util.regex.Pattern;

/**
 * Rewrites a variable lookup path. The pattern is matched on word boundaries, except on a side
 * anchored with {@code ^} or {@code $}; the replacement may refer to groups as {@code $1}.
 */
public final class PathRule {
  private final String pattern;
  private final String replacement;
  private final Pattern compiled;

  private PathRule(String pattern, String replacement) {
    this.pattern = pattern;
    this.replacement = replacement;
    this.compiled =
        Pattern.compile(
            (pattern.startsWith("^") ? "" : "\\b") + pattern + (pattern.endsWith("$") ? "" : "\\b"));
  }

  public static PathRule of(String pattern, String replacement) {
    return new PathRule(pattern, replacement);
  }

  public String pattern() {
    return pattern;
  }

  public String replacement() {
    return replacement;
  }

  public String apply(String path) {
    return compiled.matcher(path).replaceAll(replacement);
  }

  @Override
  public String toString() {
    return pattern + " -> " + replacement;
  }
}
