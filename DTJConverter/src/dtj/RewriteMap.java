package dtj;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

public final class RewriteMap {
  private final Map<Integer, Map<String, String>> substitutions = new HashMap<>();

  public void add(Token token, String original, String replacement) {
    Preconditions.checkArgument(!original.isEmpty(), "empty original at %s", token.pos());
    substitutions
        .computeIfAbsent(token.index(), i -> new LinkedHashMap<>())
        .put(original, replacement);
  }

  public ImmutableMap<String, String> substitutions(int tokenIndex) {
    Map<String, String> forToken = substitutions.get(tokenIndex);
    return forToken == null ? ImmutableMap.of() : ImmutableMap.copyOf(forToken);
  }

  // Applies the token's substitutions to text in one left-to-right pass. At each position the
  // longest matching original wins; an original only matches where it is not part of a longer
  // identifier or dotted path. Quoted strings are copied as they are unless an original starts at
  // the opening quote. Replacement text is never rescanned.
  public String applyTo(int tokenIndex, String text) {
    Map<String, String> forToken = substitutions.get(tokenIndex);
    if (forToken == null) {
      return text;
    }

    List<String> originals =
        forToken
            .keySet()
            .stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(Collectors.toList());
    StringBuilder out = new StringBuilder();
    int i = 0;
    while (i < text.length()) {
      String match = matchAt(text, i, originals);
      if (match != null) {
        out.append(forToken.get(match));
        i += match.length();
        continue;
      }

      char c = text.charAt(i);
      if (c == '"' || c == '\'') {
        int close = closingQuote(text, i);
        if (close >= 0) {
          out.append(text, i, close + 1);
          i = close + 1;
          continue;
        }
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private static String matchAt(String text, int at, List<String> originals) {
    if (at > 0 && isPathChar(text.charAt(at - 1))) {
      return null;
    }
    for (String original : originals) {
      int end = at + original.length();
      if (text.startsWith(original, at) && (end == text.length() || !isPathChar(text.charAt(end)))) {
        return original;
      }
    }
    return null;
  }

  private static boolean isPathChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }

  private static int closingQuote(String text, int open) {
    char quote = text.charAt(open);
    for (int i = open + 1; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == quote) {
        return i;
      }
    }
    return -1;
  }
}
