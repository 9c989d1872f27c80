package dtj;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public final class NodeRewriteMap {
  private final Map<Integer, String> replacements = new HashMap<>();

  public void record(int tokenIndex, String replacement) {
    replacements.put(tokenIndex, replacement);
  }

  public Optional<String> replacement(int tokenIndex) {
    return Optional.ofNullable(replacements.get(tokenIndex));
  }

  public int size() {
    return replacements.size();
  }
}
