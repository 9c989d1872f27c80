package dtj;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class NodeRewrite {
  public enum Outcome {
    NONE,
    REPLACE,
    // No translation: emitted as written and reported.
    UNKNOWN;
  }

  public abstract Outcome outcome();

  public abstract String replacement();

  public abstract ImmutableMap<Integer, String> otherReplacements();

  public abstract ImmutableList<String> warnings();

  public static NodeRewrite none() {
    return new AutoValue_NodeRewrite(Outcome.NONE, "", ImmutableMap.of(), ImmutableList.of());
  }

  public static NodeRewrite replace(String replacement) {
    return new AutoValue_NodeRewrite(
        Outcome.REPLACE, replacement, ImmutableMap.of(), ImmutableList.of());
  }

  public static NodeRewrite unknown() {
    return new AutoValue_NodeRewrite(Outcome.UNKNOWN, "", ImmutableMap.of(), ImmutableList.of());
  }

  public NodeRewrite alsoReplacing(int tokenIndex, String replacement) {
    return new AutoValue_NodeRewrite(
        outcome(),
        replacement(),
        ImmutableMap.<Integer, String>builder()
            .putAll(otherReplacements())
            .put(tokenIndex, replacement)
            .build(),
        warnings());
  }

  public NodeRewrite withWarning(String warning) {
    return new AutoValue_NodeRewrite(
        outcome(),
        replacement(),
        otherReplacements(),
        ImmutableList.<String>builder().addAll(warnings()).add(warning).build());
  }
}
