package dtj;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

@AutoValue
public abstract class ConversionResult {
  public abstract String name();

  public abstract String output();

  public abstract ImmutableSortedSet<String> unknownFilters();

  public abstract ImmutableSortedSet<String> unknownNodeKinds();

  public abstract ImmutableSortedSet<String> usedVariables();

  public abstract ImmutableList<String> warnings();

  public static ConversionResult create(
      String name,
      String output,
      ImmutableSortedSet<String> unknownFilters,
      ImmutableSortedSet<String> unknownNodeKinds,
      ImmutableSortedSet<String> usedVariables,
      ImmutableList<String> warnings) {
    return new AutoValue_ConversionResult(
        name, output, unknownFilters, unknownNodeKinds, usedVariables, warnings);
  }
}
