package dtj;

import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

public class Aggregator {
  private static final Joiner COMMA = Joiner.on(", ");

  private final Set<String> usedVariables = new TreeSet<>();
  private final Set<String> unknownFilters = new TreeSet<>();
  private final Set<String> unknownNodeKinds = new TreeSet<>();

  public synchronized void add(ConversionResult result) {
    usedVariables.addAll(result.usedVariables());
    unknownFilters.addAll(result.unknownFilters());
    unknownNodeKinds.addAll(result.unknownNodeKinds());
  }

  public synchronized ImmutableSortedSet<String> unknownFilters() {
    return ImmutableSortedSet.copyOf(unknownFilters);
  }

  public synchronized ImmutableSortedSet<String> unknownNodeKinds() {
    return ImmutableSortedSet.copyOf(unknownNodeKinds);
  }

  public synchronized ImmutableSortedMap<String, ImmutableSortedSet<String>> variablesByRoot() {
    Map<String, SortedSet<String>> groups = new TreeMap<>();
    for (String path : usedVariables) {
      int dot = path.indexOf('.');
      String root = dot < 0 ? "" : path.substring(0, dot);
      String member = dot < 0 ? path : path.substring(dot + 1).split("\\.", 2)[0];
      groups.computeIfAbsent(root, r -> new TreeSet<>()).add(member);
    }

    ImmutableSortedMap.Builder<String, ImmutableSortedSet<String>> builder =
        ImmutableSortedMap.naturalOrder();
    groups.forEach((root, members) -> builder.put(root, ImmutableSortedSet.copyOf(members)));
    return builder.build();
  }

  public synchronized ImmutableList<String> summaryLines() {
    ImmutableSortedMap<String, ImmutableSortedSet<String>> groups = variablesByRoot();

    SortedSet<String> names = new TreeSet<>(groups.keySet());
    names.remove("");
    names.addAll(groups.getOrDefault("", ImmutableSortedSet.of()));

    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add("Variables: " + COMMA.join(names));
    groups.forEach(
        (root, members) -> {
          if (!root.isEmpty()) {
            lines.add(String.format("  %s: %s", root, COMMA.join(members)));
          }
        });
    if (!unknownFilters.isEmpty()) {
      lines.add("Unknown filters: " + COMMA.join(unknownFilters));
    }
    if (!unknownNodeKinds.isEmpty()) {
      lines.add("Unknown tags: " + COMMA.join(unknownNodeKinds));
    }
    return lines.build();
  }
}
