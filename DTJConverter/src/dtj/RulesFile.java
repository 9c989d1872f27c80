package dtj;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Project-specific additions to {@link ConversionRules}, read from JSON:
 *
 * <pre>
 * {
 *   "pathRules": [{"pattern": "^profile", "replacement": "request.user.profile"}],
 *   "filters": {"money": "{input}|currency", "naturalday": null},
 *   "literals": {"endif_legacy": "{% endif %}"},
 *   "passthroughTags": ["cache"],
 *   "libraries": {"cache": {"tags": [], "blockTags": ["cache"]}}
 * }
 * </pre>
 *
 * Path rules run after the base rules. A {@code null} filter keeps the filter as written. Every
 * other entry adds to or replaces the base entry of the same name.
 */
public final class RulesFile {
  private static final Logger logger = LogManager.getLogger(RulesFile.class);

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(JsonParser.Feature.ALLOW_COMMENTS);

  static final class PathRuleEntry {
    public String pattern;
    public String replacement;
  }

  static final class LibraryEntry {
    public List<String> tags = new ArrayList<>();
    public List<String> blockTags = new ArrayList<>();
  }

  static final class Contents {
    public List<PathRuleEntry> pathRules = new ArrayList<>();
    public Map<String, String> filters = new LinkedHashMap<>();
    public Map<String, String> literals = new LinkedHashMap<>();
    public List<String> passthroughTags = new ArrayList<>();
    public Map<String, LibraryEntry> libraries = new LinkedHashMap<>();
  }

  public static ConversionRules load(Path path, ConversionRules base) throws IOException {
    logger.debug("Reading conversion rules from {}", path);
    return merge(base, MAPPER.readValue(path.toFile(), Contents.class));
  }

  public static ConversionRules parse(String json, ConversionRules base) throws IOException {
    return merge(base, MAPPER.readValue(json, Contents.class));
  }

  private static ConversionRules merge(ConversionRules base, Contents contents)
      throws IOException {
    ConversionRules.Builder builder = ConversionRules.builder();

    builder.pathRulesBuilder().addAll(base.pathRules());
    for (PathRuleEntry entry : contents.pathRules) {
      if (entry.pattern == null || entry.replacement == null) {
        throw new IOException("path rules need a 'pattern' and a 'replacement'");
      }
      try {
        builder.addPathRule(entry.pattern, entry.replacement);
      } catch (PatternSyntaxException ex) {
        throw new IOException("invalid path rule pattern: " + entry.pattern, ex);
      }
    }

    Map<String, Optional<String>> filters = new LinkedHashMap<>(base.filterRules());
    contents.filters.forEach((name, template) -> filters.put(name, Optional.ofNullable(template)));
    builder.filterRulesBuilder().putAll(filters);

    Map<String, String> literals = new LinkedHashMap<>(base.literalOverrides());
    for (Map.Entry<String, String> entry : contents.literals.entrySet()) {
      if (entry.getValue() == null) {
        throw new IOException("literal override for '" + entry.getKey() + "' has no replacement");
      }
      literals.put(entry.getKey(), entry.getValue());
    }
    builder.literalOverridesBuilder().putAll(literals);

    builder.passthroughTagsBuilder().addAll(base.passthroughTags()).addAll(contents.passthroughTags);

    Map<String, TagLibrary> libraries = new LinkedHashMap<>(base.libraries());
    contents.libraries.forEach((name, entry) -> libraries.put(name, toLibrary(name, entry)));
    builder.librariesBuilder().putAll(libraries);

    return builder.build();
  }

  private static TagLibrary toLibrary(String name, LibraryEntry entry) {
    TagLibrary.Builder library = TagLibrary.builder(name);
    entry.tags.forEach(library::simpleTag);
    entry.blockTags.forEach(library::blockTag);
    return library.build();
  }

  private RulesFile() {}
}
