package dtj;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

public final class TagLibrary {
  private final String name;
  private final ImmutableMap<String, TagParser> tags;

  private TagLibrary(String name, Map<String, TagParser> tags) {
    this.name = name;
    this.tags = ImmutableMap.copyOf(tags);
  }

  public String name() {
    return name;
  }

  public ImmutableMap<String, TagParser> tags() {
    return tags;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String toString() {
    return name + tags.keySet();
  }

  public static final class Builder {
    private final String name;
    private final Map<String, TagParser> tags = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder tag(String tagName, TagParser parser) {
      tags.put(tagName, parser);
      return this;
    }

    public Builder simpleTag(String tagName) {
      return tag(tagName, (parser, token) -> parser.parseCustom(token, false));
    }

    public Builder blockTag(String tagName) {
      return tag(tagName, (parser, token) -> parser.parseCustom(token, true));
    }

    public TagLibrary build() {
      return new TagLibrary(name, tags);
    }
  }
}
