package dtj;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

@AutoValue
public abstract class ConversionRules {

  public abstract ImmutableList<PathRule> pathRules();

  // Filter name to its Jinja2 form. An empty template keeps the filter as |name(arg); otherwise the
  // template's {input}, {escaped} and {raw} placeholders are filled in. Filters missing from the
  // table are reported as unknown.
  public abstract ImmutableMap<String, Optional<String>> filterRules();

  public abstract ImmutableMap<String, String> literalOverrides();

  public abstract ImmutableSet<String> passthroughTags();

  public abstract ImmutableMap<String, TagLibrary> libraries();

  public static Builder builder() {
    return new AutoValue_ConversionRules.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ImmutableList.Builder<PathRule> pathRulesBuilder();

    public abstract ImmutableMap.Builder<String, Optional<String>> filterRulesBuilder();

    public abstract ImmutableMap.Builder<String, String> literalOverridesBuilder();

    public abstract ImmutableSet.Builder<String> passthroughTagsBuilder();

    public abstract ImmutableMap.Builder<String, TagLibrary> librariesBuilder();

    public Builder addPathRule(String pattern, String replacement) {
      pathRulesBuilder().add(PathRule.of(pattern, replacement));
      return this;
    }

    public Builder keepFilter(String name) {
      filterRulesBuilder().put(name, Optional.empty());
      return this;
    }

    public Builder rewriteFilter(String name, String template) {
      filterRulesBuilder().put(name, Optional.of(template));
      return this;
    }

    public Builder overrideLiteral(String contents, String replacement) {
      literalOverridesBuilder().put(contents, replacement);
      return this;
    }

    public Builder passthroughTag(String name) {
      passthroughTagsBuilder().add(name);
      return this;
    }

    public Builder library(TagLibrary library) {
      librariesBuilder().put(library.name(), library);
      return this;
    }

    public abstract ConversionRules build();
  }

  private static final ConversionRules DEFAULTS = createDefaults();

  public static ConversionRules defaults() {
    return DEFAULTS;
  }

  private static ConversionRules createDefaults() {
    Builder builder =
        builder()
            .addPathRule("forloop\\.counter0", "loop.index0")
            .addPathRule("forloop\\.counter", "loop.index")
            .addPathRule("forloop\\.revcounter0", "loop.revindex0")
            .addPathRule("forloop\\.revcounter", "loop.revindex")
            .addPathRule("forloop\\.(first|last)", "loop.$1")
            .addPathRule("^block\\.super$", "super()")
            .addPathRule("^user", "request.user")
            .addPathRule("\\.(all|count|items|keys|values|exists)", ".$1()")
            .addPathRule("get_\\w+", "$0()");

    for (String name :
        ImmutableList.of(
            // Registered with the Jinja2 environment.
            "date",
            "default_if_none",
            "floatformat",
            "intcomma",
            "linebreaks",
            "markdown",
            "pluralize",
            "time",
            "timesince",
            "timeuntil",
            "truncatewords",
            // Same name and meaning in Jinja2.
            "center",
            "escape",
            "filesizeformat",
            "first",
            "join",
            "last",
            "length",
            "lower",
            "pprint",
            "random",
            "safe",
            "striptags",
            "title",
            "upper",
            "urlencode",
            "urlize",
            "wordcount",
            "wordwrap")) {
      builder.keepFilter(name);
    }

    builder
        .rewriteFilter("add", "({input} + {escaped})")
        .rewriteFilter("cut", "{input}|replace({escaped}, \"\")")
        .rewriteFilter("default", "{input}|default({escaped}, true)")
        .rewriteFilter("dictsort", "{input}|sort(attribute={escaped})")
        .rewriteFilter("dictsortreversed", "{input}|sort(attribute={escaped}, reverse=true)")
        .rewriteFilter("divisibleby", "({input} is divisibleby {escaped})")
        .rewriteFilter("force_escape", "{input}|forceescape")
        .rewriteFilter("length_is", "({input}|length == {raw})")
        .rewriteFilter("make_list", "{input}|list")
        .rewriteFilter("safeseq", "{input}|map(\"safe\")|list")
        .rewriteFilter("slice", "{input}[{raw}]")
        .rewriteFilter("stringformat", "\"%{raw}\"|format({input})")
        .rewriteFilter("truncatechars", "{input}|truncate({escaped}, true)");

    builder
        .overrideLiteral("comment", "{#")
        .overrideLiteral("endcomment", "#}")
        .overrideLiteral("empty", "{% else %}")
        .overrideLiteral("verbatim", "{% raw %}")
        .overrideLiteral("endverbatim", "{% endraw %}")
        .overrideLiteral("templatetag openblock", "{{ \"{%\" }}")
        .overrideLiteral("templatetag closeblock", "{{ \"%}\" }}")
        .overrideLiteral("templatetag openvariable", "{{ \"{{\" }}")
        .overrideLiteral("templatetag closevariable", "{{ \"}}\" }}")
        .overrideLiteral("templatetag openbrace", "{")
        .overrideLiteral("templatetag closebrace", "}")
        .overrideLiteral("templatetag opencomment", "{{ \"{#\" }}")
        .overrideLiteral("templatetag closecomment", "{{ \"#}\" }}");

    builder.passthroughTag("compress");
    BuiltinTags.standardLibraries().values().forEach(builder::library);
    return builder.build();
  }
}
