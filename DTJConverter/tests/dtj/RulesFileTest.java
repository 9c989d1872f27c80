package dtj;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class RulesFileTest {

  private static ConversionRules loadFixture() throws IOException, URISyntaxException {
    Path path = Paths.get(RulesFileTest.class.getResource("/rules.json").toURI());
    return RulesFile.load(path, ConversionRules.defaults());
  }

  @Test
  public void mergesOverDefaults() throws IOException, URISyntaxException {
    ConversionRules rules = loadFixture();
    ConversionRules defaults = ConversionRules.defaults();

    assertThat(rules.pathRules()).hasSize(defaults.pathRules().size() + 1);
    assertThat(rules.pathRules().get(rules.pathRules().size() - 1).pattern())
        .isEqualTo("^profile");
    assertThat(rules.filterRules())
        .containsEntry("money", Optional.of("{input}|currency({escaped})"));
    assertThat(rules.filterRules()).containsEntry("naturalday", Optional.empty());
    assertThat(rules.filterRules()).containsEntry("date", Optional.empty());
    assertThat(rules.literalOverrides()).containsEntry("endif_legacy", "{% endif %}");
    assertThat(rules.literalOverrides()).containsEntry("empty", "{% else %}");
    assertThat(rules.passthroughTags()).containsExactly("compress", "cache");
    assertThat(rules.libraries()).containsKey("static");
    assertThat(rules.libraries().get("thumbnail").tags().keySet())
        .containsExactly("thumbnail_url", "thumbnail");
  }

  @Test
  public void loadedRulesConvert() throws Exception {
    TemplateConverter converter = new TemplateConverter(loadFixture());

    ConversionResult result =
        converter.convert(
            "a.html",
            "{% load thumbnail %}{% thumbnail img \"100x100\" %}<img>{% endthumbnail %}"
                + "{{ profile.balance|money:'EUR' }}{{ d|naturalday }}");

    assertThat(result.output())
        .isEqualTo(
            "{% thumbnail img \"100x100\" %}<img>{% endthumbnail %}"
                + "{{ request.user.profile.balance|currency(\"EUR\") }}{{ d|naturalday }}");
    assertThat(result.unknownFilters()).isEmpty();
    assertThat(result.unknownNodeKinds()).containsExactly("thumbnail");
  }

  @Test
  public void replacesFilterRule() throws IOException {
    ConversionRules rules =
        RulesFile.parse("{\"filters\": {\"default\": null}}", ConversionRules.defaults());

    assertThat(rules.filterRules()).containsEntry("default", Optional.empty());
  }

  @Test
  public void invalidPattern() {
    IOException ex =
        assertThrows(
            IOException.class,
            () ->
                RulesFile.parse(
                    "{\"pathRules\": [{\"pattern\": \"(\", \"replacement\": \"x\"}]}",
                    ConversionRules.defaults()));

    assertThat(ex).hasMessageThat().contains("invalid path rule pattern");
  }

  @Test
  public void incompletePathRule() {
    assertThrows(
        IOException.class,
        () ->
            RulesFile.parse(
                "{\"pathRules\": [{\"pattern\": \"^a\"}]}", ConversionRules.defaults()));
  }

  @Test
  public void nullLiteral() {
    assertThrows(
        IOException.class,
        () -> RulesFile.parse("{\"literals\": {\"x\": null}}", ConversionRules.defaults()));
  }

  @Test
  public void malformedJson() {
    assertThrows(IOException.class, () -> RulesFile.parse("{", ConversionRules.defaults()));
  }
}
