package dtj;

import static com.google.common.truth.Truth.assertThat;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class BatchConverterTest {

  @TempDir File tempDir;

  private final Aggregator aggregator = new Aggregator();
  private final BatchConverter batch =
      new BatchConverter(new TemplateConverter(ConversionRules.defaults()), aggregator, ".html");

  private void write(File file, String content) throws IOException {
    Files.createParentDirs(file);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  @Test
  public void findsTemplates() throws IOException {
    File input = new File(tempDir, "templates");
    write(new File(input, "b.html"), "");
    write(new File(input, "a/c.html"), "");
    write(new File(input, "notes.txt"), "");

    assertThat(batch.findTemplates(input))
        .containsExactly(new File(input, "a/c.html"), new File(input, "b.html"))
        .inOrder();
  }

  @Test
  public void mirrorsLayout() throws IOException {
    File input = new File(tempDir, "templates");
    File output = new File(tempDir, "jinja2");
    write(new File(input, "base.html"), "{% csrf_token %}{{ user.name }}");
    write(new File(input, "shop/item.html"), "{{ price|money:2 }}");

    assertThat(batch.convertAll(input, output)).isTrue();

    assertThat(read(new File(output, "base.html")))
        .isEqualTo("{{ csrf_input }}{{ request.user.name }}");
    assertThat(read(new File(output, "shop/item.html"))).isEqualTo("{{ price|money(2) }}");
    assertThat(aggregator.unknownFilters()).containsExactly("money");
  }

  @Test
  public void continuesAfterSyntaxError() throws IOException {
    File input = new File(tempDir, "templates");
    File output = new File(tempDir, "jinja2");
    write(new File(input, "a.html"), "{% if x %}");
    write(new File(input, "b.html"), "{{ x }}");

    assertThat(batch.convertAll(input, output)).isFalse();

    assertThat(new File(output, "a.html").exists()).isFalse();
    assertThat(read(new File(output, "b.html"))).isEqualTo("{{ x }}");
  }

  @Test
  public void continuesAfterInternalError() throws IOException {
    File input = new File(tempDir, "templates");
    File output = new File(tempDir, "jinja2");
    write(new File(input, "a.html"), "{% csrf_token %}");
    write(new File(input, "b.html"), "{{ x }}");
    ConversionRules rules = ConversionRules.defaults();
    BatchConverter failing =
        new BatchConverter(
            new TemplateConverter(
                rules,
                new StandardNodeRules(rules) {
                  @Override
                  public NodeRewrite apply(Nodes.CsrfToken node) {
                    throw new IllegalStateException("broken rule");
                  }
                }),
            aggregator,
            ".html");

    assertThat(failing.convertAll(input, output)).isFalse();

    assertThat(new File(output, "a.html").exists()).isFalse();
    assertThat(read(new File(output, "b.html"))).isEqualTo("{{ x }}");
  }

  @Test
  public void rejectsMalformedUtf8() throws IOException {
    File input = new File(tempDir, "templates");
    File output = new File(tempDir, "jinja2");
    File latin1 = new File(input, "a.html");
    Files.createParentDirs(latin1);
    Files.write(new byte[] {'c', 'a', 'f', (byte) 0xE9, '\n'}, latin1);
    write(new File(input, "b.html"), "caf\u00e9");

    assertThat(batch.convertAll(input, output)).isFalse();

    assertThat(new File(output, "a.html").exists()).isFalse();
    assertThat(read(new File(output, "b.html"))).isEqualTo("caf\u00e9");
  }
}
