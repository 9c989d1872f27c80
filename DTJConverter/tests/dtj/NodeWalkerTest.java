package dtj;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class NodeWalkerTest {

  private final NodeRewriteMap nodeRewrites = new NodeRewriteMap();

  private NodeWalker walk(String content) throws TemplateSyntaxException {
    ConversionRules rules = ConversionRules.defaults();
    ImmutableList<Token> tokens = new Lexer("/test/page.html", content).tokenize();
    Nodes.Template template =
        new Parser("/test/page.html", tokens, rules.libraries(), (t, e, s) -> {}).parse();

    NodeWalker walker = new NodeWalker(tokens, new StandardNodeRules(rules), nodeRewrites);
    walker.walk(template);
    return walker;
  }

  @Test
  public void replacesNestedNodes() throws TemplateSyntaxException {
    walk("<form>{% if x %}{% csrf_token %}{% endif %}</form>");

    assertThat(nodeRewrites.size()).isEqualTo(1);
    assertThat(nodeRewrites.replacement(2)).hasValue("{{ csrf_input }}");
    assertThat(nodeRewrites.replacement(1)).isEmpty();
  }

  @Test
  public void walksEveryBranch() throws TemplateSyntaxException {
    walk("{% if a %}{% csrf_token %}{% elif b %}{% csrf_token %}{% else %}{% csrf_token %}"
        + "{% endif %}{% for x in y %}{% empty %}{% csrf_token %}{% endfor %}");

    assertThat(nodeRewrites.size()).isEqualTo(4);
  }

  @Test
  public void reportsUnknownKinds() throws TemplateSyntaxException {
    NodeWalker walker =
        walk("{% cache 500 s %}{% verbatim a %}x{% endverbatim a %}{% endcache %}{% compress %}");

    assertThat(walker.unknownNodeKinds()).containsExactly("cache");
  }

  @Test
  public void replacesBothTagsOfNamedVerbatim() throws TemplateSyntaxException {
    walk("{% verbatim a %}{% if %}{% endverbatim a %}");

    assertThat(nodeRewrites.replacement(0)).hasValue("{% raw %}");
    assertThat(nodeRewrites.replacement(1)).isEmpty();
    assertThat(nodeRewrites.replacement(2)).hasValue("{% endraw %}");
  }

  @Test
  public void collectsWarnings() throws TemplateSyntaxException {
    NodeWalker walker = walk("{% include \"a.html\" only %}");

    assertThat(walker.warnings()).hasSize(1);
    assertThat(walker.warnings().get(0)).contains("'only' is dropped");
    assertThat(walker.warnings().get(0)).endsWith("{% include \"a.html\" only %}");
    assertThat(nodeRewrites.replacement(0)).hasValue("{% include \"a.html\" %}");
  }

  @Test
  public void customNodeRules() throws TemplateSyntaxException {
    ConversionRules rules = ConversionRules.defaults();
    ImmutableList<Token> tokens = new Lexer("/test/page.html", "{% csrf_token %}").tokenize();
    Nodes.Template template =
        new Parser("/test/page.html", tokens, rules.libraries(), (t, e, s) -> {}).parse();

    new NodeWalker(
            tokens,
            new StandardNodeRules(rules) {
              @Override
              public NodeRewrite apply(Nodes.CsrfToken node) {
                return NodeRewrite.replace("{{ csrf_token }}");
              }
            },
            nodeRewrites)
        .walk(template);

    assertThat(nodeRewrites.replacement(0)).hasValue("{{ csrf_token }}");
  }
}
