package dtj;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class TemplateConverterTest {

  private final TemplateConverter converter = new TemplateConverter(ConversionRules.defaults());

  private ConversionResult convert(String source) throws TemplateSyntaxException {
    return converter.convert("page.html", source);
  }

  private void assertConverts(String source, String expected) throws TemplateSyntaxException {
    assertThat(convert(source).output()).isEqualTo(expected);
  }

  @Test
  public void accessorBecomesCall() throws TemplateSyntaxException {
    assertConverts("{{ user.get_full_name }}", "{{ request.user.get_full_name() }}");
  }

  @Test
  public void defaultFilter() throws TemplateSyntaxException {
    assertConverts("{{ value|default:\"x\" }}", "{{ value|default(\"x\", true) }}");
  }

  @Test
  public void csrfToken() throws TemplateSyntaxException {
    assertConverts("<form>{% csrf_token %}</form>", "<form>{{ csrf_input }}</form>");
  }

  @Test
  public void loadIsRemoved() throws TemplateSyntaxException {
    assertConverts("{% load somelib %}", "");
    assertConverts("{% load humanize %}\n<p></p>", "\n<p></p>");
  }

  @Test
  public void unknownFilterPassesThrough() throws TemplateSyntaxException {
    ConversionResult result = convert("{{ x|customfilter }}");

    assertThat(result.output()).isEqualTo("{{ x|customfilter }}");
    assertThat(result.unknownFilters()).containsExactly("customfilter");
  }

  @Test
  public void forEmpty() throws TemplateSyntaxException {
    assertConverts(
        "{% for item in list %}<li>{{ item }}</li>{% empty %}none{% endfor %}",
        "{% for item in list %}<li>{{ item }}</li>{% else %}none{% endfor %}");
  }

  @Test
  public void forReversed() throws TemplateSyntaxException {
    assertConverts(
        "{% for k, v in d.items reversed %}{{ k }}{% endfor %}",
        "{% for k, v in d.items()|reverse %}{{ k }}{% endfor %}");
  }

  @Test
  public void loopVariables() throws TemplateSyntaxException {
    assertConverts(
        "{% for x in y %}{% if forloop.first %}{{ forloop.counter }}{% endif %}{% endfor %}",
        "{% for x in y %}{% if loop.first %}{{ loop.index }}{% endif %}{% endfor %}");
  }

  @Test
  public void ifCondition() throws TemplateSyntaxException {
    assertConverts(
        "{% if user.is_authenticated and items.count > 0 %}yes{% endif %}",
        "{% if request.user.is_authenticated and items.count() > 0 %}yes{% endif %}");
  }

  @Test
  public void tightDelimiters() throws TemplateSyntaxException {
    assertConverts("{{user.name}}", "{{request.user.name}}");
  }

  @Test
  public void blockSuper() throws TemplateSyntaxException {
    assertConverts(
        "{% extends \"base.html\" %}{% block content %}{{ block.super }}more{% endblock %}",
        "{% extends \"base.html\" %}{% block content %}{{ super() }}more{% endblock %}");
  }

  @Test
  public void autoescape() throws TemplateSyntaxException {
    assertConverts(
        "{% autoescape off %}{{ body }}{% endautoescape %}",
        "{% autoescape false %}{{ body }}{% endautoescape %}");
  }

  @Test
  public void firstOf() throws TemplateSyntaxException {
    assertConverts(
        "{% firstof a b 'none' %}", "{{ a|default(b, true)|default(\"none\", true) }}");
    assertConverts("{% firstof a b as x %}", "{% set x = a|default(b, true) %}");
  }

  @Test
  public void firstOfWithOnlyTarget() throws TemplateSyntaxException {
    assertConverts("{% firstof as x %}{{ x }}", "{% set x = \"\" %}{{ x }}");
  }

  @Test
  public void url() throws TemplateSyntaxException {
    assertConverts(
        "<a href=\"{% url 'profile' user.pk page=2 %}\">",
        "<a href=\"{{ url(\"profile\", args=[request.user.pk], kwargs={\"page\": 2}) }}\">");
    assertConverts("{% url 'home' as home %}", "{% set home = url(\"home\") %}");
  }

  @Test
  public void widthRatio() throws TemplateSyntaxException {
    assertConverts(
        "{% widthratio this_value max_value 100 %}",
        "{{ ((this_value / max_value) * 100)|round|int }}");
  }

  @Test
  public void with() throws TemplateSyntaxException {
    assertConverts(
        "{% with total=items.count %}{{ total }}{% endwith %}",
        "{% with total = items.count() %}{{ total }}{% endwith %}");
  }

  @Test
  public void include() throws TemplateSyntaxException {
    assertConverts("{% include \"nav.html\" %}", "{% include \"nav.html\" %}");

    ConversionResult result = convert("{% include \"row.html\" with item=x only %}");
    assertThat(result.output())
        .isEqualTo("{% with item = x %}{% include \"row.html\" %}{% endwith %}");
    assertThat(result.warnings()).hasSize(1);
  }

  @Test
  public void staticTags() throws TemplateSyntaxException {
    assertConverts(
        "{% load static %}<link href=\"{% static 'site.css' %}\">",
        "<link href=\"{{ static(\"site.css\") }}\">");
    assertConverts(
        "{% load static %}{% get_static_prefix as prefix %}{{ prefix }}",
        "{% set prefix = STATIC_URL %}{{ prefix }}");
    assertConverts("{% load static %}{% get_media_prefix %}", "{{ MEDIA_URL }}");
  }

  @Test
  public void filterTag() throws TemplateSyntaxException {
    assertConverts(
        "{% filter lower|truncatechars:5 %}Some Text{% endfilter %}",
        "{% filter lower|truncate(5, true) %}Some Text{% endfilter %}");
  }

  @Test
  public void filterTagWithoutChainForm() throws TemplateSyntaxException {
    ConversionResult added = convert("{% filter add:1 %}x{% endfilter %}");
    assertThat(added.output()).isEqualTo("{% filter add:1 %}x{% endfilter %}");
    assertThat(added.warnings()).hasSize(1);
    assertThat(added.warnings().get(0)).contains("no Jinja2 filter tag form");

    ConversionResult sliced = convert("{% filter lower|slice:\":2\" %}x{% endfilter %}");
    assertThat(sliced.output()).isEqualTo("{% filter lower|slice:\":2\" %}x{% endfilter %}");
    assertThat(sliced.output()).doesNotContain("var");
    assertThat(sliced.warnings()).hasSize(1);
  }

  @Test
  public void cycle() throws TemplateSyntaxException {
    assertConverts(
        "{% for x in y %}<tr class=\"{% cycle 'odd' 'even' %}\">{% endfor %}",
        "{% for x in y %}<tr class=\"{{ loop.cycle(\"odd\", \"even\") }}\">{% endfor %}");
  }

  @Test
  public void cycleReference() throws TemplateSyntaxException {
    ConversionResult result =
        convert("{% for x in y %}{% cycle 'a' 'b' as c silent %}{% cycle c %}{% endfor %}");

    assertThat(result.output())
        .isEqualTo(
            "{% for x in y %}{% set c = loop.cycle(\"a\", \"b\") %}{% cycle c %}{% endfor %}");
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.unknownNodeKinds()).containsExactly("cycle");
  }

  @Test
  public void trans() throws TemplateSyntaxException {
    assertConverts("{% load i18n %}{% trans \"Hello\" %}", "{{ _(\"Hello\") }}");
    assertConverts(
        "{% load i18n %}{% trans \"May\" context \"month\" %}",
        "{{ pgettext(\"month\", \"May\") }}");
    assertConverts("{% load i18n %}{% trans \"x\" noop as y %}", "{% set y = \"x\" %}");
  }

  @Test
  public void comments() throws TemplateSyntaxException {
    assertConverts("{% comment %}{{ x }}{% endcomment %}", "{#{{ x }}#}");
    assertConverts("{% comment \"todo\" %}x{% endcomment %}", "{# \"todo\" x#}");
    assertConverts("{# short #}", "{# short #}");
  }

  @Test
  public void templateTag() throws TemplateSyntaxException {
    assertConverts("{% templatetag openblock %}", "{{ \"{%\" }}");
    assertConverts("{% templatetag openbrace %}", "{");
  }

  @Test
  public void verbatim() throws TemplateSyntaxException {
    assertConverts(
        "{% verbatim %}{{ user }}{% endverbatim %}", "{% raw %}{{ user }}{% endraw %}");

    ConversionResult named = convert("{% verbatim a %}{{ x }}{% endverbatim a %}");
    assertThat(named.output()).isEqualTo("{% raw %}{{ x }}{% endraw %}");
    assertThat(named.unknownNodeKinds()).isEmpty();
  }

  @Test
  public void passthroughTag() throws TemplateSyntaxException {
    ConversionResult result =
        convert("{% load compress %}{% compress css %}<link>{% endcompress %}");

    assertThat(result.output()).isEqualTo("{% compress css %}<link>{% endcompress %}");
    assertThat(result.unknownNodeKinds()).isEmpty();
  }

  @Test
  public void unknownTag() throws TemplateSyntaxException {
    ConversionResult result = convert("{% cache 500 sidebar %}{{ user }}{% endcache %}");

    assertThat(result.output())
        .isEqualTo("{% cache 500 sidebar %}{{ request.user }}{% endcache %}");
    assertThat(result.unknownNodeKinds()).containsExactly("cache");
  }

  @Test
  public void usedVariables() throws TemplateSyntaxException {
    ConversionResult result = convert("{{ title }}{% if user.email %}{{ user.name }}{% endif %}");

    assertThat(result.usedVariables()).containsExactly("title", "user.email", "user.name");
  }

  @Test
  public void syntaxError() {
    TemplateSyntaxException ex =
        assertThrows(TemplateSyntaxException.class, () -> convert("line\n{% if %}{% endif %}"));

    assertThat(ex.pos().file()).isEqualTo("page.html");
    assertThat(ex.pos().lineNumber()).isEqualTo(1);
  }

  @Test
  public void customRules() throws TemplateSyntaxException {
    ConversionRules rules =
        ConversionRules.builder()
            .addPathRule("^profile", "request.user.profile")
            .rewriteFilter("money", "{input}|currency({escaped})")
            .build();
    TemplateConverter custom = new TemplateConverter(rules);

    assertThat(custom.convert("a.html", "{{ profile.balance|money:'EUR' }}").output())
        .isEqualTo("{{ request.user.profile.balance|currency(\"EUR\") }}");
  }
}
