package dtj;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;

/**
 * Django to Jinja2 translations of whole tags. Expressions are written back in their Django
 * spelling; the reassembler replaces them with their compiled form.
 */
public class StandardNodeRules implements ASTFunction<NodeRewrite> {
  private static final Joiner COMMA = Joiner.on(", ");

  private final ImmutableSet<String> passthroughTags;

  public StandardNodeRules(ConversionRules rules) {
    this.passthroughTags = rules.passthroughTags();
  }

  private static String sources(List<FilterExpression> expressions) {
    return expressions.stream().map(FilterExpression::source).collect(Collectors.joining(", "));
  }

  // {{ value }}, or {% set name = value %}
  private static String output(String value, Optional<String> asVar) {
    return asVar.isPresent()
        ? String.format("{%% set %s = %s %%}", asVar.get(), value)
        : String.format("{{ %s }}", value);
  }

  private static String bindings(Map<String, FilterExpression> context) {
    return COMMA.join(
        context
            .entrySet()
            .stream()
            .map(e -> e.getKey() + " = " + e.getValue().source())
            .collect(Collectors.toList()));
  }

  @Override
  public NodeRewrite apply(Nodes.Template node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Text node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Variable node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.For node) {
    if (!node.reversed()) {
      return NodeRewrite.none();
    }
    return NodeRewrite.replace(
        String.format(
            "{%% for %s in %s|reverse %%}",
            COMMA.join(node.loopVars()),
            node.sequence().source()));
  }

  @Override
  public NodeRewrite apply(Nodes.If node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.IfBranch node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Block node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Extends node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Include node) {
    String include = String.format("{%% include %s %%}", node.template().source());
    if (!node.extraContext().isEmpty()) {
      include =
          String.format(
              "{%% with %s %%}%s{%% endwith %%}", bindings(node.extraContext()), include);
    }

    NodeRewrite rewrite = NodeRewrite.replace(include);
    if (node.isolatedContext()) {
      rewrite =
          rewrite.withWarning(
              "'only' is dropped; the included template sees the whole context");
    }
    return rewrite;
  }

  @Override
  public NodeRewrite apply(Nodes.With node) {
    return NodeRewrite.replace(
        String.format("{%% with %s %%}", bindings(node.extraContext())));
  }

  @Override
  public NodeRewrite apply(Nodes.Filter node) {
    return NodeRewrite.replace(
        String.format("{%% filter %s %%}", node.filterExpression().source()));
  }

  @Override
  public NodeRewrite apply(Nodes.FirstOf node) {
    // {% firstof as x %} renders nothing.
    if (node.vars().isEmpty()) {
      return NodeRewrite.replace(output("\"\"", node.asVar()));
    }
    StringBuilder value = new StringBuilder(node.vars().get(0).source());
    for (FilterExpression fallback : node.vars().subList(1, node.vars().size())) {
      value.append("|default(").append(fallback.source()).append(", true)");
    }
    return NodeRewrite.replace(output(value.toString(), node.asVar()));
  }

  @Override
  public NodeRewrite apply(Nodes.Url node) {
    StringBuilder call = new StringBuilder("url(").append(node.viewName().source());
    if (!node.args().isEmpty()) {
      call.append(", args=[").append(sources(node.args())).append("]");
    }
    if (!node.kwargs().isEmpty()) {
      call.append(", kwargs={")
          .append(
              COMMA.join(
                  node.kwargs()
                      .entrySet()
                      .stream()
                      .map(e -> "\"" + e.getKey() + "\": " + e.getValue().source())
                      .collect(Collectors.toList())))
          .append("}");
    }
    call.append(")");
    return NodeRewrite.replace(output(call.toString(), node.asVar()));
  }

  @Override
  public NodeRewrite apply(Nodes.WidthRatio node) {
    String value =
        String.format(
            "((%s / %s) * %s)|round|int",
            node.value().source(),
            node.maxValue().source(),
            node.maxWidth().source());
    return NodeRewrite.replace(output(value, node.asVar()));
  }

  @Override
  public NodeRewrite apply(Nodes.AutoEscape node) {
    return NodeRewrite.replace(
        String.format("{%% autoescape %s %%}", node.setting() ? "true" : "false"));
  }

  @Override
  public NodeRewrite apply(Nodes.CsrfToken node) {
    return NodeRewrite.replace("{{ csrf_input }}");
  }

  @Override
  public NodeRewrite apply(Nodes.Load node) {
    return NodeRewrite.replace("");
  }

  @Override
  public NodeRewrite apply(Nodes.Comment node) {
    // A bare {% comment %} is covered by the literal overrides.
    if (!node.note().isPresent()) {
      return NodeRewrite.none();
    }
    return NodeRewrite.replace("{# " + node.note().get() + " ");
  }

  @Override
  public NodeRewrite apply(Nodes.Cycle node) {
    if (node.isReference()) {
      return NodeRewrite.unknown()
          .withWarning("named cycle references have no Jinja2 equivalent");
    }

    String cycle = String.format("loop.cycle(%s)", sources(node.values()));
    if (!node.asVar().isPresent()) {
      return NodeRewrite.replace(output(cycle, Optional.empty()));
    }
    String set = output(cycle, node.asVar());
    return NodeRewrite.replace(
        node.silent() ? set : set + output(node.asVar().get(), Optional.empty()));
  }

  @Override
  public NodeRewrite apply(Nodes.Spaceless node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Verbatim node) {
    // The unnamed form is covered by the literal overrides.
    if (!node.name().isPresent()) {
      return NodeRewrite.none();
    }
    return NodeRewrite.replace("{% raw %}").alsoReplacing(node.endTokenIndex(), "{% endraw %}");
  }

  @Override
  public NodeRewrite apply(Nodes.TemplateTag node) {
    return NodeRewrite.none();
  }

  @Override
  public NodeRewrite apply(Nodes.Static node) {
    return NodeRewrite.replace(
        output(String.format("static(%s)", node.path().source()), node.asVar()));
  }

  @Override
  public NodeRewrite apply(Nodes.Prefix node) {
    return NodeRewrite.replace(output(node.setting(), node.asVar()));
  }

  @Override
  public NodeRewrite apply(Nodes.Trans node) {
    String message = node.message().source();
    String value;
    if (node.noop()) {
      value = message;
    } else if (node.context().isPresent()) {
      value = String.format("pgettext(%s, %s)", node.context().get().source(), message);
    } else {
      value = String.format("_(%s)", message);
    }
    return NodeRewrite.replace(output(value, node.asVar()));
  }

  @Override
  public NodeRewrite apply(Nodes.Custom node) {
    return passthroughTags.contains(node.tagName()) ? NodeRewrite.none() : NodeRewrite.unknown();
  }
}
