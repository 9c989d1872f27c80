package dtj;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import dtj.processor.ASTChild;
import dtj.processor.ASTNode;

public final class Nodes {

  @ASTNode
  public static class Template extends Node implements Nodes_Template_ASTNode {
    private final ImmutableList<Node> body;

    public Template(List<Node> body) {
      super(OptionalInt.empty());
      this.body = ImmutableList.copyOf(body);
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "template";
    }
  }

  @ASTNode
  public static class Text extends Node implements Nodes_Text_ASTNode {
    public Text(Token token) {
      super(token);
    }

    @Override
    public String kindName() {
      return "text";
    }
  }

  // {{ expression }}
  @ASTNode
  public static class Variable extends Node implements Nodes_Variable_ASTNode {
    private final FilterExpression expression;

    public Variable(Token token, FilterExpression expression) {
      super(token);
      this.expression = expression;
    }

    public FilterExpression expression() {
      return expression;
    }

    @Override
    public String kindName() {
      return "variable";
    }
  }

  @ASTNode
  public static class For extends Node implements Nodes_For_ASTNode {
    private final ImmutableList<String> loopVars;
    private final FilterExpression sequence;
    private final boolean reversed;
    private final ImmutableList<Node> loop;
    private final ImmutableList<Node> empty;

    public For(
        Token token,
        List<String> loopVars,
        FilterExpression sequence,
        boolean reversed,
        List<Node> loop,
        List<Node> empty) {
      super(token);
      this.loopVars = ImmutableList.copyOf(loopVars);
      this.sequence = sequence;
      this.reversed = reversed;
      this.loop = ImmutableList.copyOf(loop);
      this.empty = ImmutableList.copyOf(empty);
    }

    public ImmutableList<String> loopVars() {
      return loopVars;
    }

    public FilterExpression sequence() {
      return sequence;
    }

    public boolean reversed() {
      return reversed;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> loop() {
      return loop;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> empty() {
      return empty;
    }

    @Override
    public String kindName() {
      return "for";
    }
  }

  @ASTNode
  public static class If extends Node implements Nodes_If_ASTNode {
    private final ImmutableList<IfBranch> branches;

    public If(Token token, List<IfBranch> branches) {
      super(token);
      this.branches = ImmutableList.copyOf(branches);
    }

    @ASTChild
    @Override
    public ImmutableList<IfBranch> branches() {
      return branches;
    }

    public boolean hasElseBranch() {
      return branches.get(branches.size() - 1).isElse();
    }

    @Override
    public String kindName() {
      return "if";
    }
  }

  // One {% if %}, {% elif %} or {% else %} section.
  @ASTNode
  public static class IfBranch extends Node implements Nodes_IfBranch_ASTNode {
    private final ImmutableList<FilterExpression> operands;
    private final boolean isElse;
    private final ImmutableList<Node> body;

    public IfBranch(
        Token token, List<FilterExpression> operands, boolean isElse, List<Node> body) {
      super(token);
      this.operands = ImmutableList.copyOf(operands);
      this.isElse = isElse;
      this.body = ImmutableList.copyOf(body);
    }

    public ImmutableList<FilterExpression> operands() {
      return operands;
    }

    public boolean isElse() {
      return isElse;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return isElse ? "else" : "if branch";
    }
  }

  @ASTNode
  public static class Block extends Node implements Nodes_Block_ASTNode {
    private final String name;
    private final ImmutableList<Node> body;

    public Block(Token token, String name, List<Node> body) {
      super(token);
      this.name = name;
      this.body = ImmutableList.copyOf(body);
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "block";
    }
  }

  @ASTNode
  public static class Extends extends Node implements Nodes_Extends_ASTNode {
    private final FilterExpression parent;

    public Extends(Token token, FilterExpression parent) {
      super(token);
      this.parent = parent;
    }

    public FilterExpression parent() {
      return parent;
    }

    @Override
    public String kindName() {
      return "extends";
    }
  }

  @ASTNode
  public static class Include extends Node implements Nodes_Include_ASTNode {
    private final FilterExpression template;
    private final ImmutableMap<String, FilterExpression> extraContext;
    private final boolean isolatedContext;

    public Include(
        Token token,
        FilterExpression template,
        Map<String, FilterExpression> extraContext,
        boolean isolatedContext) {
      super(token);
      this.template = template;
      this.extraContext = ImmutableMap.copyOf(extraContext);
      this.isolatedContext = isolatedContext;
    }

    public FilterExpression template() {
      return template;
    }

    public ImmutableMap<String, FilterExpression> extraContext() {
      return extraContext;
    }

    // {% include ... only %}
    public boolean isolatedContext() {
      return isolatedContext;
    }

    @Override
    public String kindName() {
      return "include";
    }
  }

  @ASTNode
  public static class With extends Node implements Nodes_With_ASTNode {
    private final ImmutableMap<String, FilterExpression> extraContext;
    private final ImmutableList<Node> body;

    public With(Token token, Map<String, FilterExpression> extraContext, List<Node> body) {
      super(token);
      this.extraContext = ImmutableMap.copyOf(extraContext);
      this.body = ImmutableList.copyOf(body);
    }

    public ImmutableMap<String, FilterExpression> extraContext() {
      return extraContext;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "with";
    }
  }

  // {% filter lower|escape %}; the chain is parsed against a synthetic base variable.
  @ASTNode
  public static class Filter extends Node implements Nodes_Filter_ASTNode {
    private final FilterExpression filterExpression;
    private final ImmutableList<Node> body;

    public Filter(Token token, FilterExpression filterExpression, List<Node> body) {
      super(token);
      this.filterExpression = filterExpression;
      this.body = ImmutableList.copyOf(body);
    }

    public FilterExpression filterExpression() {
      return filterExpression;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "filter";
    }
  }

  @ASTNode
  public static class FirstOf extends Node implements Nodes_FirstOf_ASTNode {
    private final ImmutableList<FilterExpression> vars;
    private final Optional<String> asVar;

    public FirstOf(Token token, List<FilterExpression> vars, Optional<String> asVar) {
      super(token);
      this.vars = ImmutableList.copyOf(vars);
      this.asVar = asVar;
    }

    public ImmutableList<FilterExpression> vars() {
      return vars;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    @Override
    public String kindName() {
      return "firstof";
    }
  }

  @ASTNode
  public static class Url extends Node implements Nodes_Url_ASTNode {
    private final FilterExpression viewName;
    private final ImmutableList<FilterExpression> args;
    private final ImmutableMap<String, FilterExpression> kwargs;
    private final Optional<String> asVar;

    public Url(
        Token token,
        FilterExpression viewName,
        List<FilterExpression> args,
        Map<String, FilterExpression> kwargs,
        Optional<String> asVar) {
      super(token);
      this.viewName = viewName;
      this.args = ImmutableList.copyOf(args);
      this.kwargs = ImmutableMap.copyOf(kwargs);
      this.asVar = asVar;
    }

    public FilterExpression viewName() {
      return viewName;
    }

    public ImmutableList<FilterExpression> args() {
      return args;
    }

    public ImmutableMap<String, FilterExpression> kwargs() {
      return kwargs;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    @Override
    public String kindName() {
      return "url";
    }
  }

  @ASTNode
  public static class WidthRatio extends Node implements Nodes_WidthRatio_ASTNode {
    private final FilterExpression value;
    private final FilterExpression maxValue;
    private final FilterExpression maxWidth;
    private final Optional<String> asVar;

    public WidthRatio(
        Token token,
        FilterExpression value,
        FilterExpression maxValue,
        FilterExpression maxWidth,
        Optional<String> asVar) {
      super(token);
      this.value = value;
      this.maxValue = maxValue;
      this.maxWidth = maxWidth;
      this.asVar = asVar;
    }

    public FilterExpression value() {
      return value;
    }

    public FilterExpression maxValue() {
      return maxValue;
    }

    public FilterExpression maxWidth() {
      return maxWidth;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    @Override
    public String kindName() {
      return "widthratio";
    }
  }

  @ASTNode
  public static class AutoEscape extends Node implements Nodes_AutoEscape_ASTNode {
    private final boolean setting;
    private final ImmutableList<Node> body;

    public AutoEscape(Token token, boolean setting, List<Node> body) {
      super(token);
      this.setting = setting;
      this.body = ImmutableList.copyOf(body);
    }

    public boolean setting() {
      return setting;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "autoescape";
    }
  }

  @ASTNode
  public static class CsrfToken extends Node implements Nodes_CsrfToken_ASTNode {
    public CsrfToken(Token token) {
      super(token);
    }

    @Override
    public String kindName() {
      return "csrf_token";
    }
  }

  @ASTNode
  public static class Load extends Node implements Nodes_Load_ASTNode {
    private final ImmutableList<String> libraries;

    public Load(Token token, List<String> libraries) {
      super(token);
      this.libraries = ImmutableList.copyOf(libraries);
    }

    public ImmutableList<String> libraries() {
      return libraries;
    }

    @Override
    public String kindName() {
      return "load";
    }
  }

  // {% comment %} ... {% endcomment %}; the body is skipped, not parsed.
  @ASTNode
  public static class Comment extends Node implements Nodes_Comment_ASTNode {
    private final Optional<String> note;

    public Comment(Token token, Optional<String> note) {
      super(token);
      this.note = note;
    }

    public Optional<String> note() {
      return note;
    }

    @Override
    public String kindName() {
      return "comment";
    }
  }

  @ASTNode
  public static class Cycle extends Node implements Nodes_Cycle_ASTNode {
    private final ImmutableList<FilterExpression> values;
    private final Optional<String> asVar;
    private final boolean silent;

    public Cycle(
        Token token, List<FilterExpression> values, Optional<String> asVar, boolean silent) {
      super(token);
      this.values = ImmutableList.copyOf(values);
      this.asVar = asVar;
      this.silent = silent;
    }

    public ImmutableList<FilterExpression> values() {
      return values;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    public boolean silent() {
      return silent;
    }

    // {% cycle name %} advances a cycle defined earlier by {% cycle ... as name %}.
    public boolean isReference() {
      return values.isEmpty();
    }

    @Override
    public String kindName() {
      return "cycle";
    }
  }

  @ASTNode
  public static class Spaceless extends Node implements Nodes_Spaceless_ASTNode {
    private final ImmutableList<Node> body;

    public Spaceless(Token token, List<Node> body) {
      super(token);
      this.body = ImmutableList.copyOf(body);
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "spaceless";
    }
  }

  @ASTNode
  public static class Verbatim extends Node implements Nodes_Verbatim_ASTNode {
    private final Optional<String> name;
    private final ImmutableList<Node> body;
    private final int endTokenIndex;

    public Verbatim(Token token, Optional<String> name, List<Node> body, Token endToken) {
      super(token);
      this.name = name;
      this.body = ImmutableList.copyOf(body);
      this.endTokenIndex = endToken.index();
    }

    // {% verbatim name %} ... {% endverbatim name %}
    public Optional<String> name() {
      return name;
    }

    public int endTokenIndex() {
      return endTokenIndex;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return "verbatim";
    }
  }

  // {% templatetag openblock %}
  @ASTNode
  public static class TemplateTag extends Node implements Nodes_TemplateTag_ASTNode {
    private final String tagType;

    public TemplateTag(Token token, String tagType) {
      super(token);
      this.tagType = tagType;
    }

    public String tagType() {
      return tagType;
    }

    @Override
    public String kindName() {
      return "templatetag";
    }
  }

  @ASTNode
  public static class Static extends Node implements Nodes_Static_ASTNode {
    private final FilterExpression path;
    private final Optional<String> asVar;

    public Static(Token token, FilterExpression path, Optional<String> asVar) {
      super(token);
      this.path = path;
      this.asVar = asVar;
    }

    public FilterExpression path() {
      return path;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    @Override
    public String kindName() {
      return "static";
    }
  }

  // {% get_static_prefix %} and {% get_media_prefix %}.
  @ASTNode
  public static class Prefix extends Node implements Nodes_Prefix_ASTNode {
    private final String tagName;
    private final String setting;
    private final Optional<String> asVar;

    public Prefix(Token token, String tagName, String setting, Optional<String> asVar) {
      super(token);
      this.tagName = tagName;
      this.setting = setting;
      this.asVar = asVar;
    }

    public String setting() {
      return setting;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    @Override
    public String kindName() {
      return tagName;
    }
  }

  @ASTNode
  public static class Trans extends Node implements Nodes_Trans_ASTNode {
    private final FilterExpression message;
    private final Optional<FilterExpression> context;
    private final Optional<String> asVar;
    private final boolean noop;

    public Trans(
        Token token,
        FilterExpression message,
        Optional<FilterExpression> context,
        Optional<String> asVar,
        boolean noop) {
      super(token);
      this.message = message;
      this.context = context;
      this.asVar = asVar;
      this.noop = noop;
    }

    public FilterExpression message() {
      return message;
    }

    public Optional<FilterExpression> context() {
      return context;
    }

    public Optional<String> asVar() {
      return asVar;
    }

    public boolean noop() {
      return noop;
    }

    @Override
    public String kindName() {
      return "trans";
    }
  }

  // A tag with no dedicated node class: registered by a third-party library, or not registered
  // anywhere. Block-style custom tags own the body up to {% end<name> %}.
  @ASTNode
  public static class Custom extends Node implements Nodes_Custom_ASTNode {
    private final String tagName;
    private final boolean hasBody;
    private final ImmutableList<Node> body;

    public Custom(Token token, String tagName, boolean hasBody, List<Node> body) {
      super(token);
      this.tagName = tagName;
      this.hasBody = hasBody;
      this.body = ImmutableList.copyOf(body);
    }

    public String tagName() {
      return tagName;
    }

    public boolean hasBody() {
      return hasBody;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public String kindName() {
      return tagName;
    }
  }

  private Nodes() {}
}
