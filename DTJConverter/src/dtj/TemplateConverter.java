package dtj;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

public class TemplateConverter {
  private static final Logger logger = LogManager.getLogger(TemplateConverter.class);

  private final ConversionRules rules;
  private final ASTFunction<NodeRewrite> nodeRules;

  public TemplateConverter(ConversionRules rules) {
    this(rules, new StandardNodeRules(rules));
  }

  public TemplateConverter(ConversionRules rules, ASTFunction<NodeRewrite> nodeRules) {
    this.rules = rules;
    this.nodeRules = nodeRules;
  }

  public ConversionResult convert(String name, String source) throws TemplateSyntaxException {
    ImmutableList<Token> tokens = new Lexer(name, source).tokenize();

    RewriteMap rewriteMap = new RewriteMap();
    ExpressionCompiler compiler = new ExpressionCompiler(rules, rewriteMap);
    Nodes.Template template = new Parser(name, tokens, rules.libraries(), compiler).parse();

    NodeRewriteMap nodeRewrites = new NodeRewriteMap();
    NodeWalker walker = new NodeWalker(tokens, nodeRules, nodeRewrites);
    walker.walk(template);

    String output =
        new Reassembler(rules.literalOverrides()).reassemble(tokens, nodeRewrites, rewriteMap);
    logger.debug(
        "{}: {} tokens, {} tag replacements", name, tokens.size(), nodeRewrites.size());

    return ConversionResult.create(
        name,
        output,
        compiler.unknownFilters(),
        walker.unknownNodeKinds(),
        compiler.usedVariables(),
        ImmutableList.<String>builder()
            .addAll(compiler.warnings())
            .addAll(walker.warnings())
            .build());
  }
}
