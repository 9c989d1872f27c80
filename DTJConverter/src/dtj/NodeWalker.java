package dtj;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

public class NodeWalker extends DefaultASTVisitor<Void> {
  private static final Logger logger = LogManager.getLogger(NodeWalker.class);

  private final ImmutableList<Token> tokens;
  private final ASTFunction<NodeRewrite> rules;
  private final NodeRewriteMap nodeRewrites;

  private final Set<String> unknownNodeKinds = new TreeSet<>();
  private final List<String> warnings = new ArrayList<>();

  public NodeWalker(
      ImmutableList<Token> tokens, ASTFunction<NodeRewrite> rules, NodeRewriteMap nodeRewrites) {
    this.tokens = tokens;
    this.rules = rules;
    this.nodeRewrites = nodeRewrites;
  }

  public void walk(Nodes.Template template) {
    template.accept(this, null);
  }

  public ImmutableSortedSet<String> unknownNodeKinds() {
    return ImmutableSortedSet.copyOf(unknownNodeKinds);
  }

  public ImmutableList<String> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  @Override
  protected Void visitNode(ASTNodeInterface astNode, Void value) {
    Node node = (Node) astNode;
    NodeRewrite rewrite = node.apply(rules);
    switch (rewrite.outcome()) {
      case REPLACE:
        Verify.verify(node.tokenIndex().isPresent(), "%s has no token to replace", node);
        nodeRewrites.record(node.tokenIndex().getAsInt(), rewrite.replacement());
        rewrite.otherReplacements().forEach(nodeRewrites::record);
        break;
      case UNKNOWN:
        unknownNodeKinds.add(node.kindName());
        break;
      case NONE:
        break;
    }

    for (String warning : rewrite.warnings()) {
      Token token = tokens.get(node.tokenIndex().getAsInt());
      String message = String.format("%s %s: %s", token.pos(), warning, token.source());
      logger.warn("{}", message);
      warnings.add(message);
    }
    return super.visitNode(astNode, value);
  }
}
