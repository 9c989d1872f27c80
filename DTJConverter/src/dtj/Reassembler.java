package dtj;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * Produces the converted template by replaying the original tokens. Each token starts from one
 * base text: its literal override, else its node replacement, else the token as written. Recorded
 * expression substitutions are then applied to node replacements and unchanged tokens.
 */
public class Reassembler {
  private static final String SYNTHETIC_FILTER_PREFIX =
      "{% filter " + Parser.SYNTHETIC_FILTER_BASE + "|";

  private final ImmutableMap<String, String> literalOverrides;

  public Reassembler(ImmutableMap<String, String> literalOverrides) {
    this.literalOverrides = literalOverrides;
  }

  public String reassemble(
      List<Token> tokens, NodeRewriteMap nodeRewrites, RewriteMap rewriteMap) {
    StringBuilder out = new StringBuilder();
    for (Token token : tokens) {
      out.append(reassemble(token, nodeRewrites, rewriteMap));
    }
    return out.toString();
  }

  String reassemble(Token token, NodeRewriteMap nodeRewrites, RewriteMap rewriteMap) {
    Optional<String> replacement = nodeRewrites.replacement(token.index());
    if (token.kind() == Token.Kind.BLOCK) {
      // A non-empty node replacement beats the override.
      String override = literalOverrides.get(token.contents());
      if (override != null && !replacement.filter(r -> !r.isEmpty()).isPresent()) {
        return override;
      }
    }

    String base = replacement.orElseGet(() -> token.source());
    String substituted = rewriteMap.applyTo(token.index(), base);
    return substituted.replace(SYNTHETIC_FILTER_PREFIX, "{% filter ");
  }
}
