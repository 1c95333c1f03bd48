package negra.treebank;

import java.util.List;

/**
 * Turns one sentence's raw representation into the canonical token stream.
 *
 * @param <S> the raw sentence type
 */
public interface TokenNormalizer<S> {
  /**
   * @return the tokens, terminals first and non-terminals after them, or
   *         <code>null</code> if the sentence is malformed
   */
  public List<Token> normalize(S sentence);

  /** the order in which the builder should copy this format's secondary edges */
  public SecondaryEdgeOrder getSecondaryEdgeOrder();
}
