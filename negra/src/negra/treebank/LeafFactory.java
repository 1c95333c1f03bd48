package negra.treebank;

import negra.syntax.Tree;

/**
 * Builds the leaf payload for a terminal token.
 *
 * @param <L> the leaf payload type
 */
public interface LeafFactory<L> {
  /**
   * @param gridLine index of the token in the sentence's token stream
   * @param token the terminal token
   * @param ancestor the part-of-speech node the leaf will hang under
   */
  public L build(int gridLine, Token token, Tree<L> ancestor);
}
