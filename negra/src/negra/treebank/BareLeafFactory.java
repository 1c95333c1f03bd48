package negra.treebank;

import negra.syntax.Tree;

/** Leaves are the bare words; all other annotation is dropped. */
public class BareLeafFactory implements LeafFactory<String> {
  public String build(int gridLine, Token token, Tree<String> ancestor) {
    return token.getLabel();
  }
}
