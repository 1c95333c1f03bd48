package negra.treebank;

import negra.syntax.Atom;
import negra.syntax.Tree;

/**
 * Leaves are {@link Atom}s carrying the token's tag, morphology, lemma and
 * edge annotation and the handle of the part-of-speech node above them.
 */
public class AtomLeafFactory implements LeafFactory<Atom> {
  public Atom build(int gridLine, Token token, Tree<Atom> ancestor) {
    return new Atom(token.getLabel(),
                    token.getTag(),
                    token.getMorph(),
                    token.getLemma(),
                    token.getEdge(),
                    token.getSecedge(),
                    token.getComment(),
                    gridLine,
                    ancestor.getHandle());
  }
}
