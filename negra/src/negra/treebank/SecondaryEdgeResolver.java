package negra.treebank;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.javatuples.Pair;

import negra.syntax.NodeArena;
import negra.syntax.Tree;

/**
 * Unravels secondary edges by copying: the subtree at the source of the edge
 * is rebuilt node by node and leaf by leaf under the edge's parent, so that
 * the copy shares no node or leaf with the original tree.
 */
public class SecondaryEdgeResolver<L> {

  /**
   * @param tokens the sentence's token stream, indexed by grid line
   * @param leafFactory rebuilds the leaves of copied part-of-speech nodes
   * @param arena the arena the sentence's nodes live in
   */
  public SecondaryEdgeResolver(List<Token> tokens, LeafFactory<L> leafFactory, NodeArena<L> arena) {
    _tokens = tokens;
    _leafFactory = leafFactory;
    _arena = arena;
  }

  /**
   * Appends a copy of <code>source</code> as the last child of
   * <code>target</code>, with the copy attached by <code>label</code>.
   * When the source is a part-of-speech node the rebuilt leaf takes the
   * secondary edge as its own edge.
   *
   * @param targetId node id of <code>target</code>
   * @return the copy
   */
  public Tree<L> duplicate(Tree<L> source, String label, int targetId, Tree<L> target) {
    Tree<L> subtreeCopy = _arena.newNode(source.getLabel(), source.getGridLine());
    subtreeCopy.setEdge(label);
    // (copied parent, original child), breadth first
    Deque<Pair<Tree<L>, Tree<L>>> todo = new ArrayDeque<Pair<Tree<L>, Tree<L>>>();
    for (Tree<L> child : source.getChildren())
      todo.add(Pair.with(subtreeCopy, child));
    while (!todo.isEmpty()) {
      Pair<Tree<L>, Tree<L>> item = todo.poll();
      Tree<L> parentCopy = item.getValue0();
      Tree<L> current = item.getValue1();
      Tree<L> currentCopy;
      if (!current.isLeaf()) {
        currentCopy = _arena.newNode(current.getLabel(), current.getGridLine());
        currentCopy.setEdge(current.getEdge());
        for (Tree<L> child : current.getChildren())
          todo.add(Pair.with(currentCopy, child));
      } else {
        Token token = _tokens.get(parentCopy.getGridLine());
        if (parentCopy == subtreeCopy)
          token = token.asSecondaryCopy(label, targetId);
        currentCopy = Tree.newLeaf(_leafFactory.build(parentCopy.getGridLine(), token, parentCopy));
      }
      parentCopy.addChild(currentCopy);
    }
    target.addChild(subtreeCopy);
    return subtreeCopy;
  }

  private final List<Token> _tokens;
  private final LeafFactory<L> _leafFactory;
  private final NodeArena<L> _arena;
}
