package negra.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Node arena: maintaining handle-to-node records for the internal nodes of
 * one sentence. Leaves refer to their parent through a handle into the arena
 * rather than through a reference of their own.
 */
public class NodeArena<L> {

  public NodeArena() {

  }

  /** creates a new internal node and registers it under the next free handle */
  public Tree<L> newNode(String label, int gridLine) {
    Tree<L> node = new Tree<L>(this, _nodes.size(), label, gridLine);
    _nodes.add(node);
    return node;
  }

  public Tree<L> get(int handle) {
    if (handle <= _nodes.size() - 1 && handle >= 0)
      return _nodes.get(handle);
    else
      return null;
  }

  public int size() {
    return _nodes.size();
  }

  private final List<Tree<L>> _nodes = new ArrayList<Tree<L>>();
}
