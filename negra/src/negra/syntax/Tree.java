package negra.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import negra.treebank.Trees;

/**
 * A node of a constituency tree built from a treebank sentence.
 * <p>
 * Internal nodes carry a category (or part of speech) label, the edge label
 * by which they attach to their parent and an ordered list of children.
 * Leaves carry a payload of type <code>L</code>, either the bare word or an
 * {@link Atom}. Internal nodes are created through a {@link NodeArena} and
 * receive a handle in it; leaves have no handle.
 *
 * @param <L> the leaf payload type
 */
public class Tree<L> {

  public static final int NO_HANDLE = -1;

  /** creates an internal node; only {@link NodeArena} calls this */
  Tree(NodeArena<L> arena, int handle, String label, int gridLine) {
    _arena = arena;
    _handle = handle;
    _label = label;
    _gridLine = gridLine;
    _leaf = null;
    _children = new ArrayList<Tree<L>>();
  }

  private Tree(L leaf) {
    _arena = null;
    _handle = NO_HANDLE;
    _label = String.valueOf(leaf);
    _leaf = leaf;
    _children = Collections.emptyList();
  }

  public static <L> Tree<L> newLeaf(L leaf) {
    if (leaf == null)
      throw new IllegalArgumentException("leaf payload must not be null");
    return new Tree<L>(leaf);
  }

  public String getLabel() {
    return _label;
  }

  /** the grammatical function by which this node attaches to its parent */
  public String getEdge() {
    return _edge;
  }

  public void setEdge(String edge) {
    _edge = edge;
  }

  /**
   * The secondary edge label of this node, only set when secondary edges are
   * annotated in place instead of being unravelled into copies.
   */
  public String getSecondaryEdge() {
    return _secondaryEdge;
  }

  /** the node id the secondary edge points to, or <code>null</code> */
  public Integer getSecondaryParent() {
    return _secondaryParent;
  }

  public void setSecondaryEdge(String label, Integer parent) {
    _secondaryEdge = label;
    _secondaryParent = parent;
  }

  /** index of the token this node was built from */
  public int getGridLine() {
    return _gridLine;
  }

  public int getHandle() {
    return _handle;
  }

  public L getLeaf() {
    return _leaf;
  }

  public List<Tree<L>> getChildren() {
    return Collections.unmodifiableList(_children);
  }

  public void addChild(Tree<L> child) {
    if (isLeaf())
      throw new UnsupportedOperationException("cannot add children to a leaf");
    _children.add(child);
  }

  /** true when <code>child</code> itself (not an equal tree) is a child of this node */
  public boolean hasChild(Tree<L> child) {
    for (Tree<L> c : _children) {
      if (c == child)
        return true;
    }
    return false;
  }

  public boolean isLeaf() {
    return _leaf != null;
  }

  public boolean isPreTerminal() {
    return _children.size() == 1 && _children.get(0).isLeaf();
  }

  /**
   * Looks up an internal node of the same sentence by its handle.
   *
   * @return the node, or <code>null</code> for leaves and unknown handles
   */
  public Tree<L> lookup(int handle) {
    if (_arena == null)
      return null;
    return _arena.get(handle);
  }

  /** resolves the node an {@link Atom} of this sentence hangs under */
  public Tree<L> parentOf(Atom atom) {
    return lookup(atom.getParentHandle());
  }

  public List<String> getYield() {
    List<String> yield = new ArrayList<String>();
    for (Tree<L> leaf : getLeafNodes())
      yield.add(leaf.getLabel());
    return yield;
  }

  public List<L> getLeaves() {
    List<L> leaves = new ArrayList<L>();
    for (Tree<L> leaf : getLeafNodes())
      leaves.add(leaf.getLeaf());
    return leaves;
  }

  public List<Tree<L>> getPreTerminals() {
    List<Tree<L>> pts = new ArrayList<Tree<L>>();
    collectPreTerminals(this, pts);
    return pts;
  }

  private List<Tree<L>> getLeafNodes() {
    List<Tree<L>> leaves = new ArrayList<Tree<L>>();
    collectLeafNodes(this, leaves);
    return leaves;
  }

  private static <L> void collectLeafNodes(Tree<L> tree, List<Tree<L>> leaves) {
    if (tree.isLeaf()) {
      leaves.add(tree);
      return;
    }
    for (Tree<L> child : tree._children)
      collectLeafNodes(child, leaves);
  }

  private static <L> void collectPreTerminals(Tree<L> tree, List<Tree<L>> pts) {
    if (tree.isLeaf())
      return;
    if (tree.isPreTerminal()) {
      pts.add(tree);
      return;
    }
    for (Tree<L> child : tree._children)
      collectPreTerminals(child, pts);
  }

  @Override
  public String toString() {
    return Trees.PennTreeRenderer.render(this);
  }

  private final NodeArena<L> _arena;
  private final int _handle;
  private final L _leaf;
  private final List<Tree<L>> _children;
  private final String _label;
  private String _edge = null;
  private String _secondaryEdge = null;
  private Integer _secondaryParent = null;
  private int _gridLine = -1;
}
