package negra.treebank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.javatuples.Triplet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import negra.syntax.Atom;
import negra.syntax.NodeArena;
import negra.syntax.Tree;

/**
 * Builds a constituency tree from a sentence's canonical token stream.
 * <p>
 * The build runs in three phases over one {@link Build}:
 * <ol>
 * <li>the non-terminals are registered, root first (they are read in reverse
 *     order, the root being the last token); a second token with parent
 *     <code>0</code> is re-parented under the root;</li>
 * <li>the terminals are walked in surface order, each wrapped in a
 *     part-of-speech node and appended to its parent. Whenever the parent
 *     changes, the chunk just finished is closed: the ancestors of its parent
 *     are attached to their own parents, up to the root, unless already
 *     attached;</li>
 * <li>the remaining secondary edges are unravelled by copying.</li>
 * </ol>
 * The {@link SecondaryEdgeOrder} decides whether the secondary edges of
 * words are copied during the second phase or deferred to the third, and in
 * which order the copies of the third phase are made.
 * A malformed sentence yields <code>null</code>. A builder keeps no state
 * between sentences and may be shared between threads.
 */
public class NegraTreeBuilder<L> {

  private static final Logger logger = LoggerFactory.getLogger(NegraTreeBuilder.class);

  public NegraTreeBuilder(LeafFactory<L> leafFactory, SecondaryEdgeMode mode) {
    this(leafFactory, mode, false);
  }

  /**
   * @param strictRoot treat a second non-terminal with parent <code>0</code>
   *                   as malformed instead of re-parenting it under the root
   */
  public NegraTreeBuilder(LeafFactory<L> leafFactory, SecondaryEdgeMode mode, boolean strictRoot) {
    this(leafFactory, mode, strictRoot, SecondaryEdgeOrder.GRID);
  }

  /**
   * @param order when secondary edges are copied, usually
   *              {@link TokenNormalizer#getSecondaryEdgeOrder()} of the
   *              normalizer producing the token streams
   */
  public NegraTreeBuilder(LeafFactory<L> leafFactory, SecondaryEdgeMode mode, boolean strictRoot,
                          SecondaryEdgeOrder order) {
    if (leafFactory == null || mode == null || order == null)
      throw new IllegalArgumentException("leaf factory, secondary edge mode and order are required");
    _leafFactory = leafFactory;
    _mode = mode;
    _strictRoot = strictRoot;
    _order = order;
  }

  /** bare word leaves, secondary edges annotated in place */
  public static NegraTreeBuilder<String> bare() {
    return new NegraTreeBuilder<String>(new BareLeafFactory(), SecondaryEdgeMode.ANNOTATE);
  }

  /** {@link Atom} leaves, secondary edges unravelled by copying */
  public static NegraTreeBuilder<Atom> morph() {
    return morph(SecondaryEdgeMode.COPY);
  }

  public static NegraTreeBuilder<Atom> morph(SecondaryEdgeMode mode) {
    return new NegraTreeBuilder<Atom>(new AtomLeafFactory(), mode);
  }

  public static NegraTreeBuilder<Atom> morph(SecondaryEdgeMode mode, SecondaryEdgeOrder order) {
    return new NegraTreeBuilder<Atom>(new AtomLeafFactory(), mode, false, order);
  }

  public boolean isStrictRoot() {
    return _strictRoot;
  }

  /**
   * @param tokens a normalized token stream
   * @return the root node, or <code>null</code> if the sentence is malformed
   */
  public Tree<L> build(List<Token> tokens) {
    if (tokens == null)
      return null;
    Build build = new Build(tokens);
    if (!build.registerNonTerminals())
      return null;
    if (!build.attachTerminals())
      return null;
    if (!build.resolveSecondaryEdges())
      return null;
    return build.root();
  }

  private enum Phase {
    NEW, NONTERMINALS_REGISTERED, TERMINALS_ATTACHED, DONE
  }

  /** the state of building one sentence */
  private class Build {

    Build(List<Token> tokens) {
      _tokens = tokens;
      int count = 0;
      for (Token token : tokens) {
        if (token.isNonTerminal())
          count ++;
      }
      _numTerminals = tokens.size() - count;
      _resolver = new SecondaryEdgeResolver<L>(tokens, _leafFactory, _arena);
    }

    boolean registerNonTerminals() {
      enter(Phase.NEW);
      for (int lineno = _tokens.size() - 1; lineno >= _numTerminals; lineno --) {
        Token token = _tokens.get(lineno);
        Integer id = token.getNodeId();
        if (id == null)
          return malformed("internal node " + token.getLabel() + " has no numeric id");
        int parent = token.getParent();
        if (parent == Token.ROOT) {
          if (_root == null) {
            _root = id;
          } else if (_strictRoot) {
            return malformed("second root #" + id + " besides #" + _root);
          }
          parent = _root;
        }
        Tree<L> node = _arena.newNode(token.getTag(), lineno);
        if (id != _root.intValue())
          node.setEdge(token.getEdge());
        _nodes.put(id, node);
        _parents.put(id, parent);
        for (SecondaryEdge se : token.getSecondary()) {
          if (_mode == SecondaryEdgeMode.COPY) {
            if (se.getParent() == null)
              return malformed("secondary edge of #" + id + " has no parent id");
            _nodeCopies.add(Triplet.with(node, se.getLabel(), se.getParent()));
          } else {
            node.setSecondaryEdge(se.getLabel(), se.getParent());
            break;
          }
        }
      }
      if (_root == null)
        return malformed("no root");
      _phase = Phase.NONTERMINALS_REGISTERED;
      return true;
    }

    boolean attachTerminals() {
      enter(Phase.NONTERMINALS_REGISTERED);
      Integer lastParent = null;
      for (int lineno = 0; lineno < _numTerminals; lineno ++) {
        Token token = _tokens.get(lineno);
        // tokens outside the sentence tree go under the root
        int parent = resolve(token.getParent());
        Tree<L> parentNode = _nodes.get(parent);
        if (parentNode == null)
          return malformed("word " + lineno + " has unknown parent " + parent);

        // a chunk ends as soon as the parent changes
        if (lastParent != null && parent != lastParent.intValue()) {
          if (!closeChunk(lastParent))
            return false;
        }

        Tree<L> node = _arena.newNode(token.getTag(), lineno);
        node.setEdge(token.getEdge());
        node.addChild(Tree.newLeaf(_leafFactory.build(lineno, token, node)));
        parentNode.addChild(node);
        lastParent = parent;

        for (SecondaryEdge se : token.getSecondary()) {
          if (_mode == SecondaryEdgeMode.COPY) {
            if (se.getParent() == null)
              return malformed("secondary edge of word " + lineno + " has no parent id");
            Triplet<Tree<L>, String, Integer> copy = Triplet.with(node, se.getLabel(), se.getParent());
            if (_order == SecondaryEdgeOrder.DOCUMENT)
              _wordCopies.add(copy);
            else if (!duplicate(copy))
              return false;
          } else {
            node.setSecondaryEdge(se.getLabel(), se.getParent());
            break;
          }
        }
      }
      if (lastParent != null && !closeChunk(lastParent))
        return false;
      _phase = Phase.TERMINALS_ATTACHED;
      return true;
    }

    boolean resolveSecondaryEdges() {
      enter(Phase.TERMINALS_ATTACHED);
      List<Triplet<Tree<L>, String, Integer>> copies = new ArrayList<Triplet<Tree<L>, String, Integer>>(_wordCopies);
      // internal nodes were registered from the root side
      if (_order == SecondaryEdgeOrder.DOCUMENT)
        Collections.reverse(_nodeCopies);
      copies.addAll(_nodeCopies);
      for (Triplet<Tree<L>, String, Integer> copy : copies) {
        if (!duplicate(copy))
          return false;
      }
      _phase = Phase.DONE;
      return true;
    }

    /** appends a copy of (source, label, target id) under the target */
    private boolean duplicate(Triplet<Tree<L>, String, Integer> copy) {
      Tree<L> source = copy.getValue0();
      int target = resolve(copy.getValue2());
      Tree<L> targetNode = _nodes.get(target);
      if (targetNode == null)
        return malformed("secondary edge of line " + source.getGridLine() + " points to unknown node " + target);
      _resolver.duplicate(source, copy.getValue1(), target, targetNode);
      return true;
    }

    Tree<L> root() {
      enter(Phase.DONE);
      return _nodes.get(_root);
    }

    /**
     * Attaches <code>node</code> and its ancestors to their parents, up to the
     * root. Nodes already attached stay where they are.
     */
    private boolean closeChunk(int node) {
      int steps = 0;
      while (node != _root.intValue()) {
        Integer nodeParent = _parents.get(node);
        Tree<L> parentNode = nodeParent == null ? null : _nodes.get(nodeParent);
        if (parentNode == null)
          return malformed("#" + node + " has unknown parent " + nodeParent);
        Tree<L> child = _nodes.get(node);
        if (!parentNode.hasChild(child))
          parentNode.addChild(child);
        node = nodeParent;
        if (++steps > _nodes.size())
          return malformed("parent chain of #" + node + " does not reach the root");
      }
      return true;
    }

    private int resolve(int parent) {
      return parent == Token.ROOT ? _root : parent;
    }

    private void enter(Phase phase) {
      if (_phase != phase)
        throw new IllegalStateException("expected phase " + phase + " but was " + _phase);
    }

    private boolean malformed(String reason) {
      logger.debug("Malformed sentence: {}", reason);
      return false;
    }

    private final List<Token> _tokens;
    private final int _numTerminals;
    private final NodeArena<L> _arena = new NodeArena<L>();
    private final SecondaryEdgeResolver<L> _resolver;
    /** node id -> node */
    private final Map<Integer, Tree<L>> _nodes = new HashMap<Integer, Tree<L>>();
    /** node id -> parent node id */
    private final Map<Integer, Integer> _parents = new HashMap<Integer, Integer>();
    /** (node, label, parent id) of deferred secondary edges of words */
    private final List<Triplet<Tree<L>, String, Integer>> _wordCopies =
        new ArrayList<Triplet<Tree<L>, String, Integer>>();
    /** (node, label, parent id) of secondary edges of internal nodes, as registered */
    private final List<Triplet<Tree<L>, String, Integer>> _nodeCopies =
        new ArrayList<Triplet<Tree<L>, String, Integer>>();
    private Integer _root = null;
    private Phase _phase = Phase.NEW;
  }

  private final LeafFactory<L> _leafFactory;
  private final SecondaryEdgeMode _mode;
  private final boolean _strictRoot;
  private final SecondaryEdgeOrder _order;
}
