package negra.treebank;

/**
 * How secondary edges end up in the built tree.
 */
public enum SecondaryEdgeMode {
  /** append an independent copy of the subtree under the secondary parent */
  COPY,
  /** keep the tree as is and record the first secondary edge on the node */
  ANNOTATE
}
