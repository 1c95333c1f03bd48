package negra.treebank;

/**
 * When copied secondary edges are appended to their targets.
 */
public enum SecondaryEdgeOrder {
  /**
   * Copies of words are appended while the words are attached, in surface
   * order. Copies of internal nodes follow once the tree is complete, root
   * side first. This is how Negra export grids are read.
   */
  GRID,
  /**
   * All copies are appended once the tree is complete: those of words first,
   * then those of internal nodes, each in stream order. This is how Tiger XML
   * documents are read.
   */
  DOCUMENT
}
