package negra.treebank;

/**
 * A secondary edge request of a token: the edge label and the id of the
 * additional parent. The parent is <code>null</code> when the annotation
 * names no usable node id.
 */
public class SecondaryEdge {

  public SecondaryEdge(String label, Integer parent) {
    _label = label;
    _parent = parent;
  }

  public String getLabel() {
    return _label;
  }

  public Integer getParent() {
    return _parent;
  }

  public String toString() {
    return _label + "->" + _parent;
  }

  private final String _label;
  private final Integer _parent;
}
