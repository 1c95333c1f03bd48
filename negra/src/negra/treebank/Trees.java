package negra.treebank;

import negra.syntax.Tree;
import negra.util.StringUtils;

/**
 * Tree renderers.
 */
public class Trees {

  /**
   * Renders a tree on one line in Penn Treebank bracketing,
   * <code>(S (NP (DET The) (N house)) (VP (V is) (ADJ red)) (. .))</code>.
   * Optionally the edge label is appended to each category,
   * <code>NP-SB</code>.
   */
  public static class PennTreeRenderer {
    public static String render(Tree<?> tree) {
      return render(tree, false);
    }
    public static String render(Tree<?> tree, boolean edges) {
      StringBuilder sb = new StringBuilder();
      renderTree(tree, edges, sb);
      return sb.toString();
    }
    private static void renderTree(Tree<?> tree, boolean edges, StringBuilder sb) {
      if (tree.isLeaf()) {
        sb.append(escape(tree.getLabel()));
        return;
      }
      sb.append("(");
      sb.append(category(tree, edges));
      for (Tree<?> child : tree.getChildren()) {
        sb.append(' ');
        renderTree(child, edges, sb);
      }
      sb.append(")");
    }
  }

  /** Renders a tree over several lines, one constituent per line, indented by depth. */
  public static class IndentedTreeRenderer {
    public static String render(Tree<?> tree, boolean edges) {
      StringBuilder sb = new StringBuilder();
      renderTree(tree, 0, edges, sb);
      return sb.toString();
    }
    private static void renderTree(Tree<?> tree, int indent, boolean edges,
                                   StringBuilder sb) {
      for (int i = 0; i < indent; i ++)
        sb.append("  ");
      if (tree.isLeaf()) {
        sb.append(escape(tree.getLabel()));
      } else if (tree.isPreTerminal()) {
        sb.append("(");
        sb.append(category(tree, edges));
        sb.append(" ");
        sb.append(escape(tree.getChildren().get(0).getLabel()));
        sb.append(")");
      } else {
        sb.append("(");
        sb.append(category(tree, edges));
        for (Tree<?> child : tree.getChildren()) {
          sb.append("\n");
          renderTree(child, indent + 1, edges, sb);
        }
        sb.append(")");
      }
    }
  }

  static String category(Tree<?> tree, boolean edges) {
    String label = escape(tree.getLabel());
    if (edges && !StringUtils.isBlank(tree.getEdge()))
      label += "-" + escape(tree.getEdge());
    return label;
  }

  static String escape(String s) {
    if (s == null || s.isEmpty())
      return "-EMPTY-";
    return s.replace(" ", "_")
            .replace("(", "-LPAR-")
            .replace(")", "-RPAR-");
  }
}
