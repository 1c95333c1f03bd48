package negra.treebank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One record of a sentence's canonical token stream: a terminal (word) or a
 * non-terminal (internal node, label <code>#id</code>), with its primary
 * parent reference and any secondary edges.
 * <p>
 * A normalized stream has all terminals first, in surface order, followed by
 * all non-terminals, the sentence root last.
 */
public class Token {

  public static final String NONTERMINAL_MARKER = "#";
  /** parent id meaning "directly under the sentence root" */
  public static final int ROOT = 0;

  /**
   * @param nonTerminal whether the token is an internal node; its label is
   *                    then <code>#id</code>
   */
  public Token(String label, String tag, String morph, String lemma,
               int parent, String edge, List<SecondaryEdge> secondary,
               String comment, boolean nonTerminal, int gridLine) {
    _label = label;
    _tag = tag;
    _morph = morph;
    _lemma = lemma;
    _parent = parent;
    _edge = edge;
    _secondary = secondary == null || secondary.isEmpty()
        ? Collections.<SecondaryEdge>emptyList()
        : Collections.unmodifiableList(new ArrayList<SecondaryEdge>(secondary));
    _comment = comment;
    _nonTerminal = nonTerminal;
    _gridLine = gridLine;
  }

  public String getLabel() {
    return _label;
  }

  public String getTag() {
    return _tag;
  }

  public String getMorph() {
    return _morph;
  }

  public String getLemma() {
    return _lemma;
  }

  public int getParent() {
    return _parent;
  }

  public String getEdge() {
    return _edge;
  }

  public List<SecondaryEdge> getSecondary() {
    return _secondary;
  }

  public boolean hasSecondary() {
    return !_secondary.isEmpty();
  }

  /** label of the first secondary edge, or <code>null</code> */
  public String getSecedge() {
    return _secondary.isEmpty() ? null : _secondary.get(0).getLabel();
  }

  public String getComment() {
    return _comment;
  }

  public int getGridLine() {
    return _gridLine;
  }

  public boolean isNonTerminal() {
    return _nonTerminal;
  }

  /**
   * Decodes the node id of a non-terminal label.
   *
   * @return the id, or <code>null</code> if this is a terminal or the label
   *         carries no number
   */
  public Integer getNodeId() {
    if (!_nonTerminal || _label == null || !_label.startsWith(NONTERMINAL_MARKER))
      return null;
    try {
      return Integer.valueOf(_label.substring(NONTERMINAL_MARKER.length()));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** the same token re-positioned at another index of the stream */
  public Token atGridLine(int gridLine) {
    return new Token(_label, _tag, _morph, _lemma, _parent, _edge, _secondary, _comment, _nonTerminal, gridLine);
  }

  /**
   * The token as seen from the end of one of its secondary edges: the edge
   * becomes its primary attachment and it carries no secondary edges itself.
   */
  public Token asSecondaryCopy(String label, int parent) {
    return new Token(_label, _tag, _morph, _lemma, parent, label, null, "", _nonTerminal, _gridLine);
  }

  public String toString() {
    StringBuffer sb = new StringBuffer();
    sb.append(_gridLine).append(": ").append(_label).append(' ').append(_tag);
    sb.append(" ^").append(_parent);
    if (_edge != null)
      sb.append(' ').append(_edge);
    for (SecondaryEdge se : _secondary)
      sb.append(" +").append(se);
    return sb.toString();
  }

  private final String _label;
  private final String _tag;
  private final String _morph;
  private final String _lemma;
  private final int _parent;
  private final String _edge;
  private final List<SecondaryEdge> _secondary;
  private final String _comment;
  private final boolean _nonTerminal;
  private final int _gridLine;
}
