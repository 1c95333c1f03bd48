package negra.syntax;

/**
 * A leaf which acts like the bare word, but additionally carries the part of
 * speech, morphology, lemma and edge annotation of its token and the handle
 * of the part-of-speech node it hangs under.
 * <p>
 * The parent handle is for lookup only (see {@link Tree#parentOf(Atom)});
 * it does not keep the node alive and is never followed during traversal.
 */
public class Atom {

  public Atom(String word, String tag, String morph, String lemma,
              String edge, String secedge, String comment,
              int gridLine, int parentHandle) {
    _word = word;
    _tag = tag;
    _morph = morph;
    _lemma = lemma;
    _edge = edge;
    _secedge = secedge;
    _comment = comment;
    _gridLine = gridLine;
    _parentHandle = parentHandle;
  }

  public String getWord() {
    return _word;
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

  public String getEdge() {
    return _edge;
  }

  public void setEdge(String edge) {
    _edge = edge;
  }

  public String getSecedge() {
    return _secedge;
  }

  /** the raw secondary edge target, as written in the comment column */
  public String getComment() {
    return _comment;
  }

  public int getGridLine() {
    return _gridLine;
  }

  public int getParentHandle() {
    return _parentHandle;
  }

  /** true when <code>node</code> is the node this atom was built under */
  public boolean isChildOf(Tree<?> node) {
    return node != null && !node.isLeaf() && node.getHandle() == _parentHandle;
  }

  /** atoms compare like their words */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Atom)) return false;
    Atom that = (Atom) o;
    return _word != null ? _word.equals(that._word) : that._word == null;
  }

  @Override
  public int hashCode() {
    return _word != null ? _word.hashCode() : 0;
  }

  @Override
  public String toString() {
    return _word;
  }

  private final String _word;
  private final String _tag;
  private final String _morph;
  private final String _lemma;
  private String _edge;
  private final String _secedge;
  private final String _comment;
  private final int _gridLine;
  private final int _parentHandle;
}
