package negra.treebank;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Column types of the Negra export grid.
 */
public enum ColumnType {
  WORDS("words"),     // the word, or #id for internal nodes
  LEMMA("lemma"),
  POS("pos"),         // part of speech, or category for internal nodes
  MORPH("morph"),
  EDGE("edge"),       // grammatical function
  PARENT("parent"),   // id of the parent node, 0 for the sentence root
  SECEDGE("secedge"), // optional secondary grammatical function
  COMMENT("comment"); // editor comment, holds the secondary edge's parent

  /** words lemma pos morph edge parent secedge comment */
  public static final List<ColumnType> DEFAULT_COLUMNS =
      Collections.unmodifiableList(Arrays.asList(values()));

  ColumnType(String name) {
    _name = name;
  }

  public String columnName() {
    return _name;
  }

  public static ColumnType fromName(String name) {
    for (ColumnType type : values()) {
      if (type._name.equals(name))
        return type;
    }
    throw new IllegalArgumentException("Column " + name + " is not supported.");
  }

  private final String _name;
}
