package negra.treebank;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import negra.util.StringUtils;

/**
 * Normalizes a Negra export grid (one sentence, one row of whitespace
 * separated columns per token) into the canonical token stream. Internal
 * node rows carry <code>#id</code> in the word column and follow the word
 * rows.
 *
 * <pre>
 * The         the         DET     500
 * house       house       N       500
 * is          be          V       501
 * red         red         ADJ     501
 * .           --          .       502
 * #500        --          NP      502
 * #501        --          VP      502
 * #502        --          S       0
 * </pre>
 */
public class NegraGridNormalizer implements TokenNormalizer<List<String[]>> {

  private static final Logger logger = LoggerFactory.getLogger(NegraGridNormalizer.class);

  private static final Pattern NODE_ID = Pattern.compile("\\d+");

  public NegraGridNormalizer() {
    this(ColumnType.DEFAULT_COLUMNS);
  }

  /**
   * @param columns the column types of the grid, in column order
   * @throws IllegalArgumentException if a column type is given twice
   */
  public NegraGridNormalizer(List<ColumnType> columns) {
    if (columns == null)
      columns = ColumnType.DEFAULT_COLUMNS;
    for (int i = 0; i < columns.size(); i ++) {
      ColumnType type = columns.get(i);
      if (type == null)
        throw new IllegalArgumentException("Column " + i + " has no type.");
      if (_colmap.containsKey(type))
        throw new IllegalArgumentException("Column " + type.columnName() + " is given twice.");
      _colmap.put(type, i);
    }
    _columns = Collections.unmodifiableList(new ArrayList<ColumnType>(columns));
  }

  /**
   * @param names column names such as <code>words</code> or <code>pos</code>
   * @throws IllegalArgumentException if a name is not a supported column
   */
  public static NegraGridNormalizer forColumnNames(List<String> names) {
    List<ColumnType> columns = new ArrayList<ColumnType>();
    for (String name : names)
      columns.add(ColumnType.fromName(name.trim()));
    return new NegraGridNormalizer(columns);
  }

  public static NegraGridNormalizer forColumnNames(String... names) {
    return forColumnNames(Arrays.asList(names));
  }

  public List<ColumnType> getColumns() {
    return _columns;
  }

  public boolean hasColumn(ColumnType type) {
    return _colmap.containsKey(type);
  }

  /**
   * @throws IllegalStateException if one of the columns is not configured
   */
  public void require(ColumnType... types) {
    for (ColumnType type : types) {
      if (!hasColumn(type))
        throw new IllegalStateException("This grid has no " + type.columnName() + " column.");
    }
  }

  /**
   * @return the column value, the empty string when the row is too short,
   *         or <code>null</code> when the column is not configured
   */
  public String column(String[] row, ColumnType type) {
    Integer idx = _colmap.get(type);
    if (idx == null)
      return null;
    return idx < row.length ? row[idx] : "";
  }

  @Override
  public SecondaryEdgeOrder getSecondaryEdgeOrder() {
    return SecondaryEdgeOrder.GRID;
  }

  @Override
  public List<Token> normalize(List<String[]> grid) {
    require(ColumnType.WORDS, ColumnType.POS, ColumnType.PARENT);
    List<Token> terminals = new ArrayList<Token>();
    List<Token> nonterminals = new ArrayList<Token>();
    for (String[] row : grid) {
      if (row.length == 0)
        continue;
      String parentStr = column(row, ColumnType.PARENT);
      int parent;
      try {
        parent = Integer.parseInt(parentStr);
      } catch (NumberFormatException e) {
        logger.debug("Malformed sentence: parent {} is not a node id in row [{}]",
            parentStr, StringUtils.join(Arrays.asList(row), " "));
        return null;
      }
      String secedge = column(row, ColumnType.SECEDGE);
      String comment = column(row, ColumnType.COMMENT);
      List<SecondaryEdge> secondary = null;
      if (secedge != null && !secedge.isEmpty())
        secondary = Collections.singletonList(new SecondaryEdge(secedge, parseNodeId(comment)));
      String word = column(row, ColumnType.WORDS);
      Token token = new Token(word,
                              column(row, ColumnType.POS),
                              column(row, ColumnType.MORPH),
                              column(row, ColumnType.LEMMA),
                              parent,
                              column(row, ColumnType.EDGE),
                              secondary,
                              comment,
                              word.startsWith(Token.NONTERMINAL_MARKER),
                              -1);
      if (token.isNonTerminal())
        nonterminals.add(token);
      else
        terminals.add(token);
    }
    List<Token> tokens = new ArrayList<Token>(terminals.size() + nonterminals.size());
    for (Token token : terminals)
      tokens.add(token.atGridLine(tokens.size()));
    for (Token token : nonterminals)
      tokens.add(token.atGridLine(tokens.size()));
    return tokens;
  }

  static Integer parseNodeId(String s) {
    if (s == null || !NODE_ID.matcher(s).matches())
      return null;
    try {
      return Integer.valueOf(s);
    } catch (NumberFormatException e) {
      // more digits than an int holds
      return null;
    }
  }

  private final EnumMap<ColumnType, Integer> _colmap = new EnumMap<ColumnType, Integer>(ColumnType.class);
  private final List<ColumnType> _columns;
}
