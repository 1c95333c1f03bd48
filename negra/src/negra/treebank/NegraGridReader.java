package negra.treebank;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Splits a Negra export stream into sentence grids. A sentence starts at a
 * line matching the beginning-of-sentence pattern and ends before the line
 * matching the end-of-sentence pattern (or at the end of the stream). Lines
 * outside sentences, such as <code>%%</code> header comments, are skipped.
 */
public class NegraGridReader implements Iterator<List<String[]>> {

  public static final String DEFAULT_BOS = "#BOS.+$";
  public static final String DEFAULT_EOS = "#EOS.+$";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public NegraGridReader(Reader in) {
    this(in, DEFAULT_BOS, DEFAULT_EOS);
  }

  /**
   * @param bos pattern of the line opening a sentence, matched at line start
   * @param eos pattern of the line closing a sentence, matched at line start
   * @throws java.util.regex.PatternSyntaxException if a pattern is invalid
   */
  public NegraGridReader(Reader in, String bos, String eos) {
    _br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    _bos = Pattern.compile(bos);
    _eos = Pattern.compile(eos);
  }

  /**
   * Reads the next sentence grid.
   *
   * @return the rows of the sentence, each split on whitespace, or
   *         <code>null</code> at the end of the stream
   */
  public List<String[]> readGrid() throws IOException {
    String line = null;
    // scan to the next beginning of sentence
    while ((line = _br.readLine()) != null) {
      if (_bos.matcher(line).lookingAt())
        break;
    }
    if (line == null)
      return null;
    _lastSentenceId = sentenceId(line);
    List<String[]> grid = new ArrayList<String[]>();
    while ((line = _br.readLine()) != null) {
      if (_eos.matcher(line).lookingAt())
        break;
      String trimmed = line.trim();
      if (trimmed.isEmpty())
        continue;
      grid.add(WHITESPACE.split(trimmed));
    }
    return grid;
  }

  /** the id on the beginning-of-sentence line of the last grid read */
  public String getSentenceId() {
    return _lastSentenceId;
  }

  public boolean hasNext() {
    advance();
    return _next != null;
  }

  public List<String[]> next() {
    advance();
    if (_next == null)
      throw new NoSuchElementException();
    List<String[]> grid = _next;
    _next = null;
    return grid;
  }

  public void remove() {
    throw new UnsupportedOperationException();
  }

  public void close() throws IOException {
    _br.close();
  }

  private void advance() {
    if (_next != null || _exhausted)
      return;
    try {
      _next = readGrid();
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    if (_next == null)
      _exhausted = true;
  }

  private static String sentenceId(String bosLine) {
    String[] fields = WHITESPACE.split(bosLine.trim());
    return fields.length > 1 ? fields[1] : null;
  }

  private final BufferedReader _br;
  private final Pattern _bos;
  private final Pattern _eos;
  private List<String[]> _next = null;
  private boolean _exhausted = false;
  private String _lastSentenceId = null;
}
