package negra.treebank;

import java.util.ArrayList;
import java.util.List;

import org.javatuples.Pair;

/**
 * Word level views of a sentence's token stream. Internal nodes are left out.
 */
public class TokenProjections {

  public static List<String> words(List<Token> tokens) {
    List<String> words = new ArrayList<String>();
    for (Token token : tokens) {
      if (!token.isNonTerminal())
        words.add(token.getLabel());
    }
    return words;
  }

  /** (word, part of speech) pairs */
  public static List<Pair<String, String>> taggedWords(List<Token> tokens) {
    List<Pair<String, String>> pairs = new ArrayList<Pair<String, String>>();
    for (Token token : tokens) {
      if (!token.isNonTerminal())
        pairs.add(Pair.with(token.getLabel(), token.getTag()));
    }
    return pairs;
  }

  /** (word, lemma) pairs */
  public static List<Pair<String, String>> lemmatisedWords(List<Token> tokens) {
    List<Pair<String, String>> pairs = new ArrayList<Pair<String, String>>();
    for (Token token : tokens) {
      if (!token.isNonTerminal())
        pairs.add(Pair.with(token.getLabel(), token.getLemma()));
    }
    return pairs;
  }

  /** (word, morphological tag) pairs */
  public static List<Pair<String, String>> morphologicalWords(List<Token> tokens) {
    List<Pair<String, String>> pairs = new ArrayList<Pair<String, String>>();
    for (Token token : tokens) {
      if (!token.isNonTerminal())
        pairs.add(Pair.with(token.getLabel(), token.getMorph()));
    }
    return pairs;
  }
}
