package negra.treebank;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Normalizes a Tiger XML sentence element into the canonical token stream.
 * <p>
 * Non-terminal ids are rewritten into the Negra numbering: the number after
 * the last underscore of the id (<code>s12_503</code> becomes
 * <code>503</code>); ids without a number are numbered upwards from the
 * largest number seen, or from {@link #FIRST_NODE_ID}. A virtual root
 * (<code>s12_VROOT</code>) is dropped when the graph has other
 * non-terminals; its non-terminal child becomes the root and its other
 * children are attached to that root.
 */
public class TigerXmlNormalizer implements TokenNormalizer<Element> {

  private static final Logger logger = LoggerFactory.getLogger(TigerXmlNormalizer.class);

  public static final int FIRST_NODE_ID = 500;

  private static final Pattern ID_NUMBER = Pattern.compile("(?:^|_)(\\d+)$");

  @Override
  public SecondaryEdgeOrder getSecondaryEdgeOrder() {
    return SecondaryEdgeOrder.DOCUMENT;
  }

  @Override
  public List<Token> normalize(Element sentence) {
    Element graph = firstElement(sentence, "graph");
    if (graph == null)
      return malformed(sentence, "no graph");
    String vrootId = graph.getAttribute("root");
    List<Element> terminals = elements(graph, "t");
    List<Element> nonterminals = elements(graph, "nt");
    boolean skipVroot = isVirtualRoot(vrootId) && nonterminals.size() > 1;

    Set<String> terminalIds = new HashSet<String>();
    for (Element t : terminals)
      terminalIds.add(t.getAttribute("id"));

    Map<String, Integer> nodeIds = assignNodeIds(nonterminals, skipVroot ? vrootId : null);

    String rootId = skipVroot ? null : vrootId;
    if (skipVroot) {
      for (Element nt : nonterminals) {
        if (!nt.getAttribute("id").equals(vrootId))
          continue;
        for (Element edge : elements(nt, "edge")) {
          if (!terminalIds.contains(edge.getAttribute("idref")))
            rootId = edge.getAttribute("idref");
        }
      }
    }
    if (rootId == null || !nodeIds.containsKey(rootId))
      return malformed(sentence, "no root");
    int root = nodeIds.get(rootId);

    // child id -> (parent node id, edge label)
    Map<String, Pair<Integer, String>> incoming = new HashMap<String, Pair<Integer, String>>();
    for (Element nt : nonterminals) {
      String id = nt.getAttribute("id");
      boolean vroot = skipVroot && id.equals(vrootId);
      for (Element edge : elements(nt, "edge")) {
        String idref = edge.getAttribute("idref");
        if (vroot && idref.equals(rootId))
          continue;
        if (!terminalIds.contains(idref) && !nodeIds.containsKey(idref))
          return malformed(sentence, "edge to unknown node " + idref);
        // a constituent cannot be attached to two different parents
        if (incoming.containsKey(idref))
          return malformed(sentence, idref + " is attached twice");
        int parent = vroot ? root : nodeIds.get(id);
        incoming.put(idref, Pair.with(parent, attribute(edge, "label")));
      }
    }

    List<Token> tokens = new ArrayList<Token>();
    for (Element t : terminals) {
      if (!t.hasAttribute("word"))
        return malformed(sentence, "terminal " + t.getAttribute("id") + " has no word");
      Pair<Integer, String> in = incoming.get(t.getAttribute("id"));
      tokens.add(new Token(attribute(t, "word"),
                           attribute(t, "pos"),
                           attribute(t, "morph"),
                           attribute(t, "lemma"),
                           in == null ? Token.ROOT : in.getValue0(),
                           in == null ? null : in.getValue1(),
                           secondaryEdges(t, nodeIds),
                           null,
                           false,
                           tokens.size()));
    }
    Token rootToken = null;
    for (Element nt : nonterminals) {
      String id = nt.getAttribute("id");
      if (skipVroot && id.equals(vrootId))
        continue;
      Pair<Integer, String> in = incoming.get(id);
      boolean isRoot = id.equals(rootId);
      Token token = new Token(Token.NONTERMINAL_MARKER + nodeIds.get(id),
                              attribute(nt, "cat"),
                              null,
                              null,
                              isRoot || in == null ? Token.ROOT : in.getValue0(),
                              isRoot || in == null ? null : in.getValue1(),
                              secondaryEdges(nt, nodeIds),
                              null,
                              true,
                              -1);
      if (isRoot)
        rootToken = token;
      else
        tokens.add(token.atGridLine(tokens.size()));
    }
    // the root comes last, as in the Negra export format
    tokens.add(rootToken.atGridLine(tokens.size()));
    return tokens;
  }

  /** true for ids like <code>s12_VROOT</code> */
  static boolean isVirtualRoot(String id) {
    String[] parts = id.split("_");
    return parts.length > 1 && parts[1].equalsIgnoreCase("vroot");
  }

  static Map<String, Integer> assignNodeIds(List<Element> nonterminals, String skippedId) {
    Map<String, Integer> nodeIds = new HashMap<String, Integer>();
    int max = -1;
    for (Element nt : nonterminals) {
      String id = nt.getAttribute("id");
      Integer n = idNumber(id);
      if (n != null && !id.equals(skippedId))
        max = Math.max(max, n);
    }
    int next = max >= 0 ? max + 1 : FIRST_NODE_ID;
    for (Element nt : nonterminals) {
      String id = nt.getAttribute("id");
      if (id.equals(skippedId))
        continue;
      Integer n = idNumber(id);
      nodeIds.put(id, n != null ? n : next ++);
    }
    return nodeIds;
  }

  private static Integer idNumber(String id) {
    Matcher m = ID_NUMBER.matcher(id);
    if (!m.find())
      return null;
    return NegraGridNormalizer.parseNodeId(m.group(1));
  }

  private static List<SecondaryEdge> secondaryEdges(Element e, Map<String, Integer> nodeIds) {
    List<SecondaryEdge> secondary = new ArrayList<SecondaryEdge>();
    for (Element secedge : elements(e, "secedge"))
      secondary.add(new SecondaryEdge(attribute(secedge, "label"), nodeIds.get(secedge.getAttribute("idref"))));
    return secondary;
  }

  private static String attribute(Element e, String name) {
    return e.hasAttribute(name) ? e.getAttribute(name) : null;
  }

  private static Element firstElement(Element parent, String tag) {
    List<Element> found = elements(parent, tag);
    return found.isEmpty() ? null : found.get(0);
  }

  private static List<Element> elements(Element parent, String tag) {
    List<Element> found = new ArrayList<Element>();
    NodeList nodes = parent.getElementsByTagName(tag);
    for (int i = 0; i < nodes.getLength(); i ++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE)
        found.add((Element) node);
    }
    return found;
  }

  private static List<Token> malformed(Element sentence, String reason) {
    logger.debug("Malformed sentence {}: {}", sentence.getAttribute("id"), reason);
    return null;
  }
}
