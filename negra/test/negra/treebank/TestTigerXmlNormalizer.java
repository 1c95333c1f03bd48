package negra.treebank;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.w3c.dom.Element;

import negra.syntax.Atom;
import negra.syntax.Tree;

public class TestTigerXmlNormalizer {

  static String corpus(String... sentences) {
    StringBuilder sb = new StringBuilder();
    sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
    sb.append("<corpus id=\"test\"><head/><body>\n");
    for (String s : sentences)
      sb.append(s).append('\n');
    sb.append("</body></corpus>\n");
    return sb.toString();
  }

  static String vrootSentence =
      "<s id=\"s1\"><graph root=\"s1_VROOT\">" +
      "<terminals>" +
      "<t id=\"s1_1\" word=\"Peter\" lemma=\"Peter\" pos=\"NE\" morph=\"Nom.Sg.Masc\"/>" +
      "<t id=\"s1_2\" word=\"kam\" lemma=\"kommen\" pos=\"VVFIN\" morph=\"3.Sg.Past.Ind\"/>" +
      "<t id=\"s1_3\" word=\".\" lemma=\"--\" pos=\"$.\" morph=\"--\"/>" +
      "</terminals><nonterminals>" +
      "<nt id=\"s1_500\" cat=\"S\"><edge label=\"SB\" idref=\"s1_1\"/><edge label=\"HD\" idref=\"s1_2\"/></nt>" +
      "<nt id=\"s1_VROOT\" cat=\"VROOT\"><edge label=\"--\" idref=\"s1_500\"/><edge label=\"--\" idref=\"s1_3\"/></nt>" +
      "</nonterminals></graph></s>";

  static String renumberedSentence =
      "<s id=\"s3\"><graph root=\"s3_502\">" +
      "<terminals>" +
      "<t id=\"s3_1\" word=\"Sie\" lemma=\"sie\" pos=\"PPER\" morph=\"--\"/>" +
      "<t id=\"s3_2\" word=\"Kuchen\" lemma=\"Kuchen\" pos=\"NN\" morph=\"--\"/>" +
      "</terminals><nonterminals>" +
      "<nt id=\"s3_502\" cat=\"S\"><edge label=\"SB\" idref=\"s3_1\"/><edge label=\"OA\" idref=\"s3_X\"/></nt>" +
      "<nt id=\"s3_X\" cat=\"NP\"><edge label=\"NK\" idref=\"s3_2\"/></nt>" +
      "</nonterminals></graph></s>";

  static String secedgeSentence =
      "<s id=\"s4\"><graph root=\"s4_A\">" +
      "<terminals>" +
      "<t id=\"s4_1\" word=\"Peter\" lemma=\"Peter\" pos=\"NE\" morph=\"--\"><secedge label=\"SB\" idref=\"s4_B\"/></t>" +
      "<t id=\"s4_2\" word=\"kam\" lemma=\"kommen\" pos=\"VVFIN\" morph=\"--\"/>" +
      "<t id=\"s4_3\" word=\"und\" lemma=\"und\" pos=\"KON\" morph=\"--\"/>" +
      "<t id=\"s4_4\" word=\"ging\" lemma=\"gehen\" pos=\"VVFIN\" morph=\"--\"/>" +
      "</terminals><nonterminals>" +
      "<nt id=\"s4_C\" cat=\"S\"><edge label=\"SB\" idref=\"s4_1\"/><edge label=\"HD\" idref=\"s4_2\"/></nt>" +
      "<nt id=\"s4_B\" cat=\"S\"><edge label=\"HD\" idref=\"s4_4\"/></nt>" +
      "<nt id=\"s4_A\" cat=\"CS\"><edge label=\"CJ\" idref=\"s4_C\"/><edge label=\"CD\" idref=\"s4_3\"/>" +
      "<edge label=\"CJ\" idref=\"s4_B\"/></nt>" +
      "</nonterminals></graph></s>";

  static List<Element> sentences(String... s) throws IOException {
    return TigerXmlReader.readSentences(new StringReader(corpus(s)));
  }

  static List<Token> normalize(String s) throws IOException {
    return new TigerXmlNormalizer().normalize(sentences(s).get(0));
  }

  @Test
  public void testReadSentences() throws IOException {
    List<Element> sentences = sentences(vrootSentence, renumberedSentence);
    assertEquals(2, sentences.size());
    assertEquals("s1", sentences.get(0).getAttribute("id"));
    assertEquals("s3", sentences.get(1).getAttribute("id"));
  }

  @Test(expected = IOException.class)
  public void testBrokenXml() throws IOException {
    TigerXmlReader.readSentences(new StringReader("<corpus><body><s id=\"s1\">"));
  }

  @Test
  public void testVirtualRootIsDropped() throws IOException {
    List<Token> tokens = normalize(vrootSentence);
    assertEquals(4, tokens.size());
    assertEquals("Peter", tokens.get(0).getLabel());
    assertEquals("NE", tokens.get(0).getTag());
    assertEquals("Nom.Sg.Masc", tokens.get(0).getMorph());
    assertEquals("Peter", tokens.get(0).getLemma());
    assertEquals(500, tokens.get(0).getParent());
    assertEquals("SB", tokens.get(0).getEdge());
    // the punctuation hung under the virtual root and now hangs under the real one
    assertEquals(500, tokens.get(2).getParent());
    Token root = tokens.get(3);
    assertEquals("#500", root.getLabel());
    assertEquals("S", root.getTag());
    assertEquals(Token.ROOT, root.getParent());
    assertNull(root.getEdge());

    Tree<Atom> tree = NegraTreeBuilder.morph().build(tokens);
    assertEquals("(S (NE Peter) (VVFIN kam) ($. .))", tree.toString());
  }

  @Test
  public void testSingleVirtualRootIsKept() throws IOException {
    List<Token> tokens = normalize(
        "<s id=\"s2\"><graph root=\"s2_VROOT\"><terminals>" +
        "<t id=\"s2_1\" word=\"Ja\" pos=\"PTKANT\"/>" +
        "</terminals><nonterminals>" +
        "<nt id=\"s2_VROOT\" cat=\"VROOT\"><edge label=\"--\" idref=\"s2_1\"/></nt>" +
        "</nonterminals></graph></s>");
    assertEquals("#500", tokens.get(1).getLabel());
    assertNull(tokens.get(0).getLemma());
    assertEquals("(VROOT (PTKANT Ja))", NegraTreeBuilder.bare().build(tokens).toString());
  }

  @Test
  public void testIdsWithoutNumbersAreRenumbered() throws IOException {
    List<Token> tokens = normalize(renumberedSentence);
    assertEquals(4, tokens.size());
    assertEquals(502, tokens.get(0).getParent());
    assertEquals(503, tokens.get(1).getParent());
    assertEquals("#503", tokens.get(2).getLabel());
    assertEquals("OA", tokens.get(2).getEdge());
    // the root is listed first in the XML but comes last in the stream
    assertEquals("#502", tokens.get(3).getLabel());
    for (int i = 0; i < tokens.size(); i ++)
      assertEquals(i, tokens.get(i).getGridLine());
    assertEquals("(S (PPER Sie) (NP (NN Kuchen)))", NegraTreeBuilder.bare().build(tokens).toString());
  }

  @Test
  public void testNumberingStartsAt500() throws IOException {
    List<Token> tokens = normalize(secedgeSentence);
    // C, B and A in document order
    assertEquals("#500", tokens.get(4).getLabel());
    assertEquals("#501", tokens.get(5).getLabel());
    assertEquals("#502", tokens.get(6).getLabel());
    assertEquals(Integer.valueOf(501), tokens.get(0).getSecondary().get(0).getParent());
  }

  static NegraTreeBuilder<Atom> documentOrder() {
    return NegraTreeBuilder.morph(SecondaryEdgeMode.COPY, new TigerXmlNormalizer().getSecondaryEdgeOrder());
  }

  @Test
  public void testSecondaryEdges() throws IOException {
    assertEquals(SecondaryEdgeOrder.DOCUMENT, new TigerXmlNormalizer().getSecondaryEdgeOrder());
    Tree<Atom> tree = documentOrder().build(normalize(secedgeSentence));
    assertNotNull(tree);
    // the copy comes after the words the second conjunct already has
    assertEquals("(CS (S (NE Peter) (VVFIN kam)) (KON und) (S (VVFIN ging) (NE Peter)))", tree.toString());
    Tree<Atom> copy = tree.getChildren().get(2).getChildren().get(1);
    assertEquals("SB", copy.getEdge());
    assertEquals("SB", copy.getChildren().get(0).getLeaf().getEdge());
    assertTrue(copy.getChildren().get(0).getLeaf().isChildOf(copy));

    Tree<Atom> annotated = NegraTreeBuilder.morph(SecondaryEdgeMode.ANNOTATE).build(normalize(secedgeSentence));
    assertEquals("(CS (S (NE Peter) (VVFIN kam)) (KON und) (S (VVFIN ging)))", annotated.toString());
  }

  static String manySecedges =
      "<s id=\"s10\"><graph root=\"s10_503\">" +
      "<terminals>" +
      "<t id=\"s10_1\" word=\"a\" pos=\"A\"><secedge label=\"W\" idref=\"s10_502\"/></t>" +
      "<t id=\"s10_2\" word=\"b\" pos=\"B\"/>" +
      "<t id=\"s10_3\" word=\"c\" pos=\"C\"/>" +
      "</terminals><nonterminals>" +
      "<nt id=\"s10_500\" cat=\"X\"><edge label=\"HD\" idref=\"s10_1\"/>" +
      "<secedge label=\"L0\" idref=\"s10_502\"/></nt>" +
      "<nt id=\"s10_501\" cat=\"Y\"><edge label=\"HD\" idref=\"s10_2\"/>" +
      "<secedge label=\"L1\" idref=\"s10_502\"/></nt>" +
      "<nt id=\"s10_502\" cat=\"Z\"><edge label=\"HD\" idref=\"s10_3\"/></nt>" +
      "<nt id=\"s10_503\" cat=\"S\"><edge label=\"--\" idref=\"s10_500\"/>" +
      "<edge label=\"--\" idref=\"s10_501\"/><edge label=\"--\" idref=\"s10_502\"/></nt>" +
      "</nonterminals></graph></s>";

  @Test
  public void testSecondaryEdgesInDocumentOrder() throws IOException {
    Tree<Atom> tree = documentOrder().build(normalize(manySecedges));
    assertNotNull(tree);
    assertEquals("(S (X (A a)) (Y (B b)) (Z (C c) (A a) (X (A a)) (Y (B b))))", tree.toString());
    Tree<Atom> target = tree.getChildren().get(2);
    assertEquals("W", target.getChildren().get(1).getEdge());
    assertEquals("L0", target.getChildren().get(2).getEdge());
    assertEquals("L1", target.getChildren().get(3).getEdge());

    // read like an export grid, word copies come first and node copies root side first
    Tree<Atom> grid = NegraTreeBuilder.morph().build(normalize(manySecedges));
    assertEquals("(S (X (A a)) (Y (B b)) (Z (A a) (C c) (Y (B b)) (X (A a))))", grid.toString());
  }

  @Test
  public void testHashWordsAreWords() throws IOException {
    List<Token> tokens = normalize(
        "<s id=\"s9\"><graph root=\"s9_500\"><terminals>" +
        "<t id=\"s9_1\" word=\"Tag\" pos=\"NN\"/>" +
        "<t id=\"s9_2\" word=\"#\" pos=\"$.\"/>" +
        "<t id=\"s9_3\" word=\"#5\" pos=\"$.\"/>" +
        "</terminals><nonterminals>" +
        "<nt id=\"s9_500\" cat=\"S\"><edge label=\"HD\" idref=\"s9_1\"/>" +
        "<edge label=\"--\" idref=\"s9_2\"/><edge label=\"--\" idref=\"s9_3\"/></nt>" +
        "</nonterminals></graph></s>");
    assertFalse(tokens.get(1).isNonTerminal());
    assertFalse(tokens.get(2).isNonTerminal());
    assertNull(tokens.get(2).getNodeId());
    assertTrue(tokens.get(3).isNonTerminal());
    assertEquals(Arrays.asList("Tag", "#", "#5"), TokenProjections.words(tokens));

    Tree<Atom> tree = documentOrder().build(tokens);
    assertNotNull(tree);
    assertEquals("(S (NN Tag) ($. #) ($. #5))", tree.toString());
  }

  @Test
  public void testTerminalWithoutWord() throws IOException {
    String sentence =
        "<s id=\"s11\"><graph root=\"s11_500\"><terminals>" +
        "<t id=\"s11_1\" pos=\"NN\"/>" +
        "</terminals><nonterminals>" +
        "<nt id=\"s11_500\" cat=\"S\"><edge label=\"--\" idref=\"s11_1\"/></nt>" +
        "</nonterminals></graph></s>";
    assertNull(normalize(sentence));
    assertNull(NegraTreeBuilder.bare().build(normalize(sentence)));
  }

  @Test
  public void testNodeAttachedTwice() throws IOException {
    assertNull(normalize(
        "<s id=\"s5\"><graph root=\"s5_502\"><terminals>" +
        "<t id=\"s5_1\" word=\"a\" pos=\"A\"/>" +
        "</terminals><nonterminals>" +
        "<nt id=\"s5_501\" cat=\"X\"><edge label=\"--\" idref=\"s5_1\"/></nt>" +
        "<nt id=\"s5_502\" cat=\"S\"><edge label=\"--\" idref=\"s5_501\"/><edge label=\"--\" idref=\"s5_1\"/></nt>" +
        "</nonterminals></graph></s>"));
  }

  @Test
  public void testMalformedGraphs() throws IOException {
    // edge to a node that does not exist
    assertNull(normalize(
        "<s id=\"s6\"><graph root=\"s6_500\"><terminals>" +
        "<t id=\"s6_1\" word=\"a\" pos=\"A\"/>" +
        "</terminals><nonterminals>" +
        "<nt id=\"s6_500\" cat=\"S\"><edge label=\"--\" idref=\"s6_9\"/></nt>" +
        "</nonterminals></graph></s>"));
    // root that does not exist
    assertNull(normalize(
        "<s id=\"s7\"><graph root=\"s7_600\"><terminals>" +
        "<t id=\"s7_1\" word=\"a\" pos=\"A\"/>" +
        "</terminals><nonterminals>" +
        "<nt id=\"s7_500\" cat=\"S\"><edge label=\"--\" idref=\"s7_1\"/></nt>" +
        "</nonterminals></graph></s>"));
    // no graph at all
    assertNull(normalize("<s id=\"s8\"/>"));
  }

  @Test
  public void testVirtualRootIds() {
    assertTrue(TigerXmlNormalizer.isVirtualRoot("s1_VROOT"));
    assertTrue(TigerXmlNormalizer.isVirtualRoot("s1_vroot"));
    assertFalse(TigerXmlNormalizer.isVirtualRoot("s1_500"));
    assertFalse(TigerXmlNormalizer.isVirtualRoot("VROOT"));
  }
}
