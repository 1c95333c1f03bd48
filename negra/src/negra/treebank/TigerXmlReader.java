package negra.treebank;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads the sentence (<code>&lt;s&gt;</code>) elements of a Tiger XML
 * document, in document order.
 */
public class TigerXmlReader {

  public static List<Element> readSentences(File file) throws IOException {
    return readSentences(new InputSource(file.toURI().toString()));
  }

  public static List<Element> readSentences(InputStream in) throws IOException {
    return readSentences(new InputSource(in));
  }

  public static List<Element> readSentences(Reader in) throws IOException {
    return readSentences(new InputSource(in));
  }

  public static List<Element> readSentences(InputSource source) throws IOException {
    Document doc;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(false);
      factory.setValidating(false);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      doc = builder.parse(source);
    } catch (ParserConfigurationException e) {
      throw new IOException("cannot create an XML parser", e);
    } catch (SAXException e) {
      throw new IOException("malformed Tiger XML: " + e.getMessage(), e);
    }
    List<Element> sentences = new ArrayList<Element>();
    NodeList nodes = doc.getElementsByTagName("s");
    for (int i = 0; i < nodes.getLength(); i ++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE)
        sentences.add((Element) node);
    }
    return sentences;
  }
}
