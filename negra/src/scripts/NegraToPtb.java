package scripts;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import negra.syntax.Atom;
import negra.syntax.Tree;
import negra.treebank.AtomLeafFactory;
import negra.treebank.NegraGridNormalizer;
import negra.treebank.NegraGridReader;
import negra.treebank.NegraTreeBuilder;
import negra.treebank.SecondaryEdgeMode;
import negra.treebank.TigerXmlNormalizer;
import negra.treebank.TigerXmlReader;
import negra.treebank.Token;
import negra.treebank.Trees;
import negra.util.StringUtils;

/**
 * Converts a Negra export or Tiger XML treebank into one bracketed tree per
 * sentence, each preceded by a <code>#id</code> line. Malformed sentences are
 * skipped.
 */
public class NegraToPtb {

  private static final Logger logger = LoggerFactory.getLogger(NegraToPtb.class);

  private static final String USAGE = "NegraToPtb [options] <treebank file>";

  public static Options options() {
    Options options = new Options();
    options.addOption("e", false, "append edge labels to categories");
    options.addOption("p", false, "pretty print, one constituent per line");
    options.addOption(OptionBuilder.withArgName("negra|tiger").hasArg()
        .withDescription("input format (default negra)").create("f"));
    options.addOption(OptionBuilder.withArgName("columns").hasArg()
        .withDescription("comma separated grid columns (default words,lemma,pos,morph,edge,parent,secedge,comment)").create("c"));
    options.addOption(OptionBuilder.withArgName("copy|annotate").hasArg()
        .withDescription("secondary edge handling (default copy)").create("s"));
    options.addOption(OptionBuilder.withArgName("file").hasArg()
        .withDescription("output file (default stdout)").create("o"));
    options.addOption(OptionBuilder.withLongOpt("encoding").withArgName("charset").hasArg()
        .withDescription("input encoding (default UTF-8)").create());
    options.addOption(OptionBuilder.withLongOpt("strict-root")
        .withDescription("reject sentences with more than one root").create());
    return options;
  }

  public static void main(String [] args) {
    Options options = options();
    CommandLine cmd = null;
    try {
      CommandLineParser parser = new PosixParser();
      cmd = parser.parse(options, args);
    } catch (ParseException ex) {
      System.err.println(ex.getMessage());
      new HelpFormatter().printHelp(USAGE, options);
      System.exit(1);
    }
    if (cmd.getArgs().length != 1) {
      new HelpFormatter().printHelp(USAGE, options);
      System.exit(1);
    }
    try {
      Pair<Integer, Integer> counts = run(cmd, new File(cmd.getArgs()[0]));
      logger.info("{} trees converted, {} malformed sentences skipped.", counts.getValue0(), counts.getValue1());
    } catch (IllegalArgumentException ex) {
      System.err.println(ex.getMessage());
      System.exit(1);
    } catch (IOException ex) {
      logger.error("Conversion of " + cmd.getArgs()[0] + " failed", ex);
      System.exit(1);
    }
  }

  /**
   * @return (trees written, sentences skipped)
   * @throws IllegalArgumentException on invalid option values
   */
  public static Pair<Integer, Integer> run(CommandLine cmd, File input) throws IOException {
    String format = cmd.getOptionValue("f", "negra");
    SecondaryEdgeMode mode = parseMode(cmd.getOptionValue("s", "copy"));
    boolean strictRoot = cmd.hasOption("strict-root");
    boolean edges = cmd.hasOption("e");
    boolean pretty = cmd.hasOption("p");
    Charset charset = Charset.forName(cmd.getOptionValue("encoding", "UTF-8"));

    Writer out = cmd.hasOption("o")
        ? new OutputStreamWriter(new FileOutputStream(cmd.getOptionValue("o")), "UTF-8")
        : new OutputStreamWriter(System.out, "UTF-8");
    BufferedWriter bw = new BufferedWriter(out);
    try {
      if (format.equals("negra")) {
        NegraGridNormalizer normalizer = cmd.hasOption("c")
            ? NegraGridNormalizer.forColumnNames(StringUtils.splitList(cmd.getOptionValue("c")))
            : new NegraGridNormalizer();
        NegraTreeBuilder<Atom> builder = new NegraTreeBuilder<Atom>(
            new AtomLeafFactory(), mode, strictRoot, normalizer.getSecondaryEdgeOrder());
        Reader in = new InputStreamReader(new FileInputStream(input), charset);
        try {
          return convertNegra(new NegraGridReader(in), normalizer, builder, bw, edges, pretty);
        } finally {
          in.close();
        }
      } else if (format.equals("tiger")) {
        TigerXmlNormalizer normalizer = new TigerXmlNormalizer();
        NegraTreeBuilder<Atom> builder = new NegraTreeBuilder<Atom>(
            new AtomLeafFactory(), mode, strictRoot, normalizer.getSecondaryEdgeOrder());
        return convertTiger(TigerXmlReader.readSentences(input), normalizer, builder, bw, edges, pretty);
      } else {
        throw new IllegalArgumentException("Unknown input format " + format + ".");
      }
    } finally {
      bw.flush();
      if (cmd.hasOption("o"))
        bw.close();
    }
  }

  public static <L> Pair<Integer, Integer> convertNegra(NegraGridReader reader, NegraGridNormalizer normalizer,
                                                        NegraTreeBuilder<L> builder, Writer out,
                                                        boolean edges, boolean pretty) throws IOException {
    int converted = 0;
    int skipped = 0;
    List<String[]> grid;
    while ((grid = reader.readGrid()) != null) {
      Tree<L> tree = builder.build(normalizer.normalize(grid));
      if (tree == null) {
        logger.debug("Skipping sentence {}", reader.getSentenceId());
        skipped ++;
        continue;
      }
      write(reader.getSentenceId(), tree, out, edges, pretty);
      converted ++;
    }
    return Pair.with(converted, skipped);
  }

  public static <L> Pair<Integer, Integer> convertTiger(List<Element> sentences, TigerXmlNormalizer normalizer,
                                                        NegraTreeBuilder<L> builder, Writer out,
                                                        boolean edges, boolean pretty) throws IOException {
    int converted = 0;
    int skipped = 0;
    for (Element sentence : sentences) {
      List<Token> tokens = normalizer.normalize(sentence);
      Tree<L> tree = builder.build(tokens);
      if (tree == null) {
        logger.debug("Skipping sentence {}", sentence.getAttribute("id"));
        skipped ++;
        continue;
      }
      write(sentence.getAttribute("id"), tree, out, edges, pretty);
      converted ++;
    }
    return Pair.with(converted, skipped);
  }

  static SecondaryEdgeMode parseMode(String name) {
    if (name.equals("copy"))
      return SecondaryEdgeMode.COPY;
    else if (name.equals("annotate"))
      return SecondaryEdgeMode.ANNOTATE;
    throw new IllegalArgumentException("Unknown secondary edge handling " + name + ".");
  }

  private static void write(String id, Tree<?> tree, Writer out, boolean edges, boolean pretty) throws IOException {
    out.write("#" + id + "\n");
    if (pretty)
      out.write(Trees.IndentedTreeRenderer.render(tree, edges));
    else
      out.write(Trees.PennTreeRenderer.render(tree, edges));
    out.write("\n");
  }
}
