package dtj;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import com.google.common.io.Files;

public class BatchConverter {
  private static final Logger logger = LogManager.getLogger(BatchConverter.class);

  private final TemplateConverter converter;
  private final Aggregator aggregator;
  private final String suffix;

  public BatchConverter(TemplateConverter converter, Aggregator aggregator, String suffix) {
    this.converter = converter;
    this.aggregator = aggregator;
    this.suffix = suffix;
  }

  public ImmutableList<File> findTemplates(File inputDir) {
    return Streams.stream(Files.fileTraverser().depthFirstPreOrder(inputDir))
        .filter(f -> f.isFile() && f.getName().endsWith(suffix))
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  public boolean convertAll(File inputDir, File outputDir) {
    boolean success = true;
    for (File template : findTemplates(inputDir)) {
      String name = inputDir.toPath().relativize(template.toPath()).toString();
      try {
        ConversionResult result = converter.convert(name, read(template));
        write(result.output(), new File(outputDir, name));
        aggregator.add(result);
        System.out.println("Converted " + name);
      } catch (TemplateSyntaxException ex) {
        ex.print();
        success = false;
      } catch (IOException ex) {
        logger.error("Could not convert {}", name, ex);
        System.out.println("ERROR: " + name + " " + ex.getMessage());
        success = false;
      } catch (RuntimeException ex) {
        logger.error("Internal error converting {}", name, ex);
        System.out.println("ERROR: " + name + " internal error: " + ex);
        success = false;
      }
    }
    return success;
  }

  // Malformed input fails the template instead of being replaced with U+FFFD.
  private static String read(File file) throws IOException {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(Files.asByteSource(file).read())).toString();
    } catch (CharacterCodingException ex) {
      throw new IOException("not valid UTF-8", ex);
    }
  }

  private static void write(String string, File file) throws IOException {
    Files.createParentDirs(file);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
