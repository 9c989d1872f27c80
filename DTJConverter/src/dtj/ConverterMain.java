package dtj;

import java.io.File;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
    name = "dtj",
    mixinStandardHelpOptions = true,
    description = "Converts a directory of Django templates to Jinja2.")
public class ConverterMain implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(ConverterMain.class);

  @Mixin private Arguments arguments;

  public static void main(String... args) {
    System.exit(new CommandLine(new ConverterMain()).execute(args));
  }

  @Override
  public Integer call() throws Exception {
    File input = arguments.input();
    if (!input.isDirectory()) {
      System.err.println("Not a directory: " + input);
      return 1;
    }

    ConversionRules rules = ConversionRules.defaults();
    if (arguments.rules().isPresent()) {
      rules = RulesFile.load(arguments.rules().get().toPath(), rules);
    }
    logger.debug("Converting {} into {}", input, arguments.output());

    Aggregator aggregator = new Aggregator();
    BatchConverter batch =
        new BatchConverter(new TemplateConverter(rules), aggregator, arguments.suffix());
    boolean success = batch.convertAll(input, arguments.output());

    aggregator.summaryLines().forEach(System.out::println);
    if (!success) {
      System.out.println("Conversion failed for some templates.  See errors above.");
      return 1;
    }
    System.out.println("Conversion succeeded!");
    return 0;
  }
}
