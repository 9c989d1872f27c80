package dtj;

import java.io.File;
import java.util.Optional;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

public final class Arguments {

  @Parameters(index = "0", description = "Directory holding the Django templates.")
  private File input;

  public File input() {
    return input;
  }

  @Option(
      names = {"-o", "--output"},
      description = "Directory to write the Jinja2 templates to. Defaults to a 'jinja2' directory"
          + " next to the input directory.")
  private File output;

  public File output() {
    if (output != null) {
      return output;
    }
    File parent = input.getAbsoluteFile().getParentFile();
    return new File(parent, "jinja2");
  }

  @Option(
      names = {"-s", "--suffix"},
      description = "File name suffix of templates. Defaults to ${DEFAULT-VALUE}.",
      defaultValue = ".html")
  private String suffix = ".html";

  public String suffix() {
    return suffix;
  }

  @Option(
      names = {"-r", "--rules"},
      description = "JSON file with conversion rules to add to the defaults.",
      paramLabel = "<rules.json>")
  private File rules;

  public Optional<File> rules() {
    return Optional.ofNullable(rules);
  }
}
