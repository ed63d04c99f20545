package spygen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import spygen.SpyGen;
import spygen.SpyMode;

public class SpyGenCmd {
  // logging
  protected static Logger logger = null;

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_FAILURE = 1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("spygen - generate a SystemVerilog spy interface for the internal signals of a design", options);
  }

  // entrypoint
  public static void main(String[] args) { System.exit(run(args)); }

  /**
   * Runs the tool with the given command line.
   * @return the process exit code
   */
  public static int run(String[] args) {
    initLogging();

    Options options = createOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    SpyGenConfig cfg;
    String rtlPath;
    String outputDir;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(options);
        return EXIT_SUCCESS;
      }

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      cfg = line.hasOption("c") ? readConfig(new File(line.getOptionValue("c"))) : new SpyGenConfig();
      if (line.hasOption("t"))
        cfg.top_module = line.getOptionValue("t");
      if (line.hasOption("m"))
        cfg.mode = line.getOptionValue("m");
      if (line.hasOption("s"))
        cfg.register_suffix = line.getOptionValue("s");
      if (line.hasOption("p"))
        cfg.root_token = line.getOptionValue("p");
      if (SpyMode.fromSerialName(cfg.mode).isEmpty())
        throw new ParseException("Mode must be one of ports, regs, both; got '" + cfg.mode + "'");
      if (cfg.register_suffix == null || cfg.register_suffix.isEmpty())
        throw new ParseException("The register suffix must not be empty");
      if (cfg.root_token == null || cfg.root_token.isEmpty())
        throw new ParseException("The root path token must not be empty");

      rtlPath = line.getOptionValue("r", "./rtl");
      outputDir = line.getOptionValue("o", "results");
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return EXIT_FAILURE;
    } catch (IOException | YAMLException exp) {
      logger.fatal("Cannot read configuration: " + exp.getMessage());
      return EXIT_FAILURE;
    }

    //////////   invoke spy generation   //////////
    SpyGen spyGen = new SpyGen(cfg);
    try {
      if (spyGen.readSources(new File(rtlPath)) == 0) {
        logger.fatal("No HDL sources found in " + rtlPath);
        return EXIT_FAILURE;
      }
    } catch (IOException e) {
      logger.fatal(e.getMessage());
      return EXIT_FAILURE;
    }
    boolean success = spyGen.Generate(outputDir);
    return success ? EXIT_SUCCESS : EXIT_FAILURE;
  }

  private static void initLogging() {
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("r")
                          .longOpt("rtl")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory with the SystemVerilog sources, searched recursively (default ./rtl)")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files (default results)")
                          .build());
    options.addOption(Option.builder("t")
                          .longOpt("top")
                          .argName("module")
                          .hasArg()
                          .required(false)
                          .desc("Top module; inferred from the instance hierarchy if not given")
                          .build());
    options.addOption(Option.builder("m")
                          .longOpt("mode")
                          .argName("ports|regs|both")
                          .hasArg()
                          .required(false)
                          .desc("Signal categories to spy on (default both)")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("suffix")
                          .argName("suffix")
                          .hasArg()
                          .required(false)
                          .desc("Name suffix of registers to spy on (default _s)")
                          .build());
    options.addOption(Option.builder("p")
                          .longOpt("path")
                          .argName("token")
                          .hasArg()
                          .required(false)
                          .desc("Hierarchical path prefix of the design in the testbench (default `DUT_PATH)")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options; command line options take precedence")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /** Reads tool options from a YAML mapping; absent keys keep their defaults. An empty file yields the defaults. */
  static SpyGenConfig readConfig(File configFile) throws IOException {
    Yaml yaml = new Yaml(new Constructor(SpyGenConfig.class, new LoaderOptions()));
    try (InputStream readFile = new FileInputStream(configFile)) {
      SpyGenConfig cfg = yaml.load(readFile);
      return cfg == null ? new SpyGenConfig() : cfg;
    }
  }
}
