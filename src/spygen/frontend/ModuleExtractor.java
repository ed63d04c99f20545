package spygen.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import spygen.hier.ModuleRecord;
import spygen.hier.Parameter;
import spygen.hier.PortDirection;
import spygen.hier.PortSignal;
import spygen.hier.RegisterSignal;

/**
 * Extracts module records from comment-free SystemVerilog text.
 *
 * Only ANSI-style headers are understood: the parameter list and the port list are taken from the module header, registers are the
 * variable declarations in the body whose name carries the register suffix. Instances are not resolved here, see
 * {@link spygen.hier.InstanceGraphBuilder}.
 */
public class ModuleExtractor {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern MODULE_PATTERN = Pattern.compile("\\bmodule\\s+(?:(?:automatic|static)\\s+)?(?<name>\\w+)\\s*"
                                                                    + "(?:import\\s+[\\w:*,\\s]+;\\s*)*"
                                                                    + "(?:#\\s*\\((?<params>.*?)\\)\\s*)?"
                                                                    + "(?:\\((?<ports>.*?)\\))?\\s*;"
                                                                    + "(?<body>.*?)\\bendmodule\\b",
                                                                Pattern.DOTALL);

  private static final Pattern PARAM_PATTERN =
      Pattern.compile("(?:(?:parameter|localparam)\\s+)?(?:(?<type>[^=]*?)\\s+)?(?<name>\\w+)\\s*(?:\\[[^\\]]*\\]\\s*)*"
                          + "(?:=\\s*(?<value>.*))?",
                      Pattern.DOTALL);

  private static final Pattern PORT_PATTERN = Pattern.compile("(?:(?<direction>input|output|inout)\\s+)?"
                                                                  + "(?:(?<kind>wire|var)\\b\\s*)?"
                                                                  + "(?:(?<type>(?!signed\\b|unsigned\\b)[\\w:]+)\\b\\s*)?"
                                                                  + "(?:(?:signed|unsigned)\\b\\s*)?"
                                                                  + "(?<width>(?:\\[[^\\]]*\\]\\s*)*)"
                                                                  + "(?<name>\\w+)\\s*(?:\\[[^\\]]*\\]\\s*)*(?:=.*)?",
                                                              Pattern.DOTALL);

  private static final Pattern TYPEDEF_PATTERN = Pattern.compile("\\btypedef\\b[^;]*;");

  private static final String DEFAULT_PORT_TYPE = "logic";

  private final Pattern registerPattern;
  private final String registerSuffix;

  /**
   * @param registerSuffix name suffix that marks a body declaration as observable register, e.g. "_s"
   */
  public ModuleExtractor(String registerSuffix) {
    this.registerSuffix = registerSuffix;
    this.registerPattern = Pattern.compile("(?<![\\w$.'])(?<type>logic|reg|bit|\\w+_t)\\b\\s*"
                                               + "(?:(?:signed|unsigned)\\b\\s*)?"
                                               + "(?<width>(?:\\[[^\\]]*\\]\\s*)*)"
                                               + "(?<names>\\w+(?:\\s*\\[[^\\]]*\\])*(?:\\s*,\\s*\\w+(?:\\s*\\[[^\\]]*\\])*)*)"
                                               + "\\s*(?:=[^;]*)?;",
                                           Pattern.DOTALL);
  }

  /**
   * Extracts all modules of one source unit.
   * @param source source text with comments already removed
   * @param unitName name of the source unit, for diagnostics
   * @return the modules in source order; empty if the unit defines none
   */
  public List<ModuleRecord> extract(String source, String unitName) {
    ArrayList<ModuleRecord> modules = new ArrayList<>();
    Matcher moduleMatcher = MODULE_PATTERN.matcher(source);
    while (moduleMatcher.find()) {
      String name = moduleMatcher.group("name");
      String body = moduleMatcher.group("body");
      List<Parameter> parameters = extractParameters(Optional.ofNullable(moduleMatcher.group("params")).orElse(""), name);
      List<PortSignal> ports = extractPorts(Optional.ofNullable(moduleMatcher.group("ports")).orElse(""), name);
      List<RegisterSignal> registers = extractRegisters(body);
      ModuleRecord module = new ModuleRecord(name, parameters, ports, registers, body);
      logger.debug("Extracted from {}: {}", unitName, module);
      modules.add(module);
    }
    if (modules.isEmpty())
      logger.warn("No module found in {}", unitName);
    return modules;
  }

  List<Parameter> extractParameters(String paramList, String moduleName) {
    ArrayList<Parameter> parameters = new ArrayList<>();
    for (String item : splitTopLevel(paramList)) {
      Matcher matcher = PARAM_PATTERN.matcher(item);
      if (!matcher.matches()) {
        logger.warn("Module {}: cannot parse parameter '{}', skipping it", moduleName, item);
        continue;
      }
      String type = Optional.ofNullable(matcher.group("type")).orElse("").trim();
      String value = Optional.ofNullable(matcher.group("value")).orElse("").trim();
      parameters.add(new Parameter(matcher.group("name"), type, value));
    }
    return parameters;
  }

  List<PortSignal> extractPorts(String portList, String moduleName) {
    ArrayList<PortSignal> ports = new ArrayList<>();
    PortSignal previous = null;
    for (String item : splitTopLevel(portList)) {
      Matcher matcher = PORT_PATTERN.matcher(item);
      if (!matcher.matches()) {
        logger.warn("Module {}: cannot parse port '{}', skipping it", moduleName, item);
        continue;
      }
      String name = matcher.group("name");
      String type = Optional.ofNullable(matcher.group("type")).or(() -> Optional.ofNullable(matcher.group("kind"))).orElse(null);
      Optional<String> width = Optional.of(matcher.group("width").trim()).filter(text -> !text.isEmpty());
      String directionKeyword = matcher.group("direction");
      PortSignal port;
      if (directionKeyword != null) {
        port = new PortSignal(PortDirection.fromKeyword(directionKeyword).get(), type == null ? DEFAULT_PORT_TYPE : type, width, name);
      } else if (previous != null) {
        // "input logic [7:0] a, b": b continues the previous declaration
        if (type == null && width.isEmpty())
          port = previous.withName(name);
        else
          port = new PortSignal(previous.direction(), type == null ? previous.type() : type, width, name);
      } else {
        logger.warn("Module {}: port '{}' has no direction, skipping it", moduleName, item);
        continue;
      }
      ports.add(port);
      previous = port;
    }
    return ports;
  }

  List<RegisterSignal> extractRegisters(String body) {
    ArrayList<RegisterSignal> registers = new ArrayList<>();
    Matcher matcher = registerPattern.matcher(maskTypeBodies(body));
    while (matcher.find()) {
      String type = matcher.group("type");
      Optional<String> width = Optional.of(matcher.group("width").trim()).filter(text -> !text.isEmpty());
      for (String declarator : matcher.group("names").split(",")) {
        String name = declarator.trim().split("[\\s\\[]", 2)[0];
        if (name.length() > registerSuffix.length() && name.endsWith(registerSuffix))
          registers.add(new RegisterSignal(type, width, name));
      }
    }
    return registers;
  }

  /**
   * Blanks out brace-enclosed regions and typedef declarations.
   * Struct and union members, enum literals and initializer patterns inside braces are no variables of the module.
   */
  static String maskTypeBodies(String body) {
    StringBuilder masked = new StringBuilder(body.length());
    int depth = 0;
    for (int i = 0; i < body.length(); ++i) {
      char c = body.charAt(i);
      if (c == '{')
        ++depth;
      masked.append(depth > 0 && c != '\n' ? ' ' : c);
      if (c == '}' && depth > 0)
        --depth;
    }
    return TYPEDEF_PATTERN.matcher(masked).replaceAll(" ");
  }

  /** Splits a declaration list at commas that are not nested in brackets, braces or parentheses. Blank items are dropped. */
  static List<String> splitTopLevel(String list) {
    ArrayList<String> items = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < list.length(); ++i) {
      char c = list.charAt(i);
      if (c == '(' || c == '[' || c == '{')
        ++depth;
      else if (c == ')' || c == ']' || c == '}')
        --depth;
      else if (c == ',' && depth == 0) {
        items.add(list.substring(start, i));
        start = i + 1;
      }
    }
    items.add(list.substring(start));
    items.replaceAll(String::trim);
    items.removeIf(String::isEmpty);
    return items;
  }
}
