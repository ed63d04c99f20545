package spygen.hier;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Establishes the parent-to-child edges of the instance graph by scanning module bodies for instantiations of known modules.
 *
 * The set of known names is taken from the complete registry before any body is scanned, so a module may instantiate another one that
 * was extracted after it. Self-instantiation is recorded like any other edge; it is rejected during flattening.
 */
public class InstanceGraphBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Scans every module body in the registry and records the instances found.
   * @return the total number of edges added
   */
  public int build(ModuleRegistry registry) {
    List<String> moduleNames = List.copyOf(registry.getModuleNames());
    Pattern instancePattern = instancePattern(moduleNames);
    if (instancePattern == null)
      return 0;
    int edges = 0;
    for (ModuleRecord record : registry.getModules())
      edges += findInstances(record, instancePattern);
    logger.debug("Instance graph: {} edges between {} modules", edges, moduleNames.size());
    return edges;
  }

  /**
   * Scans a single module body against the given module names.
   * @return the number of edges added to record
   */
  public int findInstances(ModuleRecord record, Collection<String> moduleNames) {
    Pattern instancePattern = instancePattern(moduleNames);
    return instancePattern == null ? 0 : findInstances(record, instancePattern);
  }

  private int findInstances(ModuleRecord record, Pattern instancePattern) {
    Matcher matcher = instancePattern.matcher(record.getBody());
    int found = 0;
    while (matcher.find()) {
      InstanceEdge edge = new InstanceEdge(matcher.group("module"), matcher.group("alias"));
      logger.debug("Found instance in {}: {}", record.getName(), edge);
      record.addInstance(edge);
      ++found;
    }
    return found;
  }

  /**
   * Builds the pattern matching "module_name #(...) alias (" for any of the given names. The parameter override list is optional.
   * Returns null for an empty name set.
   */
  static Pattern instancePattern(Collection<String> moduleNames) {
    if (moduleNames.isEmpty())
      return null;
    // Longest names first so that the alternation never settles on a shorter prefix.
    String alternatives = moduleNames.stream()
                              .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                              .map(Pattern::quote)
                              .collect(Collectors.joining("|"));
    return Pattern.compile("\\b(?<module>" + alternatives + ")\\b\\s*(?:#\\s*\\(.*?\\)\\s*)?(?<alias>\\w+)\\s*\\(", Pattern.DOTALL);
  }
}
