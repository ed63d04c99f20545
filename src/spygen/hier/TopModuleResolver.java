package spygen.hier;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Picks the root of the instantiation tree.
 *
 * An explicit override that resolves always wins. Otherwise a registry with a single module yields that module; in all other cases the top
 * must be the only module that instantiates something and is instantiated by nothing.
 */
public class TopModuleResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * @param registry the registry, with the instance graph already built
   * @param override explicit top module name; empty or blank for inference
   * @return the top module
   * @throws TopModuleNotFoundException if no module qualifies
   * @throws AmbiguousTopModuleException if several modules qualify
   */
  public ModuleRecord resolve(ModuleRegistry registry, Optional<String> override)
      throws TopModuleNotFoundException, AmbiguousTopModuleException {
    Optional<String> overrideName = override.map(String::trim).filter(name -> !name.isEmpty());
    if (overrideName.isPresent()) {
      Optional<ModuleRecord> explicitTop = registry.lookup(overrideName.get());
      if (explicitTop.isPresent()) {
        logger.debug("Using explicit top module {}", overrideName.get());
        return explicitTop.get();
      }
      logger.warn("Requested top module {} was not found, trying to infer the top module", overrideName.get());
    }

    if (registry.size() == 1)
      return registry.getModules().iterator().next();

    HashSet<String> instantiated = new HashSet<>();
    registry.getModules().forEach(
        module -> module.getInstances().forEach(edge -> instantiated.add(edge.childModuleName())));

    List<ModuleRecord> potentialTops = registry.getModules()
                                           .stream()
                                           .filter(module -> !module.getInstances().isEmpty())
                                           .filter(module -> !instantiated.contains(module.getName()))
                                           .collect(Collectors.toList());
    if (potentialTops.size() == 1) {
      logger.info("Detected top module {}", potentialTops.get(0).getName());
      return potentialTops.get(0);
    }
    if (potentialTops.isEmpty())
      throw new TopModuleNotFoundException(registry.getModuleNames().stream().sorted().collect(Collectors.toList()));
    throw new AmbiguousTopModuleException(potentialTops.stream().map(ModuleRecord::getName).sorted().collect(Collectors.toList()));
  }
}
