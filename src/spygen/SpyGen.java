package spygen;

import java.io.File;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import spygen.frontend.CommentStripper;
import spygen.frontend.ModuleExtractor;
import spygen.frontend.SourceCollector;
import spygen.hier.ConflictResolver;
import spygen.hier.FlattenedHierarchy;
import spygen.hier.HierarchyException;
import spygen.hier.HierarchyFlattener;
import spygen.hier.InstanceGraphBuilder;
import spygen.hier.ModuleRecord;
import spygen.hier.ModuleRegistry;
import spygen.hier.PortSignal;
import spygen.hier.RegisterSignal;
import spygen.hier.SignalRecord;
import spygen.hier.TopModuleResolver;
import spygen.ui.SpyGenConfig;
import spygen.util.FileWriter;
import spygen.util.SpyInterfaceWriter;

/**
 * Drives one spy interface generation run: sources are added first, then the hierarchy is resolved and rendered.
 */
public class SpyGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SpyGenConfig cfg;
  private final ModuleExtractor extractor;
  private final ModuleRegistry registry = new ModuleRegistry();
  /** Set once the instance graph is built; no sources may be added afterwards. */
  private boolean graphBuilt = false;

  public SpyGen(SpyGenConfig cfg) {
    this.cfg = cfg;
    this.extractor = new ModuleExtractor(cfg.register_suffix);
  }

  public ModuleRegistry getRegistry() { return registry; }

  /**
   * Extracts the modules of one source unit into the registry.
   * @return the number of modules added
   */
  public int addSource(String source, String unitName) {
    if (graphBuilt)
      throw new IllegalStateException("Sources cannot be added after the instance graph was built");
    List<ModuleRecord> modules = extractor.extract(CommentStripper.strip(source), unitName);
    int added = 0;
    for (ModuleRecord module : modules)
      if (registry.add(module))
        ++added;
    return added;
  }

  /**
   * Reads all HDL sources below rtlPath.
   * @return the number of files read
   */
  public int readSources(File rtlPath) throws IOException {
    List<File> sources = SourceCollector.collect(rtlPath);
    for (File source : sources) {
      logger.debug("Reading " + source.getPath());
      addSource(SourceCollector.read(source), source.getPath());
    }
    logger.info("Read {} modules from {} files", registry.size(), sources.size());
    return sources.size();
  }

  /**
   * Builds the instance graph (on first call), picks the top module and returns its flattened, conflict-free signals.
   */
  public SpyResult resolve() throws HierarchyException {
    if (!graphBuilt) {
      new InstanceGraphBuilder().build(registry);
      graphBuilt = true;
    }
    ModuleRecord top = new TopModuleResolver().resolve(registry, cfg.getTopModuleOverride());
    FlattenedHierarchy flattened = new HierarchyFlattener(registry, cfg.root_token).flatten(top);

    SpyMode mode = cfg.getMode();
    ConflictResolver conflictResolver = new ConflictResolver(cfg.root_token);
    List<SignalRecord<PortSignal>> ports = mode.ports ? conflictResolver.resolvePorts(flattened.getPorts()) : List.of();
    List<SignalRecord<RegisterSignal>> registers =
        mode.registers ? conflictResolver.resolveRegisters(flattened.getRegisters()) : List.of();
    // All spies share one interface scope with the top module's ports.
    HashSet<String> taken = top.getPorts().stream().map(PortSignal::name).collect(Collectors.toCollection(HashSet::new));
    ports = conflictResolver.avoidNames(ports, taken);
    ports.forEach(port -> taken.add(port.name()));
    registers = conflictResolver.avoidNames(registers, taken);
    logger.info("Top module {}: {} port spies, {} register spies", top.getName(), ports.size(), registers.size());
    return new SpyResult(top, mode, ports, registers);
  }

  /**
   * Resolves the hierarchy and writes the spy interface files to outputDir.
   * @return true on success; errors are logged
   */
  public boolean Generate(String outputDir) {
    SpyResult result;
    try {
      result = resolve();
    } catch (HierarchyException e) {
      logger.fatal(e.getMessage());
      return false;
    }
    FileWriter toFile = new FileWriter();
    new SpyInterfaceWriter(cfg, toFile).generate(result);
    try {
      toFile.WriteFiles(outputDir);
    } catch (IOException e) {
      logger.fatal("Cannot write output files: " + e.getMessage());
      return false;
    }
    return true;
  }
}
