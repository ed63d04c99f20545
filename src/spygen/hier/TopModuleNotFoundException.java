package spygen.hier;

import java.util.List;

/** No top module could be inferred and no override was given. */
public class TopModuleNotFoundException extends HierarchyException {
  private static final long serialVersionUID = 1L;

  private final List<String> moduleNames;

  public TopModuleNotFoundException(List<String> moduleNames) {
    super("Top module wasn't found among [" + String.join(", ", moduleNames) + "]. Try to specify it explicitly");
    this.moduleNames = List.copyOf(moduleNames);
  }

  /** All modules known at the time of the failure. */
  public List<String> getModuleNames() { return moduleNames; }
}
