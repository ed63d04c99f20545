package spygen.hier;

import java.util.List;

/** The instantiation tree below the top module revisits a module that is still being expanded. */
public class CycleDetectedException extends HierarchyException {
  private static final long serialVersionUID = 1L;

  private final List<String> cycle;

  /**
   * @param cycle module names along the cycle, starting and ending with the revisited module
   */
  public CycleDetectedException(List<String> cycle) {
    super("Cyclic instantiation detected: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }

  public List<String> getCycle() { return cycle; }
}
