package spygen.hier;

/**
 * Directed parent-to-child edge of the instance graph, labeled by the instance alias.
 * The parent is the {@link ModuleRecord} holding the edge.
 */
public record InstanceEdge(String childModuleName, String instanceAlias) {
  @Override
  public String toString() {
    return childModuleName + " " + instanceAlias;
  }
}
