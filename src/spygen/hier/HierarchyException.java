package spygen.hier;

/**
 * Fatal error about the shape of the module hierarchy.
 * No spy artifact is produced once one of these is raised.
 */
public abstract class HierarchyException extends Exception {
  private static final long serialVersionUID = 1L;

  protected HierarchyException(String message) { super(message); }
}
