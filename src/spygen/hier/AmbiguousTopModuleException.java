package spygen.hier;

import java.util.List;

/** More than one module qualifies as top; an explicit override is required. */
public class AmbiguousTopModuleException extends HierarchyException {
  private static final long serialVersionUID = 1L;

  private final List<String> candidates;

  public AmbiguousTopModuleException(List<String> candidates) {
    super("More than one potential top module detected: " + String.join(", ", candidates) + ". Try to specify it explicitly");
    this.candidates = List.copyOf(candidates);
  }

  public List<String> getCandidates() { return candidates; }
}
