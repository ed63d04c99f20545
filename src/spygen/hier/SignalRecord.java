package spygen.hier;

/**
 * One flattened occurrence of a signal.
 * The path identifies the physical signal instance even where several records share a local name.
 *
 * @param declaration the originating declaration, or a renamed copy of it
 * @param path dot-separated path from the root token through all instance aliases to the local name
 * @param ownerModule name of the module that declared the signal
 */
public record SignalRecord<D extends SignalDeclaration>(D declaration, String path, String ownerModule) {
  public static final char PATH_SEPARATOR = '.';
  public static final char FLAT_SEPARATOR = '_';

  public String name() { return declaration.name(); }

  /**
   * Number of path segments below the root token.
   * A port of the top module has depth 1, a port of a direct child instance has depth 2.
   */
  public int depth(String rootToken) {
    String relative = relativePath(rootToken);
    if (relative.isEmpty())
      return 0;
    return (int)relative.chars().filter(c -> c == PATH_SEPARATOR).count() + 1;
  }

  /** The path without the root token, with separators flattened, e.g. "c1_cnt_s" for "`DUT_PATH.c1.cnt_s". */
  public String flatName(String rootToken) { return relativePath(rootToken).replace(PATH_SEPARATOR, FLAT_SEPARATOR); }

  /** Returns this record with the declaration renamed. Path and owner are kept. */
  @SuppressWarnings("unchecked")
  public SignalRecord<D> renamed(String newName) {
    return new SignalRecord<D>((D)declaration.withName(newName), path, ownerModule);
  }

  private String relativePath(String rootToken) {
    if (path.startsWith(rootToken + PATH_SEPARATOR))
      return path.substring(rootToken.length() + 1);
    return path.equals(rootToken) ? "" : path;
  }
}
