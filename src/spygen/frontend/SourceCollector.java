package spygen.frontend;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the HDL source files below an RTL directory.
 * Subdirectories are searched recursively, except those starting with "." or "skip_". The result is sorted by path.
 */
public class SourceCollector {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final Set<String> SOURCE_EXTENSIONS = Set.of(".sv", ".svh", ".v");

  private SourceCollector() {}

  /**
   * @param rtlDir directory to search, or a single source file
   * @throws FileNotFoundException if rtlDir does not exist
   */
  public static List<File> collect(File rtlDir) throws FileNotFoundException {
    if (!rtlDir.exists())
      throw new FileNotFoundException("RTL path " + rtlDir.getPath() + " does not exist");
    if (rtlDir.isFile())
      return List.of(rtlDir);
    List<File> sources = listRecursive(rtlDir).filter(SourceCollector::isSource)
                             .sorted(Comparator.comparing(File::getPath))
                             .collect(Collectors.toList());
    logger.debug("Found {} source files in {}", sources.size(), rtlDir.getPath());
    return sources;
  }

  /**
   * Reads a source file as UTF-8.
   * Bytes that are no valid UTF-8, e.g. Latin-1 umlauts in comments, are replaced by U+FFFD instead of failing the run.
   */
  public static String read(File source) throws IOException {
    StringBuilder text = new StringBuilder();
    try (BufferedReader in = new BufferedReader(new InputStreamReader(new FileInputStream(source), StandardCharsets.UTF_8))) {
      char[] buffer = new char[8192];
      for (int n; (n = in.read(buffer)) != -1;)
        text.append(buffer, 0, n);
    }
    if (text.indexOf("\uFFFD") >= 0)
      logger.warn("{} is not valid UTF-8, undecodable bytes were replaced", source.getPath());
    return text.toString();
  }

  private static Stream<File> listRecursive(File dir) {
    return Stream.of(Optional.ofNullable(dir.listFiles()).orElse(new File[0])).mapMulti((File fileIn, Consumer<File> filesOut) -> {
      if (fileIn.isDirectory()) {
        if (!fileIn.getName().startsWith(".") && !fileIn.getName().startsWith("skip_"))
          listRecursive(fileIn).forEach(filesOut);
      } else
        filesOut.accept(fileIn);
    });
  }

  static boolean isSource(File file) {
    String name = file.getName();
    return file.isFile() && SOURCE_EXTENSIONS.stream().anyMatch(name::endsWith);
  }
}
