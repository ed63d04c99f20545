package spygen.util;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing generated files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static class FileUpdateInfo {
    /** Text blocks in insertion order. */
    public ArrayList<String> blocks = new ArrayList<>();
  }
  /** key: file relative path */
  private LinkedHashMap<String, FileUpdateInfo> update_files = new LinkedHashMap<String, FileUpdateInfo>();
  public String tab = "    ";
  public int nrTabs = 0;

  public FileWriter() {}

  /**
   * Appends text to a file to be written later.
   * Every line is indented by the current number of tabs.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to append; use "\n" line breaks for multi-line text. The final line break is added implicitly.
   */
  public void UpdateContent(String file, String text) {
    String indent = tab.repeat(nrTabs);
    String indented = indent.isEmpty() ? text : indent + text.replace("\n", "\n" + indent);
    update_files.computeIfAbsent(file, file_ -> new FileUpdateInfo()).blocks.add(indented);
  }

  /**
   * Adds a file name to the internal tracking set, so that it is written even if no text gets added.
   * @param file The relative path to the file.
   */
  public void AddFile(String file) { update_files.computeIfAbsent(file, file_ -> new FileUpdateInfo()); }

  public Set<String> GetFiles() { return update_files.keySet(); }

  /** Returns the text that {@link #WriteFiles(String)} would write for file. */
  public String GetContent(String file) {
    FileUpdateInfo updateInfo = update_files.get(file);
    if (updateInfo == null)
      return "";
    StringBuilder content = new StringBuilder();
    for (String block : updateInfo.blocks)
      content.append(block.replaceAll("(?m)[ \\t]+$", "")).append('\n');
    return content.toString();
  }

  /**
   * Writes all files registered with this FileWriter.
   *
   * @param out_path Base output directory, created if necessary.
   * @return the written files
   */
  public List<File> WriteFiles(String out_path) throws IOException {
    ArrayList<File> written = new ArrayList<>();
    for (String key : update_files.keySet())
      written.add(WriteFile(key, out_path));
    return written;
  }

  private File WriteFile(String file, String out_path) throws IOException {
    File outFile = new File(out_path, file);
    File parent = outFile.getParentFile();
    if (parent != null && !parent.isDirectory() && !parent.mkdirs())
      throw new IOException("Cannot create output directory " + parent.getPath());

    logger.info("Writing " + outFile.getPath());
    try (PrintWriter out = new PrintWriter(outFile, StandardCharsets.UTF_8)) {
      out.print(GetContent(file));
      if (out.checkError())
        throw new IOException("Error writing file " + outFile.getPath());
    }
    return outFile;
  }
}
