package spygen.util;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import spygen.SpyMode;
import spygen.SpyResult;
import spygen.hier.ModuleRecord;
import spygen.hier.Parameter;
import spygen.hier.SignalDeclaration;
import spygen.hier.SignalRecord;
import spygen.ui.SpyGenConfig;

/**
 * Renders resolved spy signals as a SystemVerilog interface and a matching bind statement.
 *
 * The interface takes the parameters of the top module and exposes the top module's ports as inputs (connected through the bind with
 * ".*"). Every spied signal becomes a declaration plus a continuous assign from its hierarchical path.
 */
public class SpyInterfaceWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SpyGenConfig cfg;
  private final FileWriter toFile;

  public SpyInterfaceWriter(SpyGenConfig cfg, FileWriter toFile) {
    this.cfg = cfg;
    this.toFile = toFile;
  }

  public String getInterfaceName(ModuleRecord top) { return top.getName() + cfg.interface_suffix; }
  public String getInterfaceFile(ModuleRecord top) { return getInterfaceName(top) + ".sv"; }
  public String getBindFile(ModuleRecord top) { return getInterfaceName(top) + "_bind.sv"; }

  /** Adds the interface and bind files for result to the FileWriter. */
  public void generate(SpyResult result) {
    ModuleRecord top = result.getTop();
    String file = getInterfaceFile(top);
    String guard = getInterfaceName(top).toUpperCase() + "_SV";
    toFile.AddFile(file);
    toFile.nrTabs = 0;
    toFile.UpdateContent(file, "// Generated by SpyGen from module " + top.getName() + ". Do not edit.");
    toFile.UpdateContent(file, "`ifndef " + guard + "\n`define " + guard + "\n");
    if (cfg.root_token.startsWith("`")) {
      String macro = cfg.root_token.substring(1);
      toFile.UpdateContent(file, "`ifndef " + macro + "\n" + toFile.tab + "`define " + macro + " " + cfg.top_instance_name + "\n`endif\n");
    }

    toFile.UpdateContent(file, createInterfaceHeader(top));
    toFile.nrTabs = 1;
    List<SignalRecord<?>> combined = result.getCombined();
    List<SignalDeclaration> declarations =
        combined.stream().<SignalDeclaration>map(SignalRecord::declaration).collect(Collectors.toList());
    int columnWidth = ColumnAligner.maxTypeWidth(declarations);
    if (result.getMode().ports)
      toFile.UpdateContent(file, createSection("ports", combined.subList(0, result.getPortCount()), columnWidth));
    if (result.getMode() == SpyMode.BOTH)
      toFile.UpdateContent(file, createDivider());
    if (result.getMode().registers)
      toFile.UpdateContent(file, createSection("registers", combined.subList(result.getPortCount(), combined.size()), columnWidth));
    toFile.nrTabs = 0;
    toFile.UpdateContent(file, "endinterface\n\n`endif // " + guard);

    String bindFile = getBindFile(top);
    toFile.UpdateContent(bindFile, "// Generated by SpyGen from module " + top.getName() + ". Do not edit.");
    toFile.UpdateContent(bindFile, createBind(top));
    logger.debug("Rendered {} with {} port and {} register spies", getInterfaceName(top), result.getPorts().size(),
                 result.getRegisters().size());
  }

  String createInterfaceHeader(ModuleRecord top) {
    StringBuilder header = new StringBuilder("interface " + getInterfaceName(top));
    if (!top.getParameters().isEmpty()) {
      header.append(" #(\n");
      header.append(top.getParameters()
                        .stream()
                        .map(parameter -> toFile.tab + createParameterDecl(parameter))
                        .collect(Collectors.joining(",\n")));
      header.append("\n)");
    }
    if (top.getPorts().isEmpty())
      return header.append(" ();\n").toString();
    header.append(" (\n");
    List<String> ports = ColumnAligner.align(top.getPorts(), "input");
    header.append(ports.stream().map(line -> toFile.tab + line).collect(Collectors.joining(",\n")));
    header.append("\n);\n");
    return header.toString();
  }

  static String createParameterDecl(Parameter parameter) {
    StringBuilder decl = new StringBuilder("parameter ");
    if (!parameter.type().isEmpty())
      decl.append(parameter.type()).append(' ');
    decl.append(parameter.name());
    if (!parameter.defaultValue().isEmpty())
      decl.append(" = ").append(parameter.defaultValue());
    return decl.toString();
  }

  /**
   * Declarations grouped by owner module, followed by the assigns.
   * The records are expected to be sorted by owner module already.
   */
  String createSection(String title, List<SignalRecord<?>> records, int columnWidth) {
    ArrayList<String> lines = new ArrayList<>();
    lines.add("// " + title);
    if (records.isEmpty()) {
      lines.add("// (none)");
      return String.join("\n", lines) + "\n";
    }
    String owner = null;
    for (SignalRecord<?> record : records) {
      if (!record.ownerModule().equals(owner)) {
        owner = record.ownerModule();
        lines.add("// module: " + owner);
      }
      lines.add(createSignalDecl(record.declaration(), columnWidth) + ";");
    }
    lines.add("");
    for (SignalRecord<?> record : records)
      lines.add("assign " + record.name() + " = " + record.path() + ";");
    return String.join("\n", lines) + "\n";
  }

  static String createSignalDecl(SignalDeclaration declaration, int columnWidth) { return ColumnAligner.align(declaration, "", columnWidth); }

  static String createDivider() { return "// " + "-".repeat(72) + "\n"; }

  String createBind(ModuleRecord top) {
    StringBuilder bind = new StringBuilder("bind " + top.getName() + " " + getInterfaceName(top));
    if (!top.getParameters().isEmpty()) {
      bind.append(" #(");
      bind.append(top.getParameters()
                      .stream()
                      .map(parameter -> "." + parameter.name() + "(" + parameter.name() + ")")
                      .collect(Collectors.joining(", ")));
      bind.append(")");
    }
    bind.append(" i_" + getInterfaceName(top) + " (.*);");
    return bind.toString();
  }
}
