package spygen.ui;

import java.util.Optional;
import spygen.SpyMode;

/**
 * Data-Class to hold tool options.
 * Field names match the keys of the YAML configuration file.
 */
public class SpyGenConfig {

  /** Name suffix marking a body declaration as observable register. */
  public String register_suffix = "_s";
  /** Path prefix for all flattened signals; a macro that the generated file defines if not already defined. */
  public String root_token = "`DUT_PATH";
  /** Default expansion of root_token: the instance name of the design in the testbench. */
  public String top_instance_name = "i_dut";
  /** Explicit top module; empty to infer it. */
  public String top_module = "";
  /** One of "ports", "regs", "both". */
  public String mode = "both";
  /** Appended to the top module name to name the generated interface. */
  public String interface_suffix = "_spy_if";

  public Optional<String> getTopModuleOverride() {
    return Optional.ofNullable(top_module).map(String::trim).filter(name -> !name.isEmpty());
  }

  public SpyMode getMode() {
    return SpyMode.fromSerialName(mode).orElseThrow(() -> new IllegalArgumentException("Unknown mode '" + mode + "'"));
  }
}
