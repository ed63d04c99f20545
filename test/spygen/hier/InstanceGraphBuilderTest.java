package spygen.hier;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InstanceGraphBuilderTest {

  private static ModuleRecord withBody(String name, String body) { return new ModuleRecord(name, List.of(), List.of(), List.of(), body); }

  @Test
  void testInstancesInTextualOrder() {
    ModuleRecord top = withBody("top", "\n  logic a;\n  child #(.W(8)) c2 (.clk(clk));\n  child c1(.clk(clk));\n  leaf u_leaf (.*);\n");
    ModuleRegistry registry = new ModuleRegistry(List.of(top, withBody("child", ""), withBody("leaf", "")));

    int edges = new InstanceGraphBuilder().build(registry);

    Assertions.assertEquals(3, edges);
    Assertions.assertEquals(List.of(new InstanceEdge("child", "c2"), new InstanceEdge("child", "c1"), new InstanceEdge("leaf", "u_leaf")),
                            top.getInstances());
  }

  @Test
  void testForwardReferenceResolves() {
    // "later" is added to the registry after "early", which instantiates it
    ModuleRecord early = withBody("early", " later i_later (.a(a));");
    ModuleRecord later = withBody("later", "");
    ModuleRegistry registry = new ModuleRegistry(List.of(early, later));

    new InstanceGraphBuilder().build(registry);

    Assertions.assertEquals(List.of(new InstanceEdge("later", "i_later")), early.getInstances());
  }

  @Test
  void testNestedParameterOverrides() {
    ModuleRecord top = withBody("top", " fifo #(.DEPTH($clog2(16)), .W(W)) u_fifo (\n .clk(clk)\n );");
    new InstanceGraphBuilder().findInstances(top, Set.of("fifo", "top"));
    Assertions.assertEquals(List.of(new InstanceEdge("fifo", "u_fifo")), top.getInstances());
  }

  @Test
  void testIgnoresNonInstances() {
    // prefix of a known name, declaration of a variable with a module-like type and a mere mention
    ModuleRecord top = withBody("top", " fifo_ctrl u_ctrl (.a(a));\n fifo data_q;\n assign x = fifo;");
    new InstanceGraphBuilder().findInstances(top, Set.of("fifo"));
    Assertions.assertTrue(top.getInstances().isEmpty());
  }

  @Test
  void testSelfInstanceIsRecorded() {
    ModuleRecord rec = withBody("rec", " rec u_rec (.a(a));");
    new InstanceGraphBuilder().build(new ModuleRegistry(List.of(rec)));
    Assertions.assertEquals(List.of(new InstanceEdge("rec", "u_rec")), rec.getInstances());
  }

  @Test
  void testEmptyRegistry() {
    Assertions.assertEquals(0, new InstanceGraphBuilder().build(new ModuleRegistry()));
  }
}
