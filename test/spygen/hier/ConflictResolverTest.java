package spygen.hier;

import static spygen.hier.DesignFixtures.ROOT;
import static spygen.hier.DesignFixtures.flatten;
import static spygen.hier.DesignFixtures.module;
import static spygen.hier.DesignFixtures.names;
import static spygen.hier.DesignFixtures.paths;
import static spygen.hier.DesignFixtures.registry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConflictResolverTest {
  private final ConflictResolver resolver = new ConflictResolver(ROOT);

  private static SignalRecord<PortSignal> port(PortDirection direction, String name, String path, String owner) {
    return new SignalRecord<>(new PortSignal(direction, "logic", Optional.empty(), name), ROOT + "." + path, owner);
  }
  private static SignalRecord<RegisterSignal> register(String name, String path, String owner) {
    return new SignalRecord<>(new RegisterSignal("logic", Optional.empty(), name), ROOT + "." + path, owner);
  }

  @Test
  void testDuplicateRegistersRenamed() throws CycleDetectedException {
    ModuleRegistry registry = registry(module("CHILD").register("cnt_s"), module("TOP").instance("CHILD", "c1").instance("CHILD", "c2"));
    List<SignalRecord<RegisterSignal>> resolved = resolver.resolveRegisters(flatten(registry, "TOP").getRegisters());

    Assertions.assertEquals(List.of("c1_cnt_s", "c2_cnt_s"), names(resolved));
    Assertions.assertEquals(List.of(ROOT + ".c1.cnt_s", ROOT + ".c2.cnt_s"), paths(resolved));
  }

  @Test
  void testUniqueRegistersUnchanged() {
    List<SignalRecord<RegisterSignal>> registers =
        List.of(register("b_s", "b_s", "top"), register("a_s", "u0.a_s", "leaf"), register("c_s", "u0.x.c_s", "core"));
    List<SignalRecord<RegisterSignal>> resolved = resolver.resolveRegisters(registers);
    Assertions.assertEquals(List.of("c_s", "a_s", "b_s"), names(resolved)); // only re-sorted by owner
    Assertions.assertEquals(3, resolved.size());
  }

  @Test
  void testAvoidNamesTakenByOtherSignals() {
    List<SignalRecord<RegisterSignal>> registers =
        List.of(register("cnt_s", "u_b.cnt_s", "b"), register("idle_s", "u_b.idle_s", "b"), register("clk", "clk", "top"));
    Set<String> taken = Set.of("clk", "cnt_s", "u_b_cnt_s");
    List<SignalRecord<RegisterSignal>> resolved = resolver.avoidNames(registers, taken);

    Assertions.assertEquals(List.of("u_b_cnt_s_1", "idle_s", "clk_1"), names(resolved));
    Assertions.assertEquals(paths(registers), paths(resolved));
    Assertions.assertEquals(resolved, resolver.avoidNames(resolved, taken));
  }

  @Test
  void testOutputGroupKeepsAllOutputsRenamed() throws CycleDetectedException {
    ModuleRegistry registry =
        registry(module("CHILD").output("done"), module("TOP").input("clk").instance("CHILD", "c1").instance("CHILD", "c2"));
    List<SignalRecord<PortSignal>> resolved = resolver.resolvePorts(flatten(registry, "TOP").getPorts());
    Assertions.assertEquals(List.of("c1_done", "c2_done"), names(resolved));
  }

  @Test
  void testTopLevelPortExcluded() throws CycleDetectedException {
    ModuleRegistry registry =
        registry(module("CHILD").output("done"), module("TOP").output("done").instance("CHILD", "c1").instance("CHILD", "c2"));
    List<SignalRecord<PortSignal>> resolved = resolver.resolvePorts(flatten(registry, "TOP").getPorts());
    Assertions.assertEquals(List.of("c1_done", "c2_done"), names(resolved));
    Assertions.assertTrue(resolved.stream().noneMatch(record -> record.depth(ROOT) == 1));
  }

  @Test
  void testSingletonPorts() {
    List<SignalRecord<PortSignal>> ports =
        List.of(port(PortDirection.INPUT, "clk", "clk", "top"), port(PortDirection.OUTPUT, "busy", "u0.busy", "core"));
    List<SignalRecord<PortSignal>> resolved = resolver.resolvePorts(ports);
    Assertions.assertEquals(List.of("busy"), names(resolved));
  }

  @Test
  void testOutputGroupDropsInputs() {
    List<SignalRecord<PortSignal>> ports = List.of(port(PortDirection.OUTPUT, "data", "prod.data", "producer"),
                                                   port(PortDirection.INPUT, "data", "cons.data", "consumer"),
                                                   port(PortDirection.INOUT, "data", "pad.data", "pad"));
    List<SignalRecord<PortSignal>> resolved = resolver.resolvePorts(ports);
    Assertions.assertEquals(List.of("prod_data"), names(resolved));
    Assertions.assertEquals(List.of(ROOT + ".prod.data"), paths(resolved));
  }

  @Test
  void testInputGroupKeepsShortestPath() {
    List<SignalRecord<PortSignal>> ports = List.of(port(PortDirection.INPUT, "clk", "u_core.u_alu.clk", "alu"),
                                                   port(PortDirection.INPUT, "clk", "u_core.clk", "core"),
                                                   port(PortDirection.INPUT, "clk", "u_core.u_regfile.clk", "regfile"));
    List<SignalRecord<PortSignal>> resolved = resolver.resolvePorts(ports);
    Assertions.assertEquals(List.of(ROOT + ".u_core.clk"), paths(resolved));
    Assertions.assertEquals(List.of("clk"), names(resolved));
  }

  @Test
  void testInputGroupRepresentativeAtTopIsDropped() {
    List<SignalRecord<PortSignal>> ports =
        List.of(port(PortDirection.INPUT, "rst", "rst", "top"), port(PortDirection.INPUT, "rst", "u_core.rst", "core"));
    Assertions.assertTrue(resolver.resolvePorts(ports).isEmpty());
  }

  @Test
  void testInputGroupTieBreakIsLexical() {
    List<SignalRecord<PortSignal>> ports =
        List.of(port(PortDirection.INPUT, "en", "u_b.en", "b"), port(PortDirection.INPUT, "en", "u_a.en", "a"));
    Assertions.assertEquals(List.of(ROOT + ".u_a.en"), paths(resolver.resolvePorts(ports)));
    Assertions.assertEquals(List.of(ROOT + ".u_a.en"), paths(resolver.resolvePorts(List.of(ports.get(1), ports.get(0)))));
  }

  @Test
  void testRenamedNameCollidingWithUniqueName() {
    // c1.cnt_s and c2.cnt_s become c1_cnt_s and c2_cnt_s, the first of which is already taken
    List<SignalRecord<RegisterSignal>> registers =
        List.of(register("c1_cnt_s", "c1_cnt_s", "top"), register("cnt_s", "c1.cnt_s", "child"), register("cnt_s", "c2.cnt_s", "child"));
    List<SignalRecord<RegisterSignal>> resolved = resolver.resolveRegisters(registers);
    assertUniqueNames(resolved);
    Assertions.assertEquals(3, resolved.size());
    Assertions.assertTrue(names(resolved).contains("c2_cnt_s"));
  }

  @Test
  void testAmbiguousFlatNamesGetNumbered() {
    // a_b.c and a.b_c both flatten to a_b_c
    List<SignalRecord<RegisterSignal>> registers = List.of(register("c_s", "a_b.c_s", "x"), register("c_s", "a.b_c_s", "x"));
    List<SignalRecord<RegisterSignal>> resolved = resolver.resolveRegisters(registers);
    Assertions.assertEquals(List.of("a_b_c_s", "a_b_c_s_1"), names(resolved));
  }

  @Test
  void testIdempotent() throws CycleDetectedException {
    ModuleRegistry registry = registry(module("leaf").register("cnt_s").output("done").input("clk"),
                                       module("mid").register("cnt_s").instance("leaf", "l0").instance("leaf", "l1").input("clk"),
                                       module("top").input("clk").output("done").instance("mid", "m0").instance("leaf", "l2"));
    FlattenedHierarchy flattened = flatten(registry, "top");
    var registers = resolver.resolveRegisters(flattened.getRegisters());
    var ports = resolver.resolvePorts(flattened.getPorts());
    Assertions.assertEquals(registers, resolver.resolveRegisters(registers));
    Assertions.assertEquals(ports, resolver.resolvePorts(ports));
  }

  @RepeatedTest(64)
  void testRandomDesigns_random() {
    long seed = new Random().nextLong();
    try {
      testRandomDesign(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testRandomDesign with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 68392, -6733423670758169604L})
  void testRandomDesign(long seed) {
    Random rand = new Random(seed);
    ModuleRegistry registry = randomTree(rand);
    FlattenedHierarchy flattened;
    try {
      flattened = flatten(registry, "m0");
    } catch (CycleDetectedException e) {
      throw new AssertionError("random tree must be acyclic", e);
    }
    Assertions.assertEquals(flattened.getRegisters().size(), new HashSet<>(paths(flattened.getRegisters())).size());

    var registers = resolver.resolveRegisters(flattened.getRegisters());
    Assertions.assertEquals(flattened.getRegisters().size(), registers.size());
    assertUniqueNames(registers);
    assertSortedByOwner(registers);
    Assertions.assertEquals(registers, resolver.resolveRegisters(registers));

    var ports = resolver.resolvePorts(flattened.getPorts());
    Assertions.assertTrue(ports.size() <= flattened.getPorts().size());
    assertUniqueNames(ports);
    assertSortedByOwner(ports);
    Assertions.assertTrue(ports.stream().allMatch(record -> record.depth(ROOT) > 1));
    Assertions.assertEquals(ports, resolver.resolvePorts(ports));
  }

  /** Modules m0..mN; a module only instantiates modules with a higher index, so the graph is acyclic with m0 as root. */
  private static ModuleRegistry randomTree(Random rand) {
    String[] signalNames = {"clk", "rst", "data", "valid", "cnt_s", "state_s", "c1_cnt_s"};
    int numModules = 2 + rand.nextInt(5);
    ArrayList<DesignFixtures.ModuleBuilder> modules = new ArrayList<>();
    for (int i = 0; i < numModules; ++i) {
      var spec = module("m" + i);
      for (int j = rand.nextInt(4); j > 0; --j)
        spec.port(PortDirection.values()[rand.nextInt(3)], signalNames[rand.nextInt(4)] + (rand.nextBoolean() ? "" : "_" + j));
      for (int j = rand.nextInt(3); j > 0; --j)
        spec.register(signalNames[4 + rand.nextInt(3)] + (j == 1 ? "" : "_" + j));
      if (i + 1 < numModules) {
        for (int j = 1 + rand.nextInt(2); j > 0; --j)
          spec.instance("m" + (i + 1 + rand.nextInt(numModules - i - 1)), rand.nextBoolean() ? "c1" : "u" + j);
      }
      modules.add(spec);
    }
    return registry(modules.toArray(new DesignFixtures.ModuleBuilder[0]));
  }

  private static void assertUniqueNames(List<? extends SignalRecord<?>> records) {
    Assertions.assertEquals(records.size(), new HashSet<>(names(records)).size(), () -> "duplicate names in " + names(records));
  }

  private static void assertSortedByOwner(List<? extends SignalRecord<?>> records) {
    for (int i = 1; i < records.size(); ++i)
      Assertions.assertTrue(records.get(i - 1).ownerModule().compareTo(records.get(i).ownerModule()) <= 0);
  }
}
