package spygen.frontend;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceCollectorTest {

  @Test
  void testCollectsRecursivelyInPathOrder(@TempDir Path rtl) throws IOException {
    Files.createDirectories(rtl.resolve("core/alu"));
    Files.createDirectories(rtl.resolve(".git"));
    Files.createDirectories(rtl.resolve("skip_old"));
    Files.writeString(rtl.resolve("top.sv"), "");
    Files.writeString(rtl.resolve("core/core.v"), "");
    Files.writeString(rtl.resolve("core/alu/alu.sv"), "");
    Files.writeString(rtl.resolve("core/defs.svh"), "");
    Files.writeString(rtl.resolve("core/notes.txt"), "");
    Files.writeString(rtl.resolve(".git/hidden.sv"), "");
    Files.writeString(rtl.resolve("skip_old/old.sv"), "");

    List<String> relative = SourceCollector.collect(rtl.toFile())
                                .stream()
                                .map(file -> rtl.relativize(file.toPath()).toString().replace(File.separatorChar, '/'))
                                .collect(Collectors.toList());
    Assertions.assertEquals(List.of("core/alu/alu.sv", "core/core.v", "core/defs.svh", "top.sv"), relative);
  }

  @Test
  void testReadReplacesMalformedBytes(@TempDir Path rtl) throws IOException {
    Path file = rtl.resolve("latin1.sv");
    Files.write(file, "// Gr\u00f6\u00dfe\nmodule m; endmodule\n".getBytes(StandardCharsets.ISO_8859_1));
    String text = SourceCollector.read(file.toFile());
    Assertions.assertEquals("// Gr\uFFFD\uFFFDe\nmodule m; endmodule\n", text);

    Path utf8 = Files.writeString(rtl.resolve("utf8.sv"), "// Gr\u00f6\u00dfe\n", StandardCharsets.UTF_8);
    Assertions.assertEquals("// Gr\u00f6\u00dfe\n", SourceCollector.read(utf8.toFile()));
  }

  @Test
  void testSingleFile(@TempDir Path rtl) throws IOException {
    Path file = Files.writeString(rtl.resolve("design.sv"), "module m; endmodule");
    Assertions.assertEquals(List.of(file.toFile()), SourceCollector.collect(file.toFile()));
  }

  @Test
  void testMissingDirectory(@TempDir Path rtl) {
    Assertions.assertThrows(FileNotFoundException.class, () -> SourceCollector.collect(rtl.resolve("missing").toFile()));
  }
}
