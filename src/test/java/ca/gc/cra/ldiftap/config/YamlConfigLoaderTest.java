package ca.gc.cra.ldiftap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("ldif-tap.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          encoding: UTF-8
        extract:
          directoryPath: /data/exports
          batchSize: 250
          strictParsing: false
          objectClassFilter:
            - inetOrgPerson
            - groupOfNames
        discover:
          filePattern: "*.ldf"
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "extract");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("/data/exports", map.get("directoryPath"));
    assertEquals("250", map.get("batchSize"));
    assertEquals("false", map.get("strictParsing"));
    assertEquals("inetOrgPerson,groupOfNames", map.get("objectClassFilter"));
    assertFalse(map.containsKey("filePattern"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "extract").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "discover"));
  }

  @Test
  void rejectsNonMappingSections() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), "common: [1, 2]\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }

  @Test
  void rejectsMalformedYaml() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "extract: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }
}
