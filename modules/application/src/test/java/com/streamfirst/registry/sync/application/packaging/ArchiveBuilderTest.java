package com.streamfirst.registry.sync.application.packaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveBuilderTest {

  @TempDir Path tempDir;

  /** Reads a tar.gz into archive path to content, in archive order. */
  static Map<String, String> readArchive(InputStream archive) throws IOException {
    Map<String, String> entries = new LinkedHashMap<>();
    try (TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(archive))) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        entries.put(entry.getName(), new String(tar.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return entries;
  }

  static Map<String, String> readArchive(Path archive) throws IOException {
    try (InputStream in = Files.newInputStream(archive)) {
      return readArchive(in);
    }
  }

  @Test
  void same_content_gives_identical_bytes() throws Exception {
    Path data = Files.createDirectories(tempDir.resolve("data"));
    Files.writeString(data.resolve("weights.bin"), "weights");
    Files.writeString(data.resolve("config.json"), "{}");

    Path first = tempDir.resolve("first.tar.gz");
    new ArchiveBuilder()
        .addBytes("requirements.txt", "mlflow\n".getBytes(StandardCharsets.UTF_8))
        .addTree("model", data)
        .writeTo(first);

    // Later file times and a different insertion order change nothing
    Files.setLastModifiedTime(data.resolve("weights.bin"), FileTime.fromMillis(42));
    Path second = tempDir.resolve("second.tar.gz");
    new ArchiveBuilder()
        .addTree("model", data)
        .addBytes("requirements.txt", "mlflow\n".getBytes(StandardCharsets.UTF_8))
        .writeTo(second);

    assertThat(Files.mismatch(first, second)).isEqualTo(-1L);
  }

  @Test
  void entries_are_written_in_path_order() throws Exception {
    Path archive = tempDir.resolve("model.tar.gz");
    new ArchiveBuilder()
        .addBytes("z.txt", "z".getBytes(StandardCharsets.UTF_8))
        .addBytes("./a.txt", "a".getBytes(StandardCharsets.UTF_8))
        .addBytes("/m/n.txt", "n".getBytes(StandardCharsets.UTF_8))
        .writeTo(archive);

    List<String> names = new ArrayList<>(readArchive(archive).keySet());
    assertThat(names).containsExactly("a.txt", "m/n.txt", "z.txt");
  }

  @Test
  void later_entry_replaces_earlier_one() throws Exception {
    Path archive = tempDir.resolve("model.tar.gz");
    ArchiveBuilder builder =
        new ArchiveBuilder()
            .addBytes("inference.py", "default".getBytes(StandardCharsets.UTF_8))
            .addBytes("inference.py", "custom".getBytes(StandardCharsets.UTF_8));
    builder.writeTo(archive);

    assertThat(builder.contains("inference.py")).isTrue();
    assertThat(readArchive(archive)).containsExactly(Map.entry("inference.py", "custom"));
  }

  @Test
  void rejects_paths_escaping_the_archive() {
    ArchiveBuilder builder = new ArchiveBuilder();

    assertThatThrownBy(() -> builder.addBytes("../etc/passwd", new byte[0]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.addBytes("/", new byte[0]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.addBytes("model/../../etc/passwd", new byte[0]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void double_dots_inside_a_file_name_are_kept() throws Exception {
    Path data = Files.createDirectories(tempDir.resolve("data"));
    Files.writeString(data.resolve("model..pkl"), "pickled");

    Path archive = tempDir.resolve("dots.tar.gz");
    new ArchiveBuilder()
        .addTree("", data)
        .addBytes("extra..txt", "x".getBytes(StandardCharsets.UTF_8))
        .writeTo(archive);

    assertThat(readArchive(archive)).containsOnlyKeys("extra..txt", "model..pkl");
  }
}
