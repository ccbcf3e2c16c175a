package com.streamfirst.registry.sync.application.packaging;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

/**
 * Builds reproducible {@code tar.gz} archives: the same inputs always produce byte-identical output.
 * Entries are written in path order with zeroed timestamps and ownership, and the gzip header carries
 * no modification time, so the archive hash identifies its content.
 */
public final class ArchiveBuilder {

  private static final int FILE_MODE = 0100644;

  private final SortedMap<String, Content> entries = new TreeMap<>();

  private record Content(Path file, byte[] bytes) {
    long size() throws IOException {
      return file != null ? Files.size(file) : bytes.length;
    }

    void writeTo(OutputStream out) throws IOException {
      if (file != null) {
        Files.copy(file, out);
      } else {
        out.write(bytes);
      }
    }
  }

  /** Adds a local file at the given archive path, replacing an earlier entry with the same path. */
  public ArchiveBuilder addFile(String archivePath, Path file) {
    entries.put(normalize(archivePath), new Content(file, null));
    return this;
  }

  /** Adds in-memory content at the given archive path. */
  public ArchiveBuilder addBytes(String archivePath, byte[] bytes) {
    entries.put(normalize(archivePath), new Content(null, bytes.clone()));
    return this;
  }

  /**
   * Adds every regular file below a directory, placed under {@code archiveDirectory}. An empty
   * archive directory means the archive root.
   */
  public ArchiveBuilder addTree(String archiveDirectory, Path directory) throws IOException {
    try (Stream<Path> files = Files.walk(directory)) {
      for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile).sorted()::iterator) {
        String relative = directory.relativize(file).toString().replace('\\', '/');
        String archivePath =
            archiveDirectory == null || archiveDirectory.isEmpty()
                ? relative
                : archiveDirectory + "/" + relative;
        addFile(archivePath, file);
      }
    }
    return this;
  }

  public boolean contains(String archivePath) {
    return entries.containsKey(normalize(archivePath));
  }

  /** Archive paths currently added, in the order they will be written. */
  public Map<String, ?> entries() {
    return Collections.unmodifiableMap(entries);
  }

  /** Writes the archive, replacing {@code target} if it exists. */
  public void writeTo(Path target) throws IOException {
    GzipParameters parameters = new GzipParameters();
    parameters.setModificationTime(0L);
    try (OutputStream file = new BufferedOutputStream(Files.newOutputStream(target));
        GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(file, parameters);
        TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
      tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
      tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
      for (Map.Entry<String, Content> entry : entries.entrySet()) {
        TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey());
        tarEntry.setSize(entry.getValue().size());
        tarEntry.setModTime(0L);
        tarEntry.setMode(FILE_MODE);
        tarEntry.setIds(0, 0);
        tarEntry.setNames("", "");
        tar.putArchiveEntry(tarEntry);
        entry.getValue().writeTo(tar);
        tar.closeArchiveEntry();
      }
      tar.finish();
    }
  }

  private static String normalize(String archivePath) {
    String path = archivePath.replace('\\', '/');
    while (path.startsWith("./")) {
      path = path.substring(2);
    }
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    if (path.isEmpty() || Arrays.asList(path.split("/")).contains("..")) {
      throw new IllegalArgumentException("Invalid archive path: " + archivePath);
    }
    return path;
  }
}
