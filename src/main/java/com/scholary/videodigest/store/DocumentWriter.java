package com.scholary.videodigest.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a whole JSON document on disk.
 *
 * <p>The new content is written to a temporary sibling and moved over the target. If serializing or
 * writing fails, the existing file is first copied to {@code <name>.<timestamp>.bak} and then the
 * failure is rethrown as {@link StorePersistenceException}, so the last good state is never lost.
 */
public class DocumentWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);

  private static final DateTimeFormatter BACKUP_SUFFIX =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

  private final Clock clock;

  public DocumentWriter(Clock clock) {
    this.clock = clock;
  }

  /** Produces the serialized document; may fail before anything touches the disk. */
  @FunctionalInterface
  public interface Content {
    byte[] bytes() throws IOException;
  }

  /**
   * Replace the document at {@code path}.
   *
   * @throws StorePersistenceException if the content cannot be produced or written
   */
  public void write(Path path, Content content) {
    try {
      byte[] bytes = content.bytes();
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = path.resolveSibling(path.getFileName() + ".tmp");
      Files.write(temp, bytes);
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException | RuntimeException e) {
      Path backup = backup(path);
      String note = backup != null ? " (previous copy at " + backup + ")" : "";
      throw new StorePersistenceException(String.format("Failed to write %s%s", path, note), e);
    }
  }

  /**
   * Copy the current document to a timestamped backup.
   *
   * @return the backup path, or null if there was nothing to back up or the copy failed
   */
  Path backup(Path path) {
    if (!Files.isRegularFile(path)) {
      return null;
    }
    String suffix = LocalDateTime.now(clock).format(BACKUP_SUFFIX);
    Path backup = path.resolveSibling(path.getFileName() + "." + suffix + ".bak");
    try {
      Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.warn("Backed up {} to {} after a failed write", path, backup);
      return backup;
    } catch (IOException e) {
      LOGGER.error("Could not back up {} to {}", path, backup, e);
      return null;
    }
  }
}
