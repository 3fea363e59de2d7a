package com.gentoro.endnotemcp.snapshot;

import com.gentoro.endnotemcp.config.StoreConfig;
import com.gentoro.endnotemcp.exception.IoException;
import com.gentoro.endnotemcp.utility.FileUtility;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Maintains the read-only snapshot ({@code <library>.enl.backup}) that replaces the live EndNote
 * database as the active store when snapshot mode is enabled.
 *
 * <p>A refresh is a plain whole-file overwrite. It is not isolated from EndNote writing to the
 * source at the same time: a copy racing a live write can produce a torn snapshot that fails to
 * open or returns inconsistent rows until the next successful refresh. Readers already connected
 * to the snapshot during a refresh may see the same effect. Closing EndNote before refreshing
 * avoids both, and also avoids the file lock that makes the copy fail on Windows.
 */
public class SnapshotManager {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(SnapshotManager.class);

  static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final StoreConfig config;
  private final Clock clock;
  private volatile SnapshotFile lastSnapshot;

  public SnapshotManager(StoreConfig config) {
    this(config, Clock.systemDefaultZone());
  }

  public SnapshotManager(StoreConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Startup refresh. Does nothing when snapshot mode is off. A failed copy is logged and
   * swallowed: the server still starts against the (possibly stale or missing) snapshot.
   */
  public Optional<SnapshotFile> ensureFresh() {
    if (!config.snapshotMode()) {
      return Optional.empty();
    }
    try {
      SnapshotFile snapshot = copySnapshot();
      log.info("Snapshot {} refreshed at {}", snapshot.snapshotPath(), currentTimestamp());
      return Optional.of(snapshot);
    } catch (IoException e) {
      log.warn("Failed to refresh snapshot at startup: {}", e.getMessage());
      log.debug("Snapshot copy failure", e);
      return Optional.empty();
    }
  }

  /** On-demand refresh backing the {@code refresh_backup} tool. Never throws. */
  public synchronized RefreshResult refresh() {
    if (!config.snapshotMode()) {
      return new RefreshResult(
          RefreshStatus.SKIPPED,
          "Backup mode is not enabled. Cannot refresh .enl.backup. Please use the --use-backup"
              + " option.",
          currentTimestamp(),
          null);
    }
    try {
      SnapshotFile snapshot = copySnapshot();
      String msg =
          ".enl.backup refreshed successfully, size %d bytes.".formatted(snapshot.sizeBytes());
      log.debug("refresh_backup: {}", msg);
      return new RefreshResult(
          RefreshStatus.SUCCESS, msg, currentTimestamp(), snapshot.sizeBytes());
    } catch (IoException e) {
      String err = "Failed to refresh .enl.backup: " + e.getMessage();
      log.warn("refresh_backup: {}", err);
      return new RefreshResult(RefreshStatus.ERROR, err, currentTimestamp(), null);
    }
  }

  /** Most recent successful copy made by this process, if any. */
  public Optional<SnapshotFile> lastSnapshot() {
    return Optional.ofNullable(lastSnapshot);
  }

  private synchronized SnapshotFile copySnapshot() {
    Path source = config.enlFile();
    Path target = config.snapshotPath();
    log.debug("Copying {} to {}", source, target);
    long size = FileUtility.copyFile(source, target);
    SnapshotFile snapshot = new SnapshotFile(source, target, clock.instant(), size);
    this.lastSnapshot = snapshot;
    return snapshot;
  }

  /** Wall-clock time in the {@code yyyy-MM-dd HH:mm:ss} format used by refresh responses. */
  public String currentTimestamp() {
    return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
  }
}
