package com.gentoro.endnotemcp.snapshot;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.endnotemcp.config.StoreConfig;
import com.gentoro.endnotemcp.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotManagerTest {

  @TempDir Path tmp;

  private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

  private StoreConfig config(boolean snapshotMode) {
    return new StoreConfig(
        tmp.resolve("My Library.enl"), tmp.resolve("My Library.Data"), snapshotMode, false);
  }

  @Test
  @DisplayName("disabled snapshot mode always skips, whatever exists on disk")
  void skippedWhenDisabled() throws Exception {
    StoreConfig cfg = config(false);
    Files.writeString(cfg.enlFile(), "library");
    SnapshotManager manager = new SnapshotManager(cfg, clock);

    RefreshResult first = manager.refresh();
    Files.writeString(cfg.snapshotPath(), "stale");
    RefreshResult second = manager.refresh();

    for (RefreshResult result : new RefreshResult[] {first, second}) {
      assertEquals(RefreshStatus.SKIPPED, result.status());
      assertNull(result.filesize());
      assertTrue(result.message().contains("--use-backup"));
      assertEquals("2024-03-05 14:07:09", result.timestamp());
    }
    assertEquals("stale", Files.readString(cfg.snapshotPath()));
    assertTrue(manager.ensureFresh().isEmpty());
  }

  @Test
  void successReportsTheCopiedSize() throws Exception {
    StoreConfig cfg = config(true);
    byte[] content = new byte[4096 + 17];
    Files.write(cfg.enlFile(), content);
    Files.writeString(cfg.snapshotPath(), "old snapshot");
    SnapshotManager manager = new SnapshotManager(cfg, clock);

    RefreshResult result = manager.refresh();

    assertEquals(RefreshStatus.SUCCESS, result.status());
    assertEquals(Long.valueOf(content.length), result.filesize());
    assertEquals(".enl.backup refreshed successfully, size 4113 bytes.", result.message());
    assertEquals(content.length, Files.size(cfg.snapshotPath()));
    assertEquals(content.length, Files.size(cfg.enlFile()), "source must stay untouched");

    SnapshotFile snapshot = manager.lastSnapshot().orElseThrow();
    assertEquals(cfg.enlFile(), snapshot.sourcePath());
    assertEquals(tmp.resolve("My Library.enl.backup"), snapshot.snapshotPath());
    assertEquals(clock.instant(), snapshot.lastRefreshedAt());
  }

  @Test
  void missingSourceIsAnError() {
    SnapshotManager manager = new SnapshotManager(config(true), clock);

    RefreshResult result = manager.refresh();

    assertEquals(RefreshStatus.ERROR, result.status());
    assertNull(result.filesize());
    assertTrue(result.message().startsWith("Failed to refresh .enl.backup: "), result.message());
    assertTrue(manager.lastSnapshot().isEmpty());
  }

  @Test
  @DisplayName("startup refresh never throws and copies when possible")
  void ensureFreshIsBestEffort() throws Exception {
    StoreConfig cfg = config(true);
    SnapshotManager manager = new SnapshotManager(cfg, clock);

    assertTrue(manager.ensureFresh().isEmpty());
    assertFalse(Files.exists(cfg.snapshotPath()));

    Files.writeString(cfg.enlFile(), "library v1");
    assertTrue(manager.ensureFresh().isPresent());
    assertEquals("library v1", Files.readString(cfg.snapshotPath()));
  }

  @Test
  void serializesWithLowercaseStatusAndNullSize() {
    String json =
        JacksonUtility.toJson(
            new RefreshResult(RefreshStatus.SKIPPED, "off", "2024-03-05 14:07:09", null));

    assertTrue(json.contains("\"status\" : \"skipped\""), json);
    assertTrue(json.contains("\"filesize\" : null"), json);
  }
}
