package com.gentoro.endnotemcp.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.endnotemcp.StartupParameters;
import com.gentoro.endnotemcp.exception.ConfigException;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;

class StoreConfigTest {

  @Test
  void snapshotSitsBesideTheStore() {
    StoreConfig cfg =
        new StoreConfig(
            Path.of("/lib/My Library.enl"), Path.of("/lib/My Library.Data"), true, false);

    assertEquals(Path.of("/lib/My Library.enl.backup"), cfg.snapshotPath());
    assertEquals(cfg.snapshotPath(), cfg.activeStorePath());
  }

  @Test
  void originalStoreIsActiveWithoutSnapshotMode() {
    StoreConfig cfg = new StoreConfig(Path.of("/lib/a.enl"), Path.of("/lib/a.Data"), false, true);

    assertEquals(Path.of("/lib/a.enl"), cfg.activeStorePath());
    assertTrue(cfg.verboseLogging());
    assertEquals(StoreConfig.DEFAULT_SNAPSHOT_SUFFIX, cfg.snapshotSuffix());
  }

  @Test
  void commandLineOverridesConfiguration() {
    Configuration yaml = new BaseConfiguration();
    yaml.setProperty("store.enl-file", "/yaml/lib.enl");
    yaml.setProperty("store.data-folder", "/yaml/lib.Data");
    yaml.setProperty("store.backup-suffix", ".snap");

    StoreConfig cfg =
        StoreConfig.from(
            new StartupParameters(new String[] {"--enl-file", "/cli/lib.enl", "--use-backup"}),
            yaml);

    assertEquals(Path.of("/cli/lib.enl"), cfg.enlFile());
    assertEquals(Path.of("/yaml/lib.Data"), cfg.dataFolder());
    assertTrue(cfg.snapshotMode());
    assertFalse(cfg.verboseLogging());
    assertEquals(Path.of("/cli/lib.enl.snap"), cfg.activeStorePath());
  }

  @Test
  void configurationAloneIsEnough() {
    Configuration yaml = new BaseConfiguration();
    yaml.setProperty("store.enl-file", "/yaml/lib.enl");
    yaml.setProperty("store.data-folder", "/yaml/lib.Data");
    yaml.setProperty("logging.verbose", true);

    StoreConfig cfg = StoreConfig.from(new StartupParameters(new String[0]), yaml);

    assertFalse(cfg.snapshotMode());
    assertTrue(cfg.verboseLogging());
  }

  @Test
  void missingPathsAreConfigErrors() {
    Configuration empty = new BaseConfiguration();

    assertThrows(
        ConfigException.class, () -> StoreConfig.from(new StartupParameters(new String[0]), empty));
    assertThrows(
        ConfigException.class,
        () -> StoreConfig.from(new StartupParameters(new String[] {"-e", "/x.enl"}), empty));
  }
}
