package com.gentoro.endnotemcp.config;

import com.gentoro.endnotemcp.StartupParameters;
import com.gentoro.endnotemcp.exception.ConfigException;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable store configuration, built once at startup and handed to every component that needs
 * it.
 *
 * <p>Command line parameters take precedence over the YAML keys {@code store.enl-file}, {@code
 * store.data-folder}, {@code store.use-backup}, {@code store.backup-suffix} and {@code
 * logging.verbose}.
 */
public record StoreConfig(
    /** The EndNote {@code .enl} database as given by the user. Never modified. */
    Path enlFile,
    /** The {@code .Data} folder; documents live in its {@code PDF} subfolder. */
    Path dataFolder,
    /** When set, every read goes to {@link #snapshotPath()} instead of {@link #enlFile()}. */
    boolean snapshotMode,
    boolean verboseLogging,
    /** Appended to the store file name to derive the snapshot file name. */
    String snapshotSuffix) {

  public static final String DEFAULT_SNAPSHOT_SUFFIX = ".backup";

  public StoreConfig {
    Objects.requireNonNull(enlFile, "enlFile");
    Objects.requireNonNull(dataFolder, "dataFolder");
    if (snapshotSuffix == null || snapshotSuffix.isBlank()) {
      snapshotSuffix = DEFAULT_SNAPSHOT_SUFFIX;
    }
  }

  public StoreConfig(Path enlFile, Path dataFolder, boolean snapshotMode, boolean verboseLogging) {
    this(enlFile, dataFolder, snapshotMode, verboseLogging, DEFAULT_SNAPSHOT_SUFFIX);
  }

  /** Location of the derived snapshot, beside the original store. */
  public Path snapshotPath() {
    return enlFile.resolveSibling(enlFile.getFileName().toString() + snapshotSuffix);
  }

  /** The file every repository operation opens. */
  public Path activeStorePath() {
    return snapshotMode ? snapshotPath() : enlFile;
  }

  public static StoreConfig from(StartupParameters parameters, Configuration cfg) {
    String enl =
        parameters
            .getOptionalParameter(StartupParameters.ENL_FILE, String.class)
            .orElse(cfg.getString("store.enl-file", null));
    String data =
        parameters
            .getOptionalParameter(StartupParameters.DATA_FOLDER, String.class)
            .orElse(cfg.getString("store.data-folder", null));
    if (enl == null || enl.isBlank()) {
      throw new ConfigException(
          "Missing EndNote library: pass --enl-file or set store.enl-file");
    }
    if (data == null || data.isBlank()) {
      throw new ConfigException(
          "Missing EndNote data folder: pass --data-folder or set store.data-folder");
    }

    boolean snapshot =
        parameters.isFlagSet(StartupParameters.USE_BACKUP)
            || cfg.getBoolean("store.use-backup", false);
    boolean verbose =
        parameters.isFlagSet(StartupParameters.ENABLE_LOG)
            || cfg.getBoolean("logging.verbose", false);

    return new StoreConfig(
        Path.of(enl.trim()).toAbsolutePath().normalize(),
        Path.of(data.trim()).toAbsolutePath().normalize(),
        snapshot,
        verbose,
        cfg.getString("store.backup-suffix", DEFAULT_SNAPSHOT_SUFFIX));
  }
}
