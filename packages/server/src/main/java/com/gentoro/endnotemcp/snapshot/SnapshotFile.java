package com.gentoro.endnotemcp.snapshot;

import java.nio.file.Path;
import java.time.Instant;

/** Outcome of a successful snapshot copy. */
public record SnapshotFile(
    Path sourcePath, Path snapshotPath, Instant lastRefreshedAt, long sizeBytes) {}
