package com.gentoro.endnotemcp.facade;

import com.gentoro.endnotemcp.document.DocumentResolver;
import com.gentoro.endnotemcp.document.ExtractionResult;
import com.gentoro.endnotemcp.document.TextExtractor;
import com.gentoro.endnotemcp.exception.ExceptionUtil;
import com.gentoro.endnotemcp.exception.StoreException;
import com.gentoro.endnotemcp.snapshot.RefreshResult;
import com.gentoro.endnotemcp.snapshot.RefreshStatus;
import com.gentoro.endnotemcp.snapshot.SnapshotManager;
import com.gentoro.endnotemcp.store.PageRequest;
import com.gentoro.endnotemcp.store.Reference;
import com.gentoro.endnotemcp.store.ReferenceRepository;
import com.gentoro.endnotemcp.store.StoreResult;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The four operations exposed as MCP tools. Every method returns a well-formed result for any
 * input: store and document failures become empty lists or error records, never exceptions.
 */
public class QueryFacade {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(QueryFacade.class);

  static final String CONNECTION_FAILED = "Database connection failed.";

  private final ReferenceRepository repository;
  private final DocumentResolver resolver;
  private final TextExtractor extractor;
  private final SnapshotManager snapshots;

  public QueryFacade(
      ReferenceRepository repository,
      DocumentResolver resolver,
      TextExtractor extractor,
      SnapshotManager snapshots) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
  }

  /** Arguments are loosely typed: anything that is not a usable integer gets its default. */
  public List<PaperRecord> listPapers(Object offset, Object limit) {
    log.debug("list_papers(offset={}, limit={}) called", offset, limit);
    try {
      return toRecords(repository.listPage(PageRequest.of(offset, limit)), "list_papers");
    } catch (RuntimeException e) {
      log.error("list_papers failed unexpectedly", e);
      return List.of();
    }
  }

  public List<PaperRecord> searchPapers(String query) {
    log.debug("search_papers(query={}) called", query);
    try {
      return toRecords(repository.searchByTitle(query), "search_papers");
    } catch (RuntimeException e) {
      log.error("search_papers failed unexpectedly", e);
      return List.of();
    }
  }

  public PaperResult readPaper(String title) {
    log.debug("read_paper(title={}) called", title);
    try {
      StoreResult<Optional<Reference>> match = repository.findFirstByTitle(title);
      if (!match.isSuccess()) {
        StoreException error = match.error().orElseThrow();
        log.warn("read_paper: {}", error.getMessage());
        return new ErrorRecord(
            error.isConnectionFailure()
                ? CONNECTION_FAILED
                : "Exception: " + ExceptionUtil.describe(error.getCause()));
      }

      Optional<Reference> reference = match.value();
      if (reference.isEmpty()) {
        return new ErrorRecord(
            "No paper found with title containing '%s' or no PDF attached.".formatted(title));
      }

      Reference ref = reference.get();
      ExtractionResult extraction = extractDocument(ref.filepath());
      if (!extraction.isSuccess()) {
        log.warn("read_paper: {}", extraction.error());
      }
      return PaperContent.of(ref, extraction.content());
    } catch (RuntimeException e) {
      log.error("read_paper failed unexpectedly", e);
      return new ErrorRecord("Exception: " + ExceptionUtil.describe(e));
    }
  }

  private ExtractionResult extractDocument(String storedPath) {
    Path document;
    try {
      document = resolver.resolve(storedPath);
    } catch (InvalidPathException e) {
      // not encodable in the platform file-name charset
      log.debug("Stored path {} has no local form: {}", storedPath, e.getMessage());
      return ExtractionResult.notFound(storedPath);
    }
    log.debug("PDF path resolved: {}", document);
    return extractor.extract(document);
  }

  public RefreshResult refreshBackup() {
    log.debug("refresh_backup() called");
    try {
      return snapshots.refresh();
    } catch (RuntimeException e) {
      log.error("refresh_backup failed unexpectedly", e);
      return new RefreshResult(
          RefreshStatus.ERROR,
          "Failed to refresh .enl.backup: " + ExceptionUtil.describe(e),
          snapshots.currentTimestamp(),
          null);
    }
  }

  private static List<PaperRecord> toRecords(StoreResult<List<Reference>> result, String tool) {
    if (!result.isSuccess()) {
      log.warn("{}: {}", tool, result.error().map(Throwable::getMessage).orElse("unknown error"));
      return List.of();
    }
    return result.value().stream().map(PaperRecord::from).toList();
  }
}
