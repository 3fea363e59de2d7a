package com.gentoro.endnotemcp.store;

import com.gentoro.endnotemcp.config.StoreConfig;
import com.gentoro.endnotemcp.exception.StoreException;
import com.gentoro.endnotemcp.utility.StringUtility;
import java.nio.file.Path;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Read-only queries over the EndNote {@code refs} table joined with its attached files.
 *
 * <p>Every operation opens its own connection to {@link StoreConfig#activeStorePath()} and closes
 * it before returning, whatever the outcome. Nothing is cached between calls, so a refreshed
 * snapshot is picked up by the next query. Failures are returned as {@link StoreResult#failure}
 * and never thrown.
 *
 * <p>Title matching uses SQLite {@code LIKE}: ASCII letters compare case-insensitively, every
 * other character (CJK titles included) must match exactly.
 */
public class ReferenceRepository {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(ReferenceRepository.class);

  // One file per reference: several file_res rows for the same reference collapse to the
  // smallest path so ids never repeat.
  private static final String SELECT_REFERENCES =
      """
      SELECT r.id, r.title, r.author, r.year, r.secondary_title, r.abstract, %s AS keywords,
             f.file_path AS filepath
      FROM refs r
      LEFT JOIN (SELECT refs_id, MIN(file_path) AS file_path FROM file_res GROUP BY refs_id) f
        ON r.id = f.refs_id
      """;

  private static final String TITLE_FILTER =
      "WHERE r.title LIKE ? ESCAPE '" + StringUtility.LIKE_ESCAPE + "'\n";

  private static final RowMapper<Reference> REFERENCE_ROW_MAPPER =
      (rs, rowNum) ->
          new Reference(
              rs.getLong("id"),
              rs.getString("title"),
              rs.getString("author"),
              rs.getString("year"),
              rs.getString("secondary_title"),
              rs.getString("abstract"),
              rs.getString("keywords"),
              rs.getString("filepath"));

  // Older library schemas have no keywords column.
  private static final ConnectionCallback<Boolean> HAS_KEYWORDS_COLUMN =
      conn -> {
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet columns = meta.getColumns(null, null, "refs", "%")) {
          while (columns.next()) {
            if ("keywords".equalsIgnoreCase(columns.getString("COLUMN_NAME"))) {
              return true;
            }
          }
        }
        return false;
      };

  private final StoreConfig config;
  private final ReadOnlyDataSourceFactory dataSources;

  public ReferenceRepository(StoreConfig config) {
    this(config, new ReadOnlyDataSourceFactory());
  }

  public ReferenceRepository(StoreConfig config, ReadOnlyDataSourceFactory dataSources) {
    this.config = Objects.requireNonNull(config, "config");
    this.dataSources = Objects.requireNonNull(dataSources, "dataSources");
  }

  /** Page of references, newest entries (highest id) first. */
  public StoreResult<List<Reference>> listPage(PageRequest page) {
    PageRequest window = page == null ? PageRequest.first() : page;
    return execute(
        "listPage",
        jdbc -> {
          String sql = selectClause(jdbc) + "ORDER BY r.id DESC LIMIT ? OFFSET ?";
          log.debug(
              "Executing SQL: {} | limit={}, offset={}", sql, window.limit(), window.offset());
          return logged(jdbc.query(sql, REFERENCE_ROW_MAPPER, window.limit(), window.offset()));
        });
  }

  public StoreResult<List<Reference>> listPage(int offset, int limit) {
    return listPage(new PageRequest(offset, limit));
  }

  /**
   * References whose title contains {@code query}, ordered by year descending (text ordering).
   * An empty or null query returns every reference.
   */
  public StoreResult<List<Reference>> searchByTitle(String query) {
    String q = query == null ? "" : query;
    return execute(
        "searchByTitle",
        jdbc -> {
          String sql = selectClause(jdbc) + titleFilter(q) + "ORDER BY r.year DESC";
          log.debug("Executing SQL: {} | query=%{}%", sql, q);
          return logged(jdbc.query(sql, REFERENCE_ROW_MAPPER, titleArgs(q)));
        });
  }

  /**
   * First reference whose title contains {@code title} and which has a document attached. Which
   * row comes first among several matches is up to SQLite. An empty optional means no match, or
   * a match without a document.
   */
  public StoreResult<Optional<Reference>> findFirstByTitle(String title) {
    String q = title == null ? "" : title;
    return execute(
        "findFirstByTitle",
        jdbc -> {
          String sql = selectClause(jdbc) + titleFilter(q) + "LIMIT 1";
          log.debug("Executing SQL: {} | title=%{}%", sql, q);
          List<Reference> rows = logged(jdbc.query(sql, REFERENCE_ROW_MAPPER, titleArgs(q)));
          if (rows.isEmpty() || !rows.get(0).hasDocument()) {
            log.debug("No matching paper found or no PDF: title={}", q);
            return Optional.<Reference>empty();
          }
          return Optional.of(rows.get(0));
        });
  }

  private <T> StoreResult<T> execute(String operation, Function<JdbcTemplate, T> work) {
    Path store = config.activeStorePath();
    SingleConnectionDataSource dataSource = null;
    try {
      dataSource = dataSources.open(store);
      return StoreResult.success(work.apply(new JdbcTemplate(dataSource)));
    } catch (StoreException e) {
      log.debug("{} could not reach the store: {}", operation, e.getMessage());
      return StoreResult.failure(e);
    } catch (CannotGetJdbcConnectionException e) {
      log.debug("{} could not connect: {}", operation, e.getMessage());
      return StoreResult.failure(StoreException.connection(store.toString(), e));
    } catch (RuntimeException e) {
      log.debug("{} exception: {}", operation, e.getMessage());
      return StoreResult.failure(StoreException.query(operation, store.toString(), e));
    } finally {
      if (dataSource != null) {
        dataSource.destroy();
      }
    }
  }

  private static String selectClause(JdbcTemplate jdbc) {
    Boolean keywords = jdbc.execute(HAS_KEYWORDS_COLUMN);
    return SELECT_REFERENCES.formatted(Boolean.TRUE.equals(keywords) ? "r.keywords" : "NULL");
  }

  private static String titleFilter(String query) {
    return query.isEmpty() ? "" : TITLE_FILTER;
  }

  private static Object[] titleArgs(String query) {
    return query.isEmpty() ? new Object[0] : new Object[] {StringUtility.containsPattern(query)};
  }

  private static List<Reference> logged(List<Reference> rows) {
    log.debug("Query returned {} row(s)", rows.size());
    return rows;
  }
}
