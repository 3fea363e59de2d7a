package com.gentoro.endnotemcp.store;

import com.gentoro.endnotemcp.exception.StoreException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.sqlite.SQLiteConfig;

/**
 * Creates read-only SQLite data sources for an EndNote library. Each data source hands out one
 * shared connection, opened on first use and closed by {@link
 * SingleConnectionDataSource#destroy()}. A missing file is reported as a connection failure
 * instead of silently creating an empty database.
 */
public class ReadOnlyDataSourceFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(ReadOnlyDataSourceFactory.class);

  public SingleConnectionDataSource open(Path store) {
    log.debug("Opening reference store {}", store);
    if (!Files.isRegularFile(store)) {
      log.debug("Reference store {} does not exist", store);
      throw StoreException.connection(store.toString(), new NoSuchFileException(store.toString()));
    }
    SQLiteConfig sqlite = new SQLiteConfig();
    sqlite.setReadOnly(true);

    SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
    dataSource.setDriverClassName(org.sqlite.JDBC.class.getName());
    dataSource.setUrl("jdbc:sqlite:" + store);
    dataSource.setConnectionProperties(sqlite.toProperties());
    dataSource.setSuppressClose(true);
    return dataSource;
  }
}
