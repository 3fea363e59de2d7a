package com.gentoro.endnotemcp.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class StoreExceptionTest {

  @Test
  void connectionFailureCarriesStorePath() {
    StoreException e = StoreException.connection("/lib/a.enl", new NoSuchFileException("a.enl"));

    assertTrue(e.isConnectionFailure());
    assertEquals(EndnoteMcpErrorCode.STORE_CONNECTION_ERROR, e.getCode());
    assertEquals("/lib/a.enl", e.getContext().get("store"));
    assertTrue(e.toString().contains("cause=NoSuchFileException"));
  }

  @Test
  void queryFailureNamesTheOperation() {
    StoreException e =
        StoreException.query("listPage", "/lib/a.enl", new SQLException("no such table: refs"));

    assertFalse(e.isConnectionFailure());
    assertEquals("listPage failed: no such table: refs", e.getMessage());
    assertEquals("listPage", e.getContext().get("operation"));
  }

  @Test
  void describeFallsBackToClassName() {
    assertEquals("boom", ExceptionUtil.describe(new IllegalStateException("boom")));
    assertEquals("IllegalStateException", ExceptionUtil.describe(new IllegalStateException()));
    assertEquals("unknown error", ExceptionUtil.describe(null));
  }

  @Test
  void compactStackTraceIsSingleLine() {
    String trace = ExceptionUtil.formatCompactStackTrace(new RuntimeException(), 3);

    assertFalse(trace.contains("\n"));
    assertTrue(trace.startsWith(StoreExceptionTest.class.getName()));
    assertTrue(trace.split(" > ").length <= 3);
  }
}
