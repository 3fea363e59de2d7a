package com.gentoro.endnotemcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.endnotemcp.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tmp;

  @Test
  void loadsBundledDefaults() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();

    assertEquals("stdio", cfg.getString("mcp.mode"));
    assertFalse(cfg.getBoolean("store.use-backup"));
    assertEquals(".backup", cfg.getString("store.backup-suffix"));
  }

  @Test
  void loadsFileByPathAndUri() throws Exception {
    Path yaml =
        Files.writeString(
            tmp.resolve("endnote.yaml"),
            """
            store:
              enl-file: /lib/My Library.enl
              use-backup: true
            """);

    Configuration byPath = new ConfigurationProvider(yaml.toString()).config();
    Configuration byUri = new ConfigurationProvider(yaml.toUri().toString()).config();

    assertEquals("/lib/My Library.enl", byPath.getString("store.enl-file"));
    assertTrue(byUri.getBoolean("store.use-backup"));
  }

  @Test
  void missingFileIsAConfigError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tmp.resolve("absent.yaml").toString()));
  }

  @Test
  void envLookupFallsBackToFile() throws Exception {
    Path env =
        Files.writeString(
            tmp.resolve(".env.local"),
            """
            # local overrides
            ENDNOTE_TEST_LIBRARY="/lib/From Env.enl"
            ENDNOTE_TEST_PLAIN=plain
            """);
    ConfigurationProvider.FallbackEnvLookup lookup =
        new ConfigurationProvider.FallbackEnvLookup(env);

    assertEquals("/lib/From Env.enl", lookup.lookup("ENDNOTE_TEST_LIBRARY"));
    assertEquals("plain", lookup.lookup("ENDNOTE_TEST_PLAIN"));
    assertNull(lookup.lookup("ENDNOTE_TEST_ABSENT"));
  }
}
