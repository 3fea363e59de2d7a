package com.gentoro.endnotemcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.endnotemcp.config.StoreConfig;
import com.gentoro.endnotemcp.document.DocumentResolver;
import com.gentoro.endnotemcp.document.TextExtractor;
import com.gentoro.endnotemcp.facade.QueryFacade;
import com.gentoro.endnotemcp.snapshot.SnapshotManager;
import com.gentoro.endnotemcp.store.ReferenceRepository;
import com.gentoro.endnotemcp.testing.TestLibrary;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PaperToolsTest {

  @TempDir Path tmp;

  private Map<String, McpServerFeatures.SyncToolSpecification> tools;

  @BeforeEach
  void setUp() throws Exception {
    StoreConfig config = new StoreConfig(tmp.resolve("lib.enl"), tmp.resolve("lib"), false, false);
    TestLibrary.create(config.enlFile())
        .addReference(1, "Knowledge Distillation Review", "2021")
        .addReference(2, "Attention Is All You Need", "2017")
        .attachFile(1, "internal-pdf://papers/kd.pdf");
    TestLibrary.writePdf(tmp.resolve("lib/PDF/papers/kd.pdf"), "Teacher and student.");

    QueryFacade facade =
        new QueryFacade(
            new ReferenceRepository(config),
            new DocumentResolver(config),
            new TextExtractor(),
            new SnapshotManager(config));
    tools =
        new PaperTools(facade)
            .specifications().stream()
                .collect(Collectors.toMap(s -> s.tool().name(), Function.identity()));
  }

  private JsonNode call(String name, Map<String, Object> arguments) throws Exception {
    McpSchema.CallToolResult result =
        tools.get(name).callHandler().apply(null, new McpSchema.CallToolRequest(name, arguments));
    assertNotEquals(Boolean.TRUE, result.isError());
    String text = ((McpSchema.TextContent) result.content().get(0)).text();
    return new ObjectMapper().readTree(text);
  }

  @Test
  void registersTheFourTools() {
    assertEquals(
        Set.of("list_papers", "search_papers", "read_paper", "refresh_backup"),
        tools.keySet());
    assertEquals(
        List.of("query"), tools.get(PaperTools.SEARCH_PAPERS).tool().inputSchema().required());
  }

  @Test
  void listPapersUsesDefaultsWhenArgumentsAreMissing() throws Exception {
    JsonNode papers = call(PaperTools.LIST_PAPERS, Map.of());

    assertEquals(2, papers.size());
    assertEquals(2, papers.get(0).get("id").asInt());
    assertTrue(papers.get(0).has("abstract"));
    assertTrue(papers.get(0).get("filepath").isNull());
  }

  @Test
  void listPapersHonoursPaging() throws Exception {
    JsonNode papers = call(PaperTools.LIST_PAPERS, Map.of("offset", 1, "limit", 1));

    assertEquals(1, papers.size());
    assertEquals(1, papers.get(0).get("id").asInt());
  }

  @Test
  void searchPapersMatchesTitles() throws Exception {
    JsonNode papers = call(PaperTools.SEARCH_PAPERS, Map.of("query", "ATTENTION"));

    assertEquals(1, papers.size());
    assertEquals("Attention Is All You Need", papers.get(0).get("title").asText());
  }

  @Test
  void readPaperReturnsText() throws Exception {
    JsonNode paper = call(PaperTools.READ_PAPER, Map.of("title", "distillation"));

    assertEquals(1, paper.get("id").asInt());
    assertTrue(paper.get("text").asText().contains("Teacher and student."));
  }

  @Test
  void readPaperReportsMissingMatchAsErrorField() throws Exception {
    JsonNode paper = call(PaperTools.READ_PAPER, Map.of("title", "nothing like it"));

    assertEquals(
        "No paper found with title containing 'nothing like it' or no PDF attached.",
        paper.get("error").asText());
  }

  @Test
  void refreshBackupIsSkippedWithoutSnapshotMode() throws Exception {
    JsonNode result = call(PaperTools.REFRESH_BACKUP, Map.of());

    assertEquals("skipped", result.get("status").asText());
    assertTrue(result.get("filesize").isNull());
  }

  @Test
  void invokeTurnsExceptionsIntoErrorResults() {
    McpSchema.CallToolResult result =
        PaperTools.invoke(
            "broken",
            () -> {
              throw new IllegalStateException("tool failed");
            });

    assertTrue(result.isError());
    assertEquals("tool failed", ((McpSchema.TextContent) result.content().get(0)).text());
  }
}
