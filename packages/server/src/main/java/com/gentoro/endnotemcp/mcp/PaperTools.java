package com.gentoro.endnotemcp.mcp;

import com.gentoro.endnotemcp.exception.ExceptionUtil;
import com.gentoro.endnotemcp.facade.QueryFacade;
import com.gentoro.endnotemcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * MCP tool definitions for the reference library. Each tool forwards to one {@link QueryFacade}
 * operation and returns its record serialized as JSON text content.
 */
public class PaperTools {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(PaperTools.class);

  public static final String LIST_PAPERS = "list_papers";
  public static final String SEARCH_PAPERS = "search_papers";
  public static final String READ_PAPER = "read_paper";
  public static final String REFRESH_BACKUP = "refresh_backup";

  /** Signatures printed at startup. */
  public static final List<String> SIGNATURES =
      List.of(
          "list_papers(offset: int = 0, limit: int = 10)",
          "search_papers(query: str)",
          "read_paper(title: str)",
          "refresh_backup()");

  private final QueryFacade facade;

  public PaperTools(QueryFacade facade) {
    this.facade = Objects.requireNonNull(facade, "facade");
  }

  public List<McpServerFeatures.SyncToolSpecification> specifications() {
    return List.of(
        tool(
            LIST_PAPERS,
            "Return references in the EndNote library with pagination. Use offset (int, default 0)"
                + " and limit (int, default 10) to fetch a page of results. Returns a list of dicts"
                + " with fields: id, title, author, year, journal, abstract, keywords, filepath."
                + " Typical: list_papers(offset=0, limit=10).",
            schema(
                properties(
                    "offset", Map.of("type", "integer", "default", 0, "minimum", 0),
                    "limit", Map.of("type", "integer", "default", 10, "minimum", 1)),
                List.of()),
            args -> facade.listPapers(args.get("offset"), args.get("limit"))),
        tool(
            SEARCH_PAPERS,
            "Fuzzy search references by title in the EndNote library. Use when the user only knows"
                + " part of the title or keywords, or wants to find related topics. Parameter:"
                + " query (string, case-insensitive, supports Chinese/English). Returns a list of"
                + " dicts with fields: id, title, author, year, journal, abstract, keywords,"
                + " filepath. Typical: search_papers('distillation').",
            schema(properties("query", Map.of("type", "string")), List.of("query")),
            args -> facade.searchPapers(stringArg(args, "query"))),
        tool(
            READ_PAPER,
            "Find a paper by (fuzzy) title and return its metadata and PDF full text. Use when the"
                + " user needs the full content and bibliographic info of a paper. Parameter: title"
                + " (string, case-insensitive, fuzzy match). Returns a dict with fields: id, title,"
                + " author, year, journal, abstract, keywords, filepath, text. Typical:"
                + " read_paper('Knowledge Distillation Review').",
            schema(properties("title", Map.of("type", "string")), List.of("title")),
            args -> facade.readPaper(stringArg(args, "title"))),
        tool(
            REFRESH_BACKUP,
            "Manually refresh the .enl.backup file (only available when backup mode is enabled)."
                + " No effect if backup mode is off. You must close EndNote before refreshing,"
                + " otherwise the operation will fail due to file locking.",
            schema(Map.of(), List.of()),
            args -> facade.refreshBackup()));
  }

  private static McpServerFeatures.SyncToolSpecification tool(
      String name,
      String description,
      McpSchema.JsonSchema inputSchema,
      Function<Map<String, Object>, Object> operation) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build())
        .callHandler(
            (exchange, request) ->
                invoke(
                    name,
                    () ->
                        operation.apply(
                            Objects.requireNonNullElse(
                                request.arguments(), Collections.<String, Object>emptyMap()))))
        .build();
  }

  static McpSchema.CallToolResult invoke(String name, Supplier<Object> call) {
    try {
      return new McpSchema.CallToolResult(JacksonUtility.toJson(call.get()), false);
    } catch (Exception e) {
      log.error("Failed to handle MCP tool request {}", name, e);
      return new McpSchema.CallToolResult(
          Objects.requireNonNullElse(e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)),
          true);
    }
  }

  private static String stringArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    return value == null ? null : value.toString();
  }

  private static Map<String, Object> properties(Object... nameAndSchema) {
    Map<String, Object> props = new LinkedHashMap<>();
    for (int i = 0; i + 1 < nameAndSchema.length; i += 2) {
      props.put(nameAndSchema[i].toString(), nameAndSchema[i + 1]);
    }
    return props;
  }

  private static McpSchema.JsonSchema schema(Map<String, Object> props, List<String> required) {
    return new McpSchema.JsonSchema(
        "object", props, required, false, Collections.emptyMap(), Collections.emptyMap());
  }
}
