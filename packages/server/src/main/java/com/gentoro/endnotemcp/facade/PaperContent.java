package com.gentoro.endnotemcp.facade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.endnotemcp.store.Reference;

/**
 * Reference metadata plus the document text. When the document could not be read, {@code text}
 * holds the reason instead ({@code "Error: File not found at ..."} or {@code "Error parsing PDF:
 * ..."}).
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
  "id",
  "title",
  "author",
  "year",
  "journal",
  "abstract",
  "keywords",
  "filepath",
  "text"
})
public record PaperContent(
    long id,
    String title,
    String author,
    String year,
    String journal,
    @JsonProperty("abstract") String abstractText,
    String keywords,
    String filepath,
    String text)
    implements PaperResult {

  public static PaperContent of(Reference ref, String text) {
    return new PaperContent(
        ref.id(),
        ref.title(),
        ref.author(),
        ref.year(),
        ref.journal(),
        ref.abstractText(),
        ref.keywords(),
        ref.filepath(),
        text);
  }
}
