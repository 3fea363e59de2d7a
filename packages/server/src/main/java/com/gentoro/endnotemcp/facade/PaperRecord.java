package com.gentoro.endnotemcp.facade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.endnotemcp.store.Reference;

/** Reference metadata as returned by {@code list_papers} and {@code search_papers}. */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
  "id",
  "title",
  "author",
  "year",
  "journal",
  "abstract",
  "keywords",
  "filepath"
})
public record PaperRecord(
    long id,
    String title,
    String author,
    String year,
    String journal,
    @JsonProperty("abstract") String abstractText,
    String keywords,
    String filepath) {

  public static PaperRecord from(Reference ref) {
    return new PaperRecord(
        ref.id(),
        ref.title(),
        ref.author(),
        ref.year(),
        ref.journal(),
        ref.abstractText(),
        ref.keywords(),
        ref.filepath());
  }
}
