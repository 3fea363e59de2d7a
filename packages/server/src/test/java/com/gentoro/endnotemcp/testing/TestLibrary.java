package com.gentoro.endnotemcp.testing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/** Builds small EndNote-shaped SQLite libraries and PDFs for tests. */
public final class TestLibrary {
  private final Path file;
  private final boolean withKeywords;

  private TestLibrary(Path file, boolean withKeywords) {
    this.file = file;
    this.withKeywords = withKeywords;
  }

  public static TestLibrary create(Path file) throws SQLException {
    return create(file, true);
  }

  /** Library whose {@code refs} table has a {@code keywords} column only when asked for. */
  public static TestLibrary create(Path file, boolean withKeywords) throws SQLException {
    try (Connection conn = open(file);
        Statement st = conn.createStatement()) {
      st.executeUpdate(
          "CREATE TABLE refs (id INTEGER PRIMARY KEY, title TEXT, author TEXT, year TEXT,"
              + " secondary_title TEXT, abstract TEXT"
              + (withKeywords ? ", keywords TEXT" : "")
              + ")");
      st.executeUpdate("CREATE TABLE file_res (refs_id INTEGER, file_path TEXT)");
    }
    return new TestLibrary(file, withKeywords);
  }

  public Path file() {
    return file;
  }

  public TestLibrary addReference(long id, String title, String year) throws SQLException {
    return addReference(id, title, "Author " + id, year, "Journal " + id, "Abstract " + id, null);
  }

  public TestLibrary addReference(
      long id,
      String title,
      String author,
      String year,
      String journal,
      String abstractText,
      String keywords)
      throws SQLException {
    String sql =
        withKeywords
            ? "INSERT INTO refs (id, title, author, year, secondary_title, abstract, keywords)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)"
            : "INSERT INTO refs (id, title, author, year, secondary_title, abstract)"
                + " VALUES (?, ?, ?, ?, ?, ?)";
    try (Connection conn = open(file);
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, id);
      ps.setString(2, title);
      ps.setString(3, author);
      ps.setString(4, year);
      ps.setString(5, journal);
      ps.setString(6, abstractText);
      if (withKeywords) ps.setString(7, keywords);
      ps.executeUpdate();
    }
    return this;
  }

  public TestLibrary attachFile(long refId, String filePath) throws SQLException {
    try (Connection conn = open(file);
        PreparedStatement ps =
            conn.prepareStatement("INSERT INTO file_res (refs_id, file_path) VALUES (?, ?)")) {
      ps.setLong(1, refId);
      ps.setString(2, filePath);
      ps.executeUpdate();
    }
    return this;
  }

  /** Writes a PDF with one page per entry of {@code pages}, each showing that text. */
  public static Path writePdf(Path target, String... pages) throws IOException {
    Files.createDirectories(target.getParent());
    try (PDDocument doc = new PDDocument()) {
      for (String text : pages) {
        PDPage page = new PDPage();
        doc.addPage(page);
        if (text.isEmpty()) continue;
        try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
          content.beginText();
          content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
          content.newLineAtOffset(72, 700);
          content.showText(text);
          content.endText();
        }
      }
      doc.save(target.toFile());
    }
    return target;
  }

  private static Connection open(Path file) throws SQLException {
    return DriverManager.getConnection("jdbc:sqlite:" + file);
  }
}
