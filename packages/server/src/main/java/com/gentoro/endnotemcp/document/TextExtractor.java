package com.gentoro.endnotemcp.document;

import com.gentoro.endnotemcp.exception.ExceptionUtil;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Extracts the text of a PDF with Apache PDFBox, one page at a time, joined in page order without
 * separators. Any failure yields a single descriptive message and discards pages already read.
 */
public class TextExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(TextExtractor.class);

  public ExtractionResult extract(Path document) {
    if (!Files.exists(document)) {
      log.debug("PDF file not found: {}", document);
      return ExtractionResult.notFound(document);
    }
    try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      int pages = pdf.getNumberOfPages();
      for (int page = 1; page <= pages; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(pdf);
        text.append(pageText == null ? "" : pageText);
      }
      log.debug("Extracted {} characters from {} page(s) of {}", text.length(), pages, document);
      return ExtractionResult.success(text.toString());
    } catch (NoSuchFileException | FileNotFoundException e) {
      if (Files.exists(document)) {
        // present but unreadable as a file, e.g. a directory
        return parseFailure(document, e);
      }
      log.debug("PDF file not found: {}", document);
      return ExtractionResult.notFound(document);
    } catch (IOException | RuntimeException e) {
      return parseFailure(document, e);
    }
  }

  private static ExtractionResult parseFailure(Path document, Exception e) {
    log.debug("PDF parsing exception for {}: {}", document, e.getMessage());
    return ExtractionResult.failure("Error parsing PDF: " + ExceptionUtil.describe(e));
  }
}
