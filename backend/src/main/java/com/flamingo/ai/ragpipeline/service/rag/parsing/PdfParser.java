package com.flamingo.ai.ragpipeline.service.rag.parsing;

import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextSpan;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * {@link DocumentParser} for PDF documents backed by Apache PDFBox 3.x.
 *
 * <p>The document is opened from disk with a temp-file stream cache and its text is extracted in
 * windows of {@code pagesPerWindow} pages, so memory stays bounded for documents with thousands
 * of pages. Every chunk records the page range of the window it came from.
 */
@Slf4j
public class PdfParser implements DocumentParser {

  public static final String TYPE = "PdfParser";

  private final TextChunker chunker;
  private final int pagesPerWindow;

  public PdfParser(TextChunker chunker, int pagesPerWindow) {
    this.chunker = chunker;
    this.pagesPerWindow = Math.max(1, pagesPerWindow);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<ParsedChunk> parse(ParserInput input) throws IOException {
    List<ParsedChunk> chunks = new ArrayList<>();
    try (PDDocument pdfDoc =
        Loader.loadPDF(input.path().toFile(), IOUtils.createTempFileOnlyStreamCache())) {
      int totalPages = pdfDoc.getNumberOfPages();
      String title = documentTitle(pdfDoc);
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      for (int firstPage = 1; firstPage <= totalPages; firstPage += pagesPerWindow) {
        int lastPage = Math.min(totalPages, firstPage + pagesPerWindow - 1);
        stripper.setStartPage(firstPage);
        stripper.setEndPage(lastPage);
        String windowText = stripper.getText(pdfDoc);

        for (TextSpan span : chunker.chunk(windowText)) {
          Map<String, Object> metadata = new HashMap<>();
          metadata.put("page_start", firstPage);
          metadata.put("page_end", lastPage);
          metadata.put("total_pages", totalPages);
          if (title != null) {
            metadata.put("document_title", title);
          }
          if (span.section() != null) {
            metadata.put("section", span.section());
          }
          chunks.add(new ParsedChunk(span.text(), metadata));
        }
      }
      log.debug(
          "PdfParser produced {} chunks from {} pages of {}",
          chunks.size(),
          totalPages,
          input.fileName());
    }
    return chunks;
  }

  private String documentTitle(PDDocument pdfDoc) {
    PDDocumentInformation info = pdfDoc.getDocumentInformation();
    if (info == null || info.getTitle() == null || info.getTitle().isBlank()) {
      return null;
    }
    return info.getTitle().trim();
  }
}
