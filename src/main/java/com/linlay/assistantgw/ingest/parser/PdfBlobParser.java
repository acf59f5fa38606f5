package com.linlay.assistantgw.ingest.parser;

import com.linlay.assistantgw.ingest.model.Blob;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.ai.document.Document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * One document per non-blank page; pages are extracted only as the stream is consumed.
 */
public class PdfBlobParser implements BlobParser {

    @Override
    public Stream<Document> parse(Blob blob) {
        PDDocument pdf;
        try {
            pdf = Loader.loadPDF(blob.data());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read PDF " + blob.name(), ex);
        }
        PDFTextStripper stripper = new PDFTextStripper();
        return IntStream.rangeClosed(1, pdf.getNumberOfPages())
                .mapToObj(page -> extractPage(pdf, stripper, blob.name(), page))
                .filter(Objects::nonNull)
                .onClose(() -> closeQuietly(pdf, blob.name()));
    }

    private Document extractPage(PDDocument pdf, PDFTextStripper stripper, String source, int page) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        try {
            String text = stripper.getText(pdf);
            if (text == null || text.isBlank()) {
                return null;
            }
            return new Document(text, Map.of("source", source, "page", page));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to extract page " + page + " of " + source, ex);
        }
    }

    private void closeQuietly(PDDocument pdf, String source) {
        try {
            pdf.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to close PDF " + source, ex);
        }
    }
}
