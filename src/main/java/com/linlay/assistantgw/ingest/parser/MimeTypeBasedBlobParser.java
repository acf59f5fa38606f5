package com.linlay.assistantgw.ingest.parser;

import com.linlay.assistantgw.ingest.model.Blob;
import org.springframework.ai.document.Document;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

public class MimeTypeBasedBlobParser implements BlobParser {

    private final Map<String, BlobParser> handlers;
    private final BlobParser textFallback;

    public MimeTypeBasedBlobParser(Map<String, BlobParser> handlers, BlobParser textFallback) {
        this.handlers = Map.copyOf(handlers);
        this.textFallback = textFallback;
    }

    public static MimeTypeBasedBlobParser standard() {
        BlobParser text = new TextBlobParser();
        BlobParser tika = new TikaBlobParser();
        Map<String, BlobParser> handlers = new LinkedHashMap<>();
        handlers.put("application/pdf", new PdfBlobParser());
        handlers.put("text/plain", text);
        handlers.put("text/html", tika);
        handlers.put("application/msword", tika);
        handlers.put("application/vnd.openxmlformats-officedocument.wordprocessingml.document", tika);
        handlers.put("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", tika);
        handlers.put("application/vnd.ms-excel", tika);
        return new MimeTypeBasedBlobParser(handlers, text);
    }

    @Override
    public Stream<Document> parse(Blob blob) {
        String mimeType = normalize(blob.mimeType());
        BlobParser handler = handlers.get(mimeType);
        if (handler != null) {
            return handler.parse(blob);
        }
        if (mimeType.startsWith("text/")) {
            return textFallback.parse(blob);
        }
        throw new IllegalArgumentException("Unsupported mime type: " + blob.mimeType());
    }

    private static String normalize(String mimeType) {
        String value = mimeType.trim().toLowerCase(Locale.ROOT);
        int separator = value.indexOf(';');
        return separator < 0 ? value : value.substring(0, separator).trim();
    }
}
