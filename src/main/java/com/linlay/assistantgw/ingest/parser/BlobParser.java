package com.linlay.assistantgw.ingest.parser;

import com.linlay.assistantgw.ingest.model.Blob;
import org.springframework.ai.document.Document;

import java.util.stream.Stream;

/**
 * Lazily parses a blob into documents. Callers must close the returned stream.
 */
@FunctionalInterface
public interface BlobParser {

    Stream<Document> parse(Blob blob);
}
