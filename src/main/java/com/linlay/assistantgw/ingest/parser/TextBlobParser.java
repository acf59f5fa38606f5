package com.linlay.assistantgw.ingest.parser;

import com.linlay.assistantgw.ingest.model.Blob;
import org.springframework.ai.document.Document;

import java.util.Map;
import java.util.stream.Stream;

public class TextBlobParser implements BlobParser {

    @Override
    public Stream<Document> parse(Blob blob) {
        String text = blob.asString();
        if (text.isBlank()) {
            return Stream.empty();
        }
        return Stream.of(new Document(text, Map.of("source", blob.name())));
    }
}
