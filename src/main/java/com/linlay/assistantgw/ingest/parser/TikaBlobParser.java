package com.linlay.assistantgw.ingest.parser;

import com.linlay.assistantgw.ingest.model.Blob;
import org.springframework.ai.document.Document;
import org.springframework.ai.reader.tika.TikaDocumentReader;
import org.springframework.core.io.ByteArrayResource;

import java.util.stream.Stream;

/**
 * Office and HTML formats through Apache Tika.
 */
public class TikaBlobParser implements BlobParser {

    @Override
    public Stream<Document> parse(Blob blob) {
        ByteArrayResource resource = new ByteArrayResource(blob.data(), blob.name()) {
            @Override
            public String getFilename() {
                return blob.name();
            }
        };
        return Stream.of(new TikaDocumentReader(resource))
                .flatMap(reader -> reader.get().stream());
    }
}
