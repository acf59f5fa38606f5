package com.linlay.assistantgw.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.config.IngestProperties;
import com.linlay.assistantgw.ingest.model.Blob;
import com.linlay.assistantgw.ingest.model.ChunkNamespace;
import com.linlay.assistantgw.ingest.service.IngestJobService;
import com.linlay.assistantgw.ingest.service.MediaTypeDetector;
import com.linlay.assistantgw.model.api.IngestCancelResponse;
import com.linlay.assistantgw.model.api.IngestStatusResponse;
import com.linlay.assistantgw.model.api.IngestSubmitResponse;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/ingest")
public class IngestController {

    private final IngestJobService ingestJobService;
    private final IngestProperties ingestProperties;
    private final ObjectMapper objectMapper;

    public IngestController(
            IngestJobService ingestJobService,
            IngestProperties ingestProperties,
            ObjectMapper objectMapper
    ) {
        this.ingestJobService = ingestJobService;
        this.ingestProperties = ingestProperties;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<IngestSubmitResponse> ingest(@RequestBody Mono<MultiValueMap<String, Part>> parts) {
        return parts.flatMap(form -> {
            ChunkNamespace namespace = resolveNamespace(form.getFirst("config"));
            List<FilePart> files = form.getOrDefault("files", List.of()).stream()
                    .filter(FilePart.class::isInstance)
                    .map(FilePart.class::cast)
                    .toList();
            if (files.isEmpty()) {
                return Mono.error(new IllegalArgumentException("at least one file is required"));
            }
            if (files.size() > ingestProperties.getMaxFiles()) {
                return Mono.error(new IllegalArgumentException("too many files, max " + ingestProperties.getMaxFiles()));
            }
            return Flux.fromIterable(files)
                    .concatMap(this::toBlob)
                    .collectList()
                    .map(blobs -> IngestSubmitResponse.from(ingestJobService.submit(blobs, namespace)));
        });
    }

    @GetMapping("/{jobId}")
    public IngestStatusResponse status(@PathVariable String jobId) {
        return ingestJobService.find(jobId)
                .map(IngestStatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Ingest job not found."));
    }

    @PostMapping("/{jobId}/cancel")
    public IngestCancelResponse cancel(@PathVariable String jobId) {
        if (ingestJobService.find(jobId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Ingest job not found.");
        }
        if (!ingestJobService.cancel(jobId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Ingest job cannot be canceled.");
        }
        return new IngestCancelResponse(jobId, "canceled");
    }

    private Mono<Blob> toBlob(FilePart file) {
        String name = StringUtils.hasText(file.filename()) ? file.filename() : "upload";
        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new Blob(bytes, name, MediaTypeDetector.detect(name, bytes)));
    }

    private ChunkNamespace resolveNamespace(Part configPart) {
        if (!(configPart instanceof FormFieldPart field) || !StringUtils.hasText(field.value())) {
            throw new IllegalArgumentException("config form field is required");
        }
        JsonNode config;
        try {
            config = objectMapper.readTree(field.value());
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("config must be valid JSON", ex);
        }
        JsonNode configurable = config.path("configurable");
        return ChunkNamespace.resolve(textOrNull(configurable, "assistant_id"), textOrNull(configurable, "thread_id"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
