package com.linlay.assistantgw.ingest.service;

import com.linlay.assistantgw.ingest.model.Blob;
import com.linlay.assistantgw.ingest.model.ChunkNamespace;
import com.linlay.assistantgw.ingest.model.IngestBatchPolicy;
import com.linlay.assistantgw.ingest.model.IngestJob;
import com.linlay.assistantgw.ingest.model.IngestJobStatus;
import com.linlay.assistantgw.ingest.parser.BlobParser;
import com.linlay.assistantgw.ingest.parser.MimeTypeBasedBlobParser;
import com.linlay.assistantgw.ingest.split.CharacterWindowTextSplitter;
import com.linlay.assistantgw.ingest.store.InMemoryChunkStore;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.ServiceConfigurationError;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestJobServiceTest {

    private static final ChunkNamespace NAMESPACE = ChunkNamespace.resolve(null, "thread-1");

    private final IngestJobRegistry registry = new IngestJobRegistry();
    private final InMemoryChunkStore store = new InMemoryChunkStore();
    private final IngestJobService service = new IngestJobService(
            registry,
            new BatchIngestor(
                    MimeTypeBasedBlobParser.standard(),
                    new CharacterWindowTextSplitter(20, 5),
                    store,
                    IngestBatchPolicy.PER_REQUEST
            ),
            Schedulers.immediate()
    );

    @Test
    void submittedJobShouldRunToDone() {
        IngestJob submitted = service.submit(List.of(text("a.txt", "the quick brown fox jumps over the lazy dog")), NAMESPACE);

        IngestJob job = service.find(submitted.jobId()).orElseThrow();
        assertThat(job.status()).isEqualTo(IngestJobStatus.DONE);
        assertThat(job.progress()).isEqualTo(1.0);
        assertThat(job.totalBytes()).isEqualTo(43);
        assertThat(store.size()).isPositive();
        assertThat(store.search("thread-1", "fox", 4)).isNotEmpty();
    }

    @Test
    void unsupportedFileShouldMarkJobAsError() {
        Blob binary = new Blob(new byte[]{1, 2, 3}, "blob.bin", "application/octet-stream");

        IngestJob submitted = service.submit(List.of(binary), NAMESPACE);

        IngestJob job = service.find(submitted.jobId()).orElseThrow();
        assertThat(job.status()).isEqualTo(IngestJobStatus.ERROR);
        assertThat(job.error()).contains("Unsupported mime type");
    }

    @Test
    void errorThrownByParserShouldMarkJobAsError() {
        IngestJobService failing = serviceWithParser(blob -> {
            throw new ServiceConfigurationError("no provider for " + blob.name());
        }, Schedulers.immediate());

        IngestJob submitted = failing.submit(List.of(text("a.txt", "hello")), NAMESPACE);

        IngestJob job = failing.find(submitted.jobId()).orElseThrow();
        assertThat(job.status()).isEqualTo(IngestJobStatus.ERROR);
        assertThat(job.error()).isEqualTo("no provider for a.txt");
    }

    @Test
    void fatalErrorShouldBeRecordedBeforeItPropagates() {
        IngestJobService failing = serviceWithParser(blob -> {
            throw new OutOfMemoryError("Java heap space");
        }, Schedulers.immediate());
        IngestJob job = registry.create(5);

        assertThatThrownBy(() -> failing.run(job.jobId(), List.of(text("a.txt", "hello")), NAMESPACE))
                .isInstanceOf(OutOfMemoryError.class);

        IngestJob failed = registry.get(job.jobId()).orElseThrow();
        assertThat(failed.status()).isEqualTo(IngestJobStatus.ERROR);
        assertThat(failed.error()).isEqualTo("Java heap space");
    }

    @Test
    void rejectedDispatchShouldMarkJobAsError() {
        Scheduler closed = Schedulers.newSingle("closed-ingest");
        closed.dispose();
        IngestJobService rejecting = serviceWithParser(MimeTypeBasedBlobParser.standard(), closed);

        IngestJob submitted = rejecting.submit(List.of(text("a.txt", "hello")), NAMESPACE);

        assertThat(registry.get(submitted.jobId()).orElseThrow().status()).isEqualTo(IngestJobStatus.ERROR);
        assertThat(store.size()).isZero();
    }

    @Test
    void canceledJobShouldStayCanceledAndStoreNothing() {
        IngestJob job = registry.create(10);
        assertThat(service.cancel(job.jobId())).isTrue();

        service.run(job.jobId(), List.of(text("a.txt", "hello world")), NAMESPACE);

        assertThat(service.find(job.jobId()).orElseThrow().status()).isEqualTo(IngestJobStatus.CANCELED);
        assertThat(store.size()).isZero();
    }

    @Test
    void cancelOfFinishedJobShouldBeRejected() {
        IngestJob submitted = service.submit(List.of(text("a.txt", "hello")), NAMESPACE);

        assertThat(service.cancel(submitted.jobId())).isFalse();
        assertThat(service.cancel("unknown")).isFalse();
    }

    @Test
    void submitWithoutFilesShouldBeRejected() {
        assertThatThrownBy(() -> service.submit(List.of(), NAMESPACE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private IngestJobService serviceWithParser(BlobParser parser, Scheduler scheduler) {
        return new IngestJobService(
                registry,
                new BatchIngestor(parser, new CharacterWindowTextSplitter(20, 5), store, IngestBatchPolicy.PER_REQUEST),
                scheduler
        );
    }

    private static Blob text(String name, String content) {
        return new Blob(content.getBytes(StandardCharsets.UTF_8), name, "text/plain");
    }
}
