package com.linlay.assistantgw.ingest.store;

import com.linlay.assistantgw.ingest.model.DocumentChunk;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorStoreChunkStoreTest {

    private final VectorStore vectorStore = mock(VectorStore.class);
    private final VectorStoreChunkStore store = new VectorStoreChunkStore(vectorStore);

    @Test
    void searchShouldFilterOnExactNamespaceValue() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                new Document("d1", "team notes", Map.of("namespace", "team's", "page", 1))
        ));

        List<DocumentChunk> hits = store.search("team's", "notes", 3);

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(request.capture());
        assertThat(request.getValue().getTopK()).isEqualTo(3);
        assertThat(request.getValue().getFilterExpression()).isEqualTo(new Filter.Expression(
                Filter.ExpressionType.EQ, new Filter.Key("namespace"), new Filter.Value("team's")));

        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.namespace()).isEqualTo("team's");
            assertThat(hit.text()).isEqualTo("team notes");
            assertThat(hit.metadata()).containsEntry("page", 1).doesNotContainKey("namespace");
        });
    }

    @SuppressWarnings("unchecked")
    @Test
    void addShouldTagDocumentsWithNamespace() {
        List<String> ids = store.add(List.of(new DocumentChunk("asst-1", "hello", Map.of("source", "a.txt"))));

        ArgumentCaptor<List<Document>> documents = ArgumentCaptor.forClass(List.class);
        verify(vectorStore).add(documents.capture());
        Document stored = documents.getValue().get(0);
        assertThat(ids).containsExactly(stored.getId());
        assertThat(stored.getMetadata()).containsEntry("namespace", "asst-1").containsEntry("source", "a.txt");
    }
}
