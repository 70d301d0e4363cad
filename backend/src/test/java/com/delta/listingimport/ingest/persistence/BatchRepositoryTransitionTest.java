package com.delta.listingimport.ingest.persistence;

import com.delta.listingimport.ingest.error.IllegalStateTransitionException;
import com.delta.listingimport.ingest.error.NotFoundException;
import com.delta.listingimport.ingest.model.Batch;
import com.delta.listingimport.ingest.model.BatchItem;
import com.delta.listingimport.ingest.model.BatchStatus;
import com.delta.listingimport.ingest.model.ImportStrategy;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParseStatus;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.PropertyAddress;
import com.delta.listingimport.ingest.store.CollectionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class BatchRepositoryTransitionTest {
    private static final String URL = "https://www.realtor.com/realestateandhomes-detail/10-Main-St_Austin_TX_78701_M12345-67890";

    @Autowired
    private BatchRepository repository;

    @Autowired
    private CollectionDirectory collections;

    private long batchId;

    @BeforeEach
    void setUp() {
        String owner = "repo-owner-" + System.nanoTime();
        batchId = repository.insertBatch(owner, collections.createCollection(owner, "Downtown"));
    }

    @Test
    void rejectsTransitionsOutsideTheTable() {
        BatchItem item = repository.appendItems(batchId, List.of(URL)).get(0);

        assertThatThrownBy(() -> repository.transition(item.id(), ParseStatus.PARSED, 100))
            .isInstanceOf(IllegalStateTransitionException.class)
            .hasMessageContaining("pending")
            .hasMessageContaining("parsed");
        assertThat(repository.findItem(item.id()).orElseThrow().parseStatus()).isEqualTo(ParseStatus.PENDING);

        repository.transition(item.id(), ParseStatus.FAILED, 0, null, "boom");
        assertThatThrownBy(() -> repository.transition(item.id(), ParseStatus.FULL_PARSING, 20))
            .isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    void keepsStoredDataWhenFailingWithoutNewData() {
        BatchItem item = repository.appendItems(batchId, List.of(URL)).get(0);
        ParsedProperty quick = new ParsedProperty(
            ListingSource.REALTOR, "M12345-67890", PropertyAddress.of("10 Main St", "Austin", "TX", "78701"),
            null, null, null, null, null, null, URL, Instant.parse("2026-03-01T12:00:00Z")
        );

        repository.transition(item.id(), ParseStatus.QUICK_PARSING, 10);
        repository.transition(item.id(), ParseStatus.QUICK_PARSED, 40, quick, null);
        repository.transition(item.id(), ParseStatus.FULL_PARSING, 60);
        BatchItem failed = repository.transition(item.id(), ParseStatus.FAILED, 40, null, "HTTP 503");

        assertThat(failed.parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(failed.loadingProgress()).isEqualTo(40);
        assertThat(failed.parseError()).isEqualTo("HTTP 503");
        assertThat(failed.parsedData().address().full()).isEqualTo("10 Main St, Austin, TX 78701");
    }

    @Test
    void countsAndCompletionFollowItemStatuses() {
        List<BatchItem> items = repository.appendItems(batchId, List.of(URL, URL + "1", URL + "2"));
        assertThat(repository.markProcessing(batchId, ImportStrategy.EXHAUSTIVE)).isTrue();
        repository.transition(items.get(0).id(), ParseStatus.FULL_PARSING, 20);
        repository.transition(items.get(0).id(), ParseStatus.PARSED, 100);
        repository.transition(items.get(1).id(), ParseStatus.FAILED, 0, null, "No parser available for URL");

        repository.markCompleted(batchId);

        Batch batch = repository.findBatch(batchId).orElseThrow();
        assertThat(batch.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(batch.strategy()).isEqualTo(ImportStrategy.EXHAUSTIVE);
        assertThat(batch.totalCount()).isEqualTo(3);
        assertThat(batch.successCount()).isEqualTo(1);
        assertThat(batch.failureCount()).isEqualTo(1);
        assertThat(batch.startedAt()).isNotNull();
        assertThat(batch.completedAt()).isNotNull();
    }

    @Test
    void onlyPendingBatchesCanBeClaimed() {
        assertThat(repository.markProcessing(batchId, ImportStrategy.INSTANT)).isTrue();
        assertThat(repository.markProcessing(batchId, ImportStrategy.PROGRESSIVE)).isFalse();
        assertThat(repository.findBatch(batchId).orElseThrow().strategy()).isEqualTo(ImportStrategy.INSTANT);

        repository.markCompleted(batchId);
        Batch completed = repository.findBatch(batchId).orElseThrow();

        assertThat(repository.markProcessing(batchId, ImportStrategy.EXHAUSTIVE)).isFalse();
        Batch after = repository.findBatch(batchId).orElseThrow();
        assertThat(after.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(after.completedAt()).isEqualTo(completed.completedAt());
        assertThat(repository.markProcessing(batchId + 10_000, ImportStrategy.INSTANT)).isFalse();
    }

    @Test
    void progressUpdatesOnlyApplyInTheExpectedStatus() {
        BatchItem item = repository.appendItems(batchId, List.of(URL)).get(0);
        repository.transition(item.id(), ParseStatus.FULL_PARSING, 5);

        assertThat(repository.updateProgress(item.id(), ParseStatus.FULL_PARSING, 20)).isTrue();
        assertThat(repository.findItem(item.id()).orElseThrow().loadingProgress()).isEqualTo(20);

        repository.transition(item.id(), ParseStatus.FAILED, 5, null, "HTTP 503");
        assertThat(repository.updateProgress(item.id(), ParseStatus.FULL_PARSING, 20)).isFalse();
        BatchItem failed = repository.findItem(item.id()).orElseThrow();
        assertThat(failed.parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(failed.loadingProgress()).isEqualTo(5);
    }

    @Test
    void deleteRemovesItemsWithBatch() {
        BatchItem item = repository.appendItems(batchId, List.of(URL)).get(0);

        assertThat(repository.deleteBatch(batchId)).isTrue();

        assertThat(repository.batchExists(batchId)).isFalse();
        assertThat(repository.findItem(item.id())).isEmpty();
        assertThatThrownBy(() -> repository.transition(item.id(), ParseStatus.FAILED, 0))
            .isInstanceOf(NotFoundException.class);
    }
}
