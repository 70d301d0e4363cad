package com.delta.listingimport.ingest.batch;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.duplicate.DuplicateDetector;
import com.delta.listingimport.ingest.error.IllegalStateTransitionException;
import com.delta.listingimport.ingest.error.NotFoundException;
import com.delta.listingimport.ingest.error.TransientNetworkException;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.external.ExternalDataClient;
import com.delta.listingimport.ingest.model.Batch;
import com.delta.listingimport.ingest.model.BatchItem;
import com.delta.listingimport.ingest.model.BatchRunResponse;
import com.delta.listingimport.ingest.model.BatchStatus;
import com.delta.listingimport.ingest.model.CommittedProperty;
import com.delta.listingimport.ingest.model.DuplicateCheckResult;
import com.delta.listingimport.ingest.model.ImportSelection;
import com.delta.listingimport.ingest.model.ImportStrategy;
import com.delta.listingimport.ingest.model.InstantCreateResponse;
import com.delta.listingimport.ingest.model.ItemResult;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParseStatus;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.Pricing;
import com.delta.listingimport.ingest.model.ProgressiveStartResponse;
import com.delta.listingimport.ingest.model.PropertyAddress;
import com.delta.listingimport.ingest.model.PropertyOverrides;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.parser.ListingParser;
import com.delta.listingimport.ingest.parser.ParserFactory;
import com.delta.listingimport.ingest.persistence.BatchRepository;
import com.delta.listingimport.ingest.site.SiteDetector;
import com.delta.listingimport.ingest.store.CollectionDirectory;
import com.delta.listingimport.ingest.store.CollectionPropertyStore;
import com.delta.listingimport.ingest.store.ImportNotifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class BatchManagerTest {
    private static final String URL_1 = "https://www.zillow.com/homedetails/1-Elm-St-Phoenix-AZ-85001/101_zpid/";
    private static final String URL_2 = "https://www.zillow.com/homedetails/2-Oak-Ave-Phoenix-AZ-85002/102_zpid/";
    private static final String URL_3 = "https://www.zillow.com/homedetails/3-Pine-Rd-Phoenix-AZ-85003/103_zpid/";
    private static final String UNSUPPORTED = "https://www.example.com/listing/77";

    @Autowired
    private BatchRepository batchRepository;

    @Autowired
    private CollectionPropertyStore propertyStore;

    @Autowired
    private CollectionDirectory collections;

    @Autowired
    private DuplicateDetector duplicateDetector;

    @Autowired
    private Clock clock;

    private final Map<String, ParsedProperty> fullResults = new HashMap<>();
    private ListingParser parser;
    private ExternalDataClient externalClient;
    private ImportNotifier notifier;
    private ExecutorService executor;
    private String ownerId;
    private long collectionId;

    @BeforeEach
    void setUp() {
        ownerId = "owner-" + UUID.randomUUID();
        collectionId = collections.createCollection(ownerId, "Client tour");
        parser = Mockito.mock(ListingParser.class);
        when(parser.source()).thenReturn(ListingSource.ZILLOW);
        when(parser.name()).thenReturn("Zillow");
        when(parser.canHandle(anyString())).thenAnswer(invocation -> invocation.getArgument(0, String.class).contains("zillow.com"));
        when(parser.confidence(anyString())).thenAnswer(invocation -> invocation.getArgument(0, String.class).contains("zillow.com") ? 1.0 : 0.0);
        when(parser.extractAddressFromUrl(anyString())).thenAnswer(invocation -> urlAddress(invocation.getArgument(0)));
        when(parser.parse(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            ParsedProperty result = fullResults.get(url);
            if (result == null) {
                throw new TransientNetworkException("Timed out loading " + url, 408);
            }
            return result;
        });
        fullResults.put(URL_1, parsed(URL_1, "1 Elm Street", "85001", 250_000.0));
        fullResults.put(URL_2, parsed(URL_2, "2 Oak Avenue", "85002", 410_000.0));
        fullResults.put(URL_3, parsed(URL_3, "3 Pine Road", "85003", 820_000.0));
        externalClient = Mockito.mock(ExternalDataClient.class);
        notifier = Mockito.mock(ImportNotifier.class);
        executor = new DirectExecutorService();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BatchManager manager() {
        IngestProperties properties = new IngestProperties();
        properties.getBatch().setInterItemDelayMs(0);
        properties.getBatch().setFullPassDelayMs(0);
        return new BatchManager(
            batchRepository,
            new ParserFactory(new SiteDetector(), List.of(parser)),
            externalClient,
            duplicateDetector,
            propertyStore,
            collections,
            notifier,
            executor,
            properties,
            clock,
            millis -> {
            }
        );
    }

    @Test
    void importReportsDuplicateOfExistingPropertyInSummary() {
        propertyStore.commit(
            ownerId,
            collectionId,
            parsed("https://www.trulia.com/home/2-oak-ave-phoenix-az-85002-999", "2 Oak Avenue", "85002", 405_000.0),
            true,
            100,
            PropertyOverrides.none()
        );
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1, URL_2, URL_3));

        BatchRunResponse parsedRun = manager.parseSequential(batch.id());
        assertThat(parsedRun.summary().successful()).isEqualTo(2);

        List<ImportSelection> selections = new ArrayList<>();
        for (BatchItem item : batchRepository.findItems(batch.id())) {
            selections.add(new ImportSelection(item.id(), null));
        }
        BatchRunResponse imported = manager.importSelected(batch.id(), selections);

        assertThat(imported.summary().total()).isEqualTo(3);
        assertThat(imported.summary().successful()).isEqualTo(2);
        assertThat(imported.summary().failed()).isEqualTo(1);
        ItemResult failed = imported.results().stream().filter(result -> !result.success()).findFirst().orElseThrow();
        assertThat(failed.sourceUrl()).isEqualTo(URL_2);
        assertThat(failed.duplicate()).isTrue();
        assertThat(failed.error()).isEqualTo("Duplicate: " + DuplicateCheckResult.SIMILAR_ADDRESS);
        assertThat(propertyStore.countInScope(ownerId, collectionId)).isEqualTo(3);
        verify(notifier, times(2)).propertyImported(any(CommittedProperty.class));

        Batch finished = batchRepository.findBatch(batch.id()).orElseThrow();
        assertThat(finished.successCount()).isEqualTo(2);
        assertThat(finished.failureCount()).isEqualTo(1);
        assertThat(finished.strategy()).isEqualTo(ImportStrategy.EXHAUSTIVE);
        assertThat(finished.status()).isEqualTo(BatchStatus.COMPLETED);
    }

    @Test
    void sequentialParseRecordsEachOutcomeOnItsItem() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1, UNSUPPORTED));
        fullResults.remove(URL_1);

        BatchRunResponse response = manager.parseSequential(batch.id());

        assertThat(response.summary().failed()).isEqualTo(2);
        List<BatchItem> items = batchRepository.findItems(batch.id());
        assertThat(items.get(0).parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(items.get(0).parseError()).contains("Timed out");
        assertThat(items.get(1).parseError()).isEqualTo(BatchManager.NO_PARSER);
    }

    @Test
    void importRechecksDuplicatesCommittedAfterParsing() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1));
        manager.parseSequential(batch.id());
        propertyStore.commit(ownerId, collectionId, fullResults.get(URL_1), true, 100, PropertyOverrides.none());
        BatchItem item = batchRepository.findItems(batch.id()).get(0);

        BatchRunResponse response = manager.importSelected(batch.id(), List.of(new ImportSelection(item.id(), null)));

        assertThat(response.results().get(0).duplicate()).isTrue();
        assertThat(response.results().get(0).error()).isEqualTo("Duplicate: " + DuplicateCheckResult.SAME_URL);
        BatchItem after = batchRepository.findItem(item.id()).orElseThrow();
        assertThat(after.parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(after.parsedData()).isNotNull();
    }

    @Test
    void importAppliesOverridesAndRejectsUnparsedItems() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1));
        BatchItem pending = batchRepository.findItems(batch.id()).get(0);

        BatchRunResponse early = manager.importSelected(batch.id(), List.of(new ImportSelection(pending.id(), null)));
        assertThat(early.results().get(0).error()).isEqualTo(BatchManager.NOT_PARSED);

        manager.parseSequential(batch.id());
        PropertyOverrides overrides = new PropertyOverrides("Great light", "Call before showing", 4, 2.5, 1900);
        BatchRunResponse imported = manager.importSelected(batch.id(), List.of(new ImportSelection(pending.id(), overrides)));

        Long entityId = imported.results().get(0).entityId();
        CommittedProperty committed = propertyStore.findById(entityId).orElseThrow();
        assertThat(committed.overrides()).isEqualTo(overrides);
        assertThat(committed.fullyParsed()).isTrue();
        assertThat(committed.priceRange()).isEqualTo("200k_300k");
        BatchItem item = batchRepository.findItem(pending.id()).orElseThrow();
        assertThat(item.parseStatus()).isEqualTo(ParseStatus.IMPORTED);
        assertThat(item.committedEntityId()).isEqualTo(entityId);
    }

    @Test
    void instantCommitsPlaceholdersAndBackfillsFullData() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1, URL_2, UNSUPPORTED));
        fullResults.remove(URL_2);

        InstantCreateResponse response = manager.createInstant(batch.id());

        assertThat(response.properties()).hasSize(3);
        ItemResult first = response.properties().get(0);
        assertThat(first.success()).isTrue();
        assertThat(first.address()).isEqualTo("1 Elm St, Phoenix, AZ 85001");
        assertThat(response.properties().get(2).error()).isEqualTo(BatchManager.NO_PARSER);

        CommittedProperty backfilled = propertyStore.findById(first.entityId()).orElseThrow();
        assertThat(backfilled.fullyParsed()).isTrue();
        assertThat(backfilled.loadingProgress()).isEqualTo(100);
        assertThat(backfilled.addressFull()).isEqualTo("1 Elm Street, Phoenix, AZ 85001");
        assertThat(backfilled.numericPrice()).isEqualTo(250_000.0);

        Long secondEntity = response.properties().get(1).entityId();
        CommittedProperty stillPlaceholder = propertyStore.findById(secondEntity).orElseThrow();
        assertThat(stillPlaceholder.fullyParsed()).isFalse();
        assertThat(stillPlaceholder.loadingProgress()).isEqualTo(5);

        List<BatchItem> items = batchRepository.findItems(batch.id());
        assertThat(items.get(0).parseStatus()).isEqualTo(ParseStatus.IMPORTED);
        assertThat(items.get(0).loadingProgress()).isEqualTo(100);
        assertThat(items.get(1).parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(items.get(1).loadingProgress()).isEqualTo(5);
        assertThat(items.get(1).parseError()).contains("Timed out");
        assertThat(items.get(2).parseStatus()).isEqualTo(ParseStatus.FAILED);

        Batch finished = batchRepository.findBatch(batch.id()).orElseThrow();
        assertThat(finished.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(finished.successCount()).isEqualTo(1);
        assertThat(finished.failureCount()).isEqualTo(2);
    }

    @Test
    void instantCommitMovesItemsOutOfPendingBeforeBackfill() {
        QueuedExecutorService queued = new QueuedExecutorService();
        executor = queued;
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1));

        InstantCreateResponse response = manager.createInstant(batch.id());

        BatchItem committed = batchRepository.findItems(batch.id()).get(0);
        assertThat(committed.parseStatus()).isEqualTo(ParseStatus.FULL_PARSING);
        assertThat(committed.loadingProgress()).isEqualTo(5);
        assertThat(committed.committedEntityId()).isEqualTo(response.properties().get(0).entityId());
        assertThat(batchRepository.findItemsByStatus(batch.id(), ParseStatus.PENDING)).isEmpty();

        assertThatThrownBy(() -> manager.createInstant(batch.id()))
            .isInstanceOf(IllegalStateTransitionException.class)
            .hasMessageContaining("processing");
        assertThatThrownBy(() -> manager.parseSequential(batch.id()))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(propertyStore.countInScope(ownerId, collectionId)).isEqualTo(1);

        queued.runQueued();

        BatchItem done = batchRepository.findItem(committed.id()).orElseThrow();
        assertThat(done.parseStatus()).isEqualTo(ParseStatus.IMPORTED);
        assertThat(done.loadingProgress()).isEqualTo(100);
        assertThat(done.parseError()).isNull();
        CommittedProperty property = propertyStore.findById(done.committedEntityId()).orElseThrow();
        assertThat(property.fullyParsed()).isTrue();
        assertThat(property.loadingProgress()).isEqualTo(100);
        Batch finished = batchRepository.findBatch(batch.id()).orElseThrow();
        assertThat(finished.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(finished.successCount()).isEqualTo(1);
        assertThat(finished.failureCount()).isZero();
    }

    @Test
    void completedBatchRejectsNewUrlsAndFurtherRuns() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1));
        manager.parseSequential(batch.id());
        Batch completed = batchRepository.findBatch(batch.id()).orElseThrow();

        assertThatThrownBy(() -> manager.addUrls(batch.id(), List.of(URL_2)))
            .isInstanceOf(IllegalStateTransitionException.class)
            .hasMessageContaining("completed");
        assertThatThrownBy(() -> manager.parseSequential(batch.id()))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThatThrownBy(() -> manager.parseProgressive(batch.id()))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThatThrownBy(() -> manager.createInstant(batch.id()))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThatThrownBy(() -> manager.importExternal(batch.id(), "9001"))
            .isInstanceOf(IllegalStateTransitionException.class);
        verifyNoInteractions(externalClient);

        Batch after = batchRepository.findBatch(batch.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(after.strategy()).isEqualTo(ImportStrategy.EXHAUSTIVE);
        assertThat(after.completedAt()).isEqualTo(completed.completedAt());
        assertThat(after.totalCount()).isEqualTo(1);
        assertThat(batchRepository.findItems(batch.id())).hasSize(1);
        verify(parser, times(1)).parse(URL_1);
    }

    @Test
    void instantSkipsUrlsAlreadyInTheCollection() {
        BatchManager manager = manager();
        Batch first = manager.createBatch(ownerId, collectionId);
        manager.addUrls(first.id(), List.of(URL_1));
        manager.createInstant(first.id());
        Batch second = manager.createBatch(ownerId, collectionId);
        manager.addUrls(second.id(), List.of(URL_1));

        InstantCreateResponse response = manager.createInstant(second.id());

        ItemResult result = response.properties().get(0);
        assertThat(result.duplicate()).isTrue();
        assertThat(result.error()).isEqualTo("Duplicate: " + DuplicateCheckResult.SAME_URL);
        assertThat(propertyStore.countInScope(ownerId, collectionId)).isEqualTo(1);
    }

    @Test
    void progressiveQuickPassThenFullPass() {
        when(parser.quickParse(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.equals(URL_3)) {
                throw new TransientNetworkException("HTTP 503 loading " + url, 503);
            }
            return new ParsedProperty(ListingSource.ZILLOW, null, urlAddress(url).address(), Pricing.ofNumeric(1.0, null),
                null, null, null, null, null, url, clock.instant());
        });
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1, URL_2, URL_3));

        ProgressiveStartResponse response = manager.parseProgressive(batch.id());

        assertThat(response.started()).isTrue();
        assertThat(response.quickParsed()).isEqualTo(2);
        assertThat(response.quickFailed()).isEqualTo(1);
        List<BatchItem> items = batchRepository.findItems(batch.id());
        assertThat(items.get(0).parseStatus()).isEqualTo(ParseStatus.PARSED);
        assertThat(items.get(0).loadingProgress()).isEqualTo(100);
        assertThat(items.get(0).parsedData().pricing().numericPrice()).isEqualTo(250_000.0);
        assertThat(items.get(2).parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(items.get(2).loadingProgress()).isZero();
        assertThat(propertyStore.countInScope(ownerId, collectionId)).isZero();
        assertThat(batchRepository.findBatch(batch.id()).orElseThrow().status()).isEqualTo(BatchStatus.COMPLETED);
    }

    @Test
    void progressiveFullPassFailureKeepsQuickData() {
        when(parser.quickParse(anyString())).thenAnswer(invocation -> new ParsedProperty(
            ListingSource.ZILLOW, null, urlAddress(invocation.getArgument(0)).address(), null,
            null, null, null, null, null, invocation.getArgument(0), clock.instant()));
        fullResults.remove(URL_1);
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1));

        manager.parseProgressive(batch.id());

        BatchItem item = batchRepository.findItems(batch.id()).get(0);
        assertThat(item.parseStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(item.loadingProgress()).isEqualTo(40);
        assertThat(item.parsedData().address().street()).isEqualTo("1 Elm St");
    }

    @Test
    void progressiveWithNoQuickSuccessDoesNotStartFullPass() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(UNSUPPORTED));

        ProgressiveStartResponse response = manager.parseProgressive(batch.id());

        assertThat(response.started()).isFalse();
        assertThat(response.quickFailed()).isEqualTo(1);
        assertThat(batchRepository.findBatch(batch.id()).orElseThrow().status()).isEqualTo(BatchStatus.COMPLETED);
    }

    @Test
    void importExternalQueuesParsedItem() {
        String sourceUrl = ExternalDataClient.externalSourceUrl("9001");
        when(externalClient.getById("9001")).thenReturn(parsed(sourceUrl, "9 Api Way", "85009", 199_000.0));
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);

        BatchItem item = manager.importExternal(batch.id(), "9001");

        assertThat(item.sourceUrl()).isEqualTo("external:9001");
        assertThat(item.parseStatus()).isEqualTo(ParseStatus.PARSED);
        assertThat(item.loadingProgress()).isEqualTo(100);
        assertThat(batchRepository.findBatch(batch.id()).orElseThrow().totalCount()).isEqualTo(1);

        BatchRunResponse imported = manager.importSelected(batch.id(), List.of(new ImportSelection(item.id(), null)));
        assertThat(imported.summary().successful()).isEqualTo(1);
        assertThat(propertyStore.findBySourceUrl(ownerId, collectionId, "external:9001")).isPresent();
    }

    @Test
    void deleteCancelsBackgroundWork() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientNetworkException("Interrupted while loading", e);
            }
            return fullResults.get(URL_1);
        }).when(parser).parse(anyString());
        executor = Executors.newFixedThreadPool(1);
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1, URL_2));

        manager.createInstant(batch.id());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.hasBackgroundWork(batch.id())).isTrue();

        manager.deleteBatch(batch.id());

        long deadline = System.currentTimeMillis() + 5_000;
        while (manager.hasBackgroundWork(batch.id()) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(manager.hasBackgroundWork(batch.id())).isFalse();
        assertThat(batchRepository.batchExists(batch.id())).isFalse();
        assertThatThrownBy(() -> manager.getBatchStatus(batch.id())).isInstanceOf(NotFoundException.class);
        verify(parser, times(1)).parse(anyString());
    }

    @Test
    void rejectsUnknownCollectionsAndEmptyUrlLists() {
        BatchManager manager = manager();

        assertThatThrownBy(() -> manager.createBatch(ownerId, collectionId + 10_000)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.createBatch("someone-else", collectionId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.createBatch(" ", collectionId)).isInstanceOf(ValidationException.class);

        Batch batch = manager.createBatch(ownerId, collectionId);
        assertThatThrownBy(() -> manager.addUrls(batch.id(), List.of())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> manager.addUrls(batch.id(), java.util.Arrays.asList(URL_1, " ")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> manager.addUrls(batch.id() + 10_000, List.of(URL_1))).isInstanceOf(NotFoundException.class);
        assertThat(batchRepository.findItems(batch.id())).isEmpty();
    }

    @Test
    void appendedUrlsContinueItemPositions() {
        BatchManager manager = manager();
        Batch batch = manager.createBatch(ownerId, collectionId);
        manager.addUrls(batch.id(), List.of(URL_1, URL_2));
        manager.addUrls(batch.id(), List.of(URL_3));

        List<BatchItem> items = manager.getBatchStatus(batch.id()).items();

        assertThat(items).extracting(BatchItem::position).containsExactly(0, 1, 2);
        assertThat(items).extracting(BatchItem::sourceUrl).containsExactly(URL_1, URL_2, URL_3);
        assertThat(manager.getBatchStatus(batch.id()).batch().totalCount()).isEqualTo(3);
    }

    private UrlAddress urlAddress(String url) {
        String[] slug = url.split("/")[4].split("-");
        String street = String.join(" ", java.util.Arrays.copyOfRange(slug, 0, slug.length - 3));
        return new UrlAddress(null, PropertyAddress.of(street, slug[slug.length - 3], slug[slug.length - 2], slug[slug.length - 1]));
    }

    private ParsedProperty parsed(String url, String street, String zip, double price) {
        return new ParsedProperty(
            ListingSource.ZILLOW,
            null,
            PropertyAddress.of(street, "Phoenix", "AZ", zip),
            Pricing.ofNumeric(price, null),
            null,
            null,
            null,
            null,
            null,
            url,
            clock.instant()
        );
    }

    private static final class DirectExecutorService extends AbstractExecutorService {
        private volatile boolean shutdown;

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }

        @Override
        public void execute(Runnable command) {
            command.run();
        }
    }

    private static final class QueuedExecutorService extends AbstractExecutorService {
        private final List<Runnable> queued = new ArrayList<>();
        private volatile boolean shutdown;

        void runQueued() {
            List<Runnable> tasks = new ArrayList<>(queued);
            queued.clear();
            tasks.forEach(Runnable::run);
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            List<Runnable> pending = new ArrayList<>(queued);
            queued.clear();
            return pending;
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown && queued.isEmpty();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return isTerminated();
        }

        @Override
        public void execute(Runnable command) {
            queued.add(command);
        }
    }
}
