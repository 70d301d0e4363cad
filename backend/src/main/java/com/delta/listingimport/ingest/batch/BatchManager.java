package com.delta.listingimport.ingest.batch;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.duplicate.DuplicateDetector;
import com.delta.listingimport.ingest.error.IllegalStateTransitionException;
import com.delta.listingimport.ingest.error.NotFoundException;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.external.ExternalDataClient;
import com.delta.listingimport.ingest.model.Batch;
import com.delta.listingimport.ingest.model.BatchDetails;
import com.delta.listingimport.ingest.model.BatchItem;
import com.delta.listingimport.ingest.model.BatchRunResponse;
import com.delta.listingimport.ingest.model.BatchStatus;
import com.delta.listingimport.ingest.model.BatchSummary;
import com.delta.listingimport.ingest.model.CommittedProperty;
import com.delta.listingimport.ingest.model.DuplicateCheckResult;
import com.delta.listingimport.ingest.model.ImportSelection;
import com.delta.listingimport.ingest.model.ImportStrategy;
import com.delta.listingimport.ingest.model.InstantCreateResponse;
import com.delta.listingimport.ingest.model.ItemResult;
import com.delta.listingimport.ingest.model.ParseStatus;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.ProgressiveStartResponse;
import com.delta.listingimport.ingest.model.PropertyOverrides;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.parser.ListingParser;
import com.delta.listingimport.ingest.parser.ParserFactory;
import com.delta.listingimport.ingest.persistence.BatchRepository;
import com.delta.listingimport.ingest.store.CollectionDirectory;
import com.delta.listingimport.ingest.store.CollectionPropertyStore;
import com.delta.listingimport.ingest.store.ImportNotifier;
import com.delta.listingimport.ingest.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives batch items through the parse state machine. Instant and progressive batches finish their work
 * on the background executor; those tasks are tracked per batch so deleting a batch cancels them.
 */
@Service
public class BatchManager {
  private static final Logger log = LoggerFactory.getLogger(BatchManager.class);

  static final int INSTANT_COMMIT_PROGRESS = 5;
  static final int BACKFILL_PROGRESS = 20;
  static final int QUICK_PARSING_PROGRESS = 10;
  static final int QUICK_PARSED_PROGRESS = 40;
  static final int FULL_PARSING_PROGRESS = 60;
  static final int DONE_PROGRESS = 100;

  static final String NO_PARSER = "No parser available for URL";
  static final String NOT_PARSED = "Property not found or not parsed";
  static final String DUPLICATE_PREFIX = "Duplicate: ";
  private static final String INSTANT_DIAGNOSTIC = "Created from URL; full details loading";
  private static final int LOCK_STRIPES = 64;

  private final BatchRepository batches;
  private final ParserFactory parserFactory;
  private final ExternalDataClient externalClient;
  private final DuplicateDetector duplicateDetector;
  private final CollectionPropertyStore propertyStore;
  private final CollectionDirectory collections;
  private final ImportNotifier notifier;
  private final ExecutorService backgroundExecutor;
  private final IngestProperties properties;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Map<Long, List<Future<?>>> backgroundTasks = new ConcurrentHashMap<>();
  private final Object[] scopeLocks = new Object[LOCK_STRIPES];

  @Autowired
  public BatchManager(
      BatchRepository batches,
      ParserFactory parserFactory,
      ExternalDataClient externalClient,
      DuplicateDetector duplicateDetector,
      CollectionPropertyStore propertyStore,
      CollectionDirectory collections,
      ImportNotifier notifier,
      @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor,
      IngestProperties properties,
      Clock clock) {
    this(
        batches,
        parserFactory,
        externalClient,
        duplicateDetector,
        propertyStore,
        collections,
        notifier,
        backgroundExecutor,
        properties,
        clock,
        Sleeper.SYSTEM);
  }

  BatchManager(
      BatchRepository batches,
      ParserFactory parserFactory,
      ExternalDataClient externalClient,
      DuplicateDetector duplicateDetector,
      CollectionPropertyStore propertyStore,
      CollectionDirectory collections,
      ImportNotifier notifier,
      ExecutorService backgroundExecutor,
      IngestProperties properties,
      Clock clock,
      Sleeper sleeper) {
    this.batches = batches;
    this.parserFactory = parserFactory;
    this.externalClient = externalClient;
    this.duplicateDetector = duplicateDetector;
    this.propertyStore = propertyStore;
    this.collections = collections;
    this.notifier = notifier;
    this.backgroundExecutor = backgroundExecutor;
    this.properties = properties;
    this.clock = clock;
    this.sleeper = sleeper;
    for (int i = 0; i < scopeLocks.length; i++) {
      scopeLocks[i] = new Object();
    }
  }

  public Batch createBatch(String ownerId, long collectionId) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new ValidationException("ownerId is required");
    }
    if (!collections.exists(ownerId, collectionId)) {
      throw new NotFoundException("Collection " + collectionId + " not found for owner " + ownerId);
    }
    long batchId = batches.insertBatch(ownerId, collectionId);
    log.info("Created import batch {} for owner {} collection {}", batchId, ownerId, collectionId);
    return requireBatch(batchId);
  }

  public BatchDetails addUrls(long batchId, List<String> urls) {
    requirePending(requireBatch(batchId), "add URLs to");
    if (urls == null || urls.isEmpty()) {
      throw new ValidationException("At least one URL is required");
    }
    List<String> cleaned = new ArrayList<>(urls.size());
    for (int i = 0; i < urls.size(); i++) {
      String url = urls.get(i);
      if (url == null || url.isBlank()) {
        throw new ValidationException("URL at index " + i + " is blank");
      }
      cleaned.add(url.trim());
    }
    batches.appendItems(batchId, cleaned);
    log.info("Queued {} URLs on batch {}", cleaned.size(), batchId);
    return getBatchStatus(batchId);
  }

  /**
   * Commits a placeholder property per pending item straight from its URL, then backfills full details in
   * the background. Items without a parser or that duplicate an existing property fail immediately.
   */
  public InstantCreateResponse createInstant(long batchId) {
    Batch batch = requireBatch(batchId);
    claim(batch, ImportStrategy.INSTANT);
    List<BatchItem> pending = batches.findItemsByStatus(batchId, ParseStatus.PENDING);
    log.info("Instant import of {} items on batch {}", pending.size(), batchId);

    List<ItemResult> results = new ArrayList<>();
    List<ScheduledItem> backfill = new ArrayList<>();
    for (BatchItem item : pending) {
      Optional<ListingParser> parser = parserFactory.getParser(item.sourceUrl());
      if (parser.isEmpty()) {
        recordFailure(item.id(), 0, NO_PARSER);
        results.add(ItemResult.failure(item.id(), item.sourceUrl(), NO_PARSER));
        continue;
      }
      try {
        UrlAddress urlAddress = parser.get().extractAddressFromUrl(item.sourceUrl());
        ParsedProperty placeholder = ParsedProperty.placeholder(
            parser.get().source(), urlAddress, item.sourceUrl(), clock.instant(), List.of(INSTANT_DIAGNOSTIC));
        CommitOutcome outcome =
            commitUnlessDuplicate(batch, placeholder, false, INSTANT_COMMIT_PROGRESS, PropertyOverrides.none());
        if (outcome.duplicate() != null) {
          String reason = DUPLICATE_PREFIX + outcome.duplicate().reason();
          recordFailure(item.id(), 0, reason);
          results.add(ItemResult.duplicate(item.id(), item.sourceUrl(), reason));
          continue;
        }
        batches.setCommittedEntity(item.id(), outcome.property().id(), INSTANT_COMMIT_PROGRESS);
        batches.transition(item.id(), ParseStatus.FULL_PARSING, INSTANT_COMMIT_PROGRESS);
        results.add(
            ItemResult.success(
                item.id(), item.sourceUrl(), outcome.property().id(), urlAddress.address().full()));
        backfill.add(new ScheduledItem(item.id(), item.sourceUrl(), parser.get(), outcome.property().id()));
      } catch (RuntimeException e) {
        log.warn("Instant creation failed for {}: {}", item.sourceUrl(), e.getMessage());
        recordFailure(item.id(), 0, messageOf(e));
        results.add(ItemResult.failure(item.id(), item.sourceUrl(), messageOf(e)));
      }
    }
    batches.refreshCounts(batchId);
    if (backfill.isEmpty()) {
      batches.markCompleted(batchId);
    } else {
      submitBackground(batchId, "instant-backfill", () -> runBackfill(batchId, backfill));
    }
    return new InstantCreateResponse(batchId, results);
  }

  /**
   * Quick pass over every pending item on the caller's thread, then a background full pass over the items
   * whose quick pass succeeded.
   */
  public ProgressiveStartResponse parseProgressive(long batchId) {
    claim(requireBatch(batchId), ImportStrategy.PROGRESSIVE);
    List<BatchItem> pending = batches.findItemsByStatus(batchId, ParseStatus.PENDING);
    log.info("Progressive parse of {} items on batch {}", pending.size(), batchId);

    int quickParsed = 0;
    int quickFailed = 0;
    for (BatchItem item : pending) {
      try {
        batches.transition(item.id(), ParseStatus.QUICK_PARSING, QUICK_PARSING_PROGRESS);
        Optional<ListingParser> parser = parserFactory.getParser(item.sourceUrl());
        if (parser.isEmpty()) {
          recordFailure(item.id(), 0, NO_PARSER);
          quickFailed++;
          continue;
        }
        ParsedProperty quick = parser.get().quickParse(item.sourceUrl());
        batches.transition(item.id(), ParseStatus.QUICK_PARSED, QUICK_PARSED_PROGRESS, quick, null);
        quickParsed++;
      } catch (RuntimeException e) {
        log.warn("Quick parse failed for {}: {}", item.sourceUrl(), e.getMessage());
        recordFailure(item.id(), 0, messageOf(e));
        quickFailed++;
      }
    }
    batches.refreshCounts(batchId);
    if (quickParsed == 0) {
      batches.markCompleted(batchId);
      return new ProgressiveStartResponse(batchId, false, quickParsed, quickFailed);
    }
    submitBackground(batchId, "progressive-full-pass", () -> runFullPass(batchId));
    return new ProgressiveStartResponse(batchId, true, quickParsed, quickFailed);
  }

  /**
   * Full parse of every pending item in order, with a duplicate check and a pause between items. Returns once
   * every item has reached {@code parsed} or {@code failed}.
   */
  public BatchRunResponse parseSequential(long batchId) {
    Batch batch = requireBatch(batchId);
    claim(batch, ImportStrategy.EXHAUSTIVE);
    List<BatchItem> pending = batches.findItemsByStatus(batchId, ParseStatus.PENDING);
    log.info("Sequential parse of {} items on batch {}", pending.size(), batchId);

    List<ItemResult> results = new ArrayList<>();
    for (int i = 0; i < pending.size(); i++) {
      BatchItem item = pending.get(i);
      results.add(parseOne(batch, item));
      if (i < pending.size() - 1 && !pause(properties.getBatch().getInterItemDelayMs())) {
        log.warn("Sequential parse of batch {} interrupted after {} items", batchId, i + 1);
        break;
      }
    }
    batches.markCompleted(batchId);
    BatchSummary summary = summarize(results);
    log.info(
        "Sequential parse of batch {} finished: {} ok, {} failed",
        batchId,
        summary.successful(),
        summary.failed());
    return new BatchRunResponse(batchId, results, summary);
  }

  public BatchRunResponse importSelected(long batchId, List<ImportSelection> selections) {
    Batch batch = requireBatch(batchId);
    if (selections == null || selections.isEmpty()) {
      throw new ValidationException("At least one item must be selected for import");
    }
    List<ItemResult> results = new ArrayList<>(selections.size());
    for (ImportSelection selection : selections) {
      results.add(importOne(batch, selection));
    }
    batches.refreshCounts(batchId);
    BatchSummary summary = summarize(results);
    log.info(
        "Imported {} of {} selected items from batch {}",
        summary.successful(),
        summary.total(),
        batchId);
    return new BatchRunResponse(batchId, results, summary);
  }

  /**
   * Looks a listing up through the structured API and queues it on the batch already parsed, ready for
   * {@link #importSelected}.
   */
  public BatchItem importExternal(long batchId, String externalId) {
    requirePending(requireBatch(batchId), "queue an external listing on");
    if (externalId == null || externalId.isBlank()) {
      throw new ValidationException("External property id is required");
    }
    ParsedProperty property = externalClient.getById(externalId.trim());
    List<BatchItem> added =
        batches.appendItems(batchId, List.of(ExternalDataClient.externalSourceUrl(externalId.trim())));
    BatchItem item = added.get(0);
    batches.transition(item.id(), ParseStatus.FULL_PARSING, FULL_PARSING_PROGRESS);
    BatchItem parsed =
        batches.transition(item.id(), ParseStatus.PARSED, DONE_PROGRESS, property, null);
    batches.refreshCounts(batchId);
    log.info("Queued external listing {} on batch {} as item {}", externalId, batchId, item.id());
    return parsed;
  }

  public BatchDetails getBatchStatus(long batchId) {
    Batch batch = requireBatch(batchId);
    return new BatchDetails(batch, batches.findItems(batchId));
  }

  public void deleteBatch(long batchId) {
    requireBatch(batchId);
    List<Future<?>> tasks = backgroundTasks.remove(batchId);
    int cancelled = 0;
    if (tasks != null) {
      for (Future<?> task : tasks) {
        if (task.cancel(true)) {
          cancelled++;
        }
      }
    }
    batches.deleteBatch(batchId);
    log.info("Deleted batch {} ({} background tasks cancelled)", batchId, cancelled);
  }

  boolean hasBackgroundWork(long batchId) {
    List<Future<?>> tasks = backgroundTasks.get(batchId);
    return tasks != null && tasks.stream().anyMatch(task -> !task.isDone());
  }

  private ItemResult parseOne(Batch batch, BatchItem item) {
    try {
      batches.transition(item.id(), ParseStatus.FULL_PARSING, BACKFILL_PROGRESS);
      Optional<ListingParser> parser = parserFactory.getParser(item.sourceUrl());
      if (parser.isEmpty()) {
        recordFailure(item.id(), 0, NO_PARSER);
        return ItemResult.failure(item.id(), item.sourceUrl(), NO_PARSER);
      }
      ParsedProperty parsed = parser.get().parse(item.sourceUrl());
      DuplicateCheckResult duplicate =
          duplicateDetector.check(batch.ownerId(), batch.collectionId(), parsed);
      if (duplicate.duplicate()) {
        String reason = DUPLICATE_PREFIX + duplicate.reason();
        batches.transition(item.id(), ParseStatus.FAILED, DONE_PROGRESS, parsed, reason);
        return ItemResult.duplicate(item.id(), item.sourceUrl(), reason);
      }
      batches.transition(item.id(), ParseStatus.PARSED, DONE_PROGRESS, parsed, null);
      return ItemResult.success(item.id(), item.sourceUrl(), null, parsed.address().full());
    } catch (RuntimeException e) {
      log.warn("Full parse failed for {}: {}", item.sourceUrl(), e.getMessage());
      recordFailure(item.id(), 0, messageOf(e));
      return ItemResult.failure(item.id(), item.sourceUrl(), messageOf(e));
    }
  }

  private ItemResult importOne(Batch batch, ImportSelection selection) {
    Optional<BatchItem> found = batches.findItem(selection.itemId());
    if (found.isEmpty() || found.get().batchId() != batch.id()) {
      return ItemResult.failure(selection.itemId(), null, NOT_PARSED);
    }
    BatchItem item = found.get();
    if (item.parseStatus() == ParseStatus.FAILED
        && item.parseError() != null
        && item.parseError().startsWith(DUPLICATE_PREFIX)) {
      return ItemResult.duplicate(item.id(), item.sourceUrl(), item.parseError());
    }
    if (item.parseStatus() != ParseStatus.PARSED || item.parsedData() == null) {
      return ItemResult.failure(item.id(), item.sourceUrl(), NOT_PARSED);
    }
    try {
      PropertyOverrides overrides =
          selection.overrides() == null ? PropertyOverrides.none() : selection.overrides();
      CommitOutcome outcome =
          commitUnlessDuplicate(batch, item.parsedData(), true, DONE_PROGRESS, overrides);
      if (outcome.duplicate() != null) {
        String reason = DUPLICATE_PREFIX + outcome.duplicate().reason();
        batches.transition(item.id(), ParseStatus.FAILED, item.loadingProgress(), null, reason);
        return ItemResult.duplicate(item.id(), item.sourceUrl(), reason);
      }
      CommittedProperty committed = outcome.property();
      batches.transition(item.id(), ParseStatus.IMPORTED, DONE_PROGRESS);
      batches.setCommittedEntity(item.id(), committed.id(), DONE_PROGRESS);
      notifier.propertyImported(committed);
      return ItemResult.success(item.id(), item.sourceUrl(), committed.id(), committed.addressFull());
    } catch (IllegalStateTransitionException e) {
      return ItemResult.failure(item.id(), item.sourceUrl(), e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Import failed for item {} ({}): {}", item.id(), item.sourceUrl(), e.getMessage());
      return ItemResult.failure(item.id(), item.sourceUrl(), messageOf(e));
    }
  }

  /**
   * The duplicate check and the insert run under the lock stripe of the owner/collection scope, so two
   * imports of the same listing cannot both pass the check.
   */
  private CommitOutcome commitUnlessDuplicate(
      Batch batch,
      ParsedProperty data,
      boolean fullyParsed,
      int loadingProgress,
      PropertyOverrides overrides) {
    String scope = batch.ownerId() + ":" + batch.collectionId();
    synchronized (scopeLocks[Math.floorMod(scope.hashCode(), scopeLocks.length)]) {
      DuplicateCheckResult duplicate =
          duplicateDetector.check(batch.ownerId(), batch.collectionId(), data);
      if (duplicate.duplicate()) {
        return new CommitOutcome(null, duplicate);
      }
      CommittedProperty committed =
          propertyStore.commit(
              batch.ownerId(), batch.collectionId(), data, fullyParsed, loadingProgress, overrides);
      return new CommitOutcome(committed, null);
    }
  }

  private void runBackfill(long batchId, List<ScheduledItem> items) {
    try {
      for (int i = 0; i < items.size(); i++) {
        if (!shouldContinue(batchId)) {
          log.info("Instant backfill of batch {} stopped", batchId);
          return;
        }
        ScheduledItem item = items.get(i);
        try {
          if (!batches.updateProgress(item.itemId(), ParseStatus.FULL_PARSING, BACKFILL_PROGRESS)) {
            log.info("Batch {} item {} is no longer awaiting backfill; skipping", batchId, item.itemId());
            continue;
          }
          propertyStore.updateLoadingProgress(item.entityId(), BACKFILL_PROGRESS);
          ParsedProperty full = item.parser().parse(item.sourceUrl());
          batches.transition(item.itemId(), ParseStatus.PARSED, DONE_PROGRESS, full, null);
          propertyStore.backfill(item.entityId(), full);
          batches.transition(item.itemId(), ParseStatus.IMPORTED, DONE_PROGRESS);
        } catch (NotFoundException e) {
          log.info("Batch {} item {} disappeared during backfill", batchId, item.itemId());
          return;
        } catch (RuntimeException e) {
          log.warn("Backfill failed for {}: {}", item.sourceUrl(), e.getMessage());
          recordFailure(item.itemId(), INSTANT_COMMIT_PROGRESS, messageOf(e));
          propertyStore.updateLoadingProgress(item.entityId(), INSTANT_COMMIT_PROGRESS);
        }
        if (i < items.size() - 1 && !pause(properties.getBatch().getInterItemDelayMs())) {
          return;
        }
      }
    } finally {
      completeIfPresent(batchId);
    }
  }

  private void runFullPass(long batchId) {
    try {
      List<BatchItem> survivors = batches.findItemsByStatus(batchId, ParseStatus.QUICK_PARSED);
      for (int i = 0; i < survivors.size(); i++) {
        if (!shouldContinue(batchId)) {
          log.info("Progressive full pass of batch {} stopped", batchId);
          return;
        }
        BatchItem item = survivors.get(i);
        try {
          batches.transition(item.id(), ParseStatus.FULL_PARSING, FULL_PARSING_PROGRESS);
          Optional<ListingParser> parser = parserFactory.getParser(item.sourceUrl());
          if (parser.isEmpty()) {
            recordFailure(item.id(), QUICK_PARSED_PROGRESS, NO_PARSER);
            continue;
          }
          ParsedProperty full = parser.get().parse(item.sourceUrl());
          batches.transition(item.id(), ParseStatus.PARSED, DONE_PROGRESS, full, null);
        } catch (NotFoundException e) {
          log.info("Batch {} item {} disappeared during full pass", batchId, item.id());
          return;
        } catch (RuntimeException e) {
          log.warn("Full pass failed for {}: {}", item.sourceUrl(), e.getMessage());
          recordFailure(item.id(), QUICK_PARSED_PROGRESS, messageOf(e));
        }
        if (i < survivors.size() - 1 && !pause(properties.getBatch().getFullPassDelayMs())) {
          return;
        }
      }
    } finally {
      completeIfPresent(batchId);
    }
  }

  private void submitBackground(long batchId, String label, Runnable work) {
    FutureTask<Void> task =
        new FutureTask<>(
            () -> {
              try {
                work.run();
              } catch (RuntimeException e) {
                log.error("Background {} for batch {} failed", label, batchId, e);
              }
            },
            null);
    List<Future<?>> tasks = backgroundTasks.computeIfAbsent(batchId, ignored -> new CopyOnWriteArrayList<>());
    tasks.add(task);
    try {
      backgroundExecutor.execute(
          () -> {
            try {
              task.run();
            } finally {
              tasks.remove(task);
              backgroundTasks.remove(batchId, List.<Future<?>>of());
            }
          });
    } catch (RejectedExecutionException e) {
      tasks.remove(task);
      log.error("Background {} for batch {} rejected: {}", label, batchId, e.getMessage());
      batches.markCompleted(batchId);
    }
  }

  private void completeIfPresent(long batchId) {
    try {
      if (batches.batchExists(batchId)) {
        batches.markCompleted(batchId);
        log.info("Batch {} completed", batchId);
      }
    } catch (RuntimeException e) {
      log.warn("Could not complete batch {}: {}", batchId, e.getMessage());
    }
  }

  private boolean shouldContinue(long batchId) {
    return !Thread.currentThread().isInterrupted() && batches.batchExists(batchId);
  }

  private boolean pause(long millis) {
    if (millis <= 0) {
      return !Thread.currentThread().isInterrupted();
    }
    try {
      sleeper.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void recordFailure(long itemId, int loadingProgress, String error) {
    try {
      batches.transition(itemId, ParseStatus.FAILED, loadingProgress, null, error);
    } catch (IllegalStateTransitionException | NotFoundException e) {
      log.debug("Could not mark item {} failed: {}", itemId, e.getMessage());
    }
  }

  private void claim(Batch batch, ImportStrategy strategy) {
    if (!batches.markProcessing(batch.id(), strategy)) {
      BatchStatus current = batches.findBatch(batch.id()).map(Batch::status).orElse(batch.status());
      throw new IllegalStateTransitionException(
          "Batch " + batch.id() + " is " + current.code() + "; " + strategy.code() + " import needs a pending batch");
    }
  }

  private static void requirePending(Batch batch, String action) {
    if (batch.status() != BatchStatus.PENDING) {
      throw new IllegalStateTransitionException(
          "Cannot " + action + " batch " + batch.id() + " while it is " + batch.status().code());
    }
  }

  private Batch requireBatch(long batchId) {
    return batches
        .findBatch(batchId)
        .orElseThrow(() -> new NotFoundException("Batch " + batchId + " not found"));
  }

  private static BatchSummary summarize(List<ItemResult> results) {
    int successful = (int) results.stream().filter(ItemResult::success).count();
    return new BatchSummary(results.size(), successful, results.size() - successful);
  }

  private static String messageOf(RuntimeException e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }

  private record ScheduledItem(long itemId, String sourceUrl, ListingParser parser, long entityId) {}

  private record CommitOutcome(CommittedProperty property, DuplicateCheckResult duplicate) {}
}
