package com.delta.listingimport.ingest.api;

import com.delta.listingimport.ingest.batch.BatchManager;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.model.Batch;
import com.delta.listingimport.ingest.model.BatchDetails;
import com.delta.listingimport.ingest.model.BatchItem;
import com.delta.listingimport.ingest.model.BatchRunResponse;
import com.delta.listingimport.ingest.model.InstantCreateResponse;
import com.delta.listingimport.ingest.model.ProgressiveStartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/batches")
public class BatchController {
    private final BatchManager batchManager;

    public BatchController(BatchManager batchManager) {
        this.batchManager = batchManager;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Batch createBatch(@RequestBody CreateBatchRequest request) {
        if (request == null || request.collectionId() == null) {
            throw new ValidationException("collectionId is required");
        }
        return batchManager.createBatch(request.ownerId(), request.collectionId());
    }

    @PostMapping("/{id}/urls")
    public BatchDetails addUrls(@PathVariable("id") long batchId, @RequestBody AddUrlsRequest request) {
        return batchManager.addUrls(batchId, request == null ? null : request.urls());
    }

    @PostMapping("/{id}/instant")
    public InstantCreateResponse createInstant(@PathVariable("id") long batchId) {
        return batchManager.createInstant(batchId);
    }

    @PostMapping("/{id}/progressive")
    public ProgressiveStartResponse parseProgressive(@PathVariable("id") long batchId) {
        return batchManager.parseProgressive(batchId);
    }

    @PostMapping("/{id}/sequential")
    public BatchRunResponse parseSequential(@PathVariable("id") long batchId) {
        return batchManager.parseSequential(batchId);
    }

    @PostMapping("/{id}/import")
    public BatchRunResponse importSelected(@PathVariable("id") long batchId, @RequestBody ImportRequest request) {
        return batchManager.importSelected(batchId, request == null ? null : request.selections());
    }

    @PostMapping("/{id}/external")
    public BatchItem importExternal(@PathVariable("id") long batchId, @RequestBody ExternalImportRequest request) {
        return batchManager.importExternal(batchId, request == null ? null : request.propertyId());
    }

    @GetMapping("/{id}")
    public BatchDetails getBatch(@PathVariable("id") long batchId) {
        return batchManager.getBatchStatus(batchId);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteBatch(@PathVariable("id") long batchId) {
        batchManager.deleteBatch(batchId);
    }
}
