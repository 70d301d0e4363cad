package com.delta.listingimport.ingest.store;

import com.delta.listingimport.ingest.model.CommittedProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default post-commit hook. Hands the event to the notification executor and records it; downstream
 * dispatch (email, timeline) plugs in by replacing this bean.
 */
@Component
public class LoggingImportNotifier implements ImportNotifier {
  private static final Logger log = LoggerFactory.getLogger(LoggingImportNotifier.class);

  private final ExecutorService notificationExecutor;

  public LoggingImportNotifier(@Qualifier("notificationExecutor") ExecutorService notificationExecutor) {
    this.notificationExecutor = notificationExecutor;
  }

  @Override
  public void propertyImported(CommittedProperty property) {
    try {
      notificationExecutor.submit(
          () ->
              log.info(
                  "Property {} imported into collection {} for owner {}: {}",
                  property.id(),
                  property.collectionId(),
                  property.ownerId(),
                  property.addressFull()));
    } catch (RejectedExecutionException e) {
      log.warn("Import notification for property {} dropped: {}", property.id(), e.getMessage());
    }
  }
}
