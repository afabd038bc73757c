package com.gentoro.gae.catalog;

/**
 * Fire-and-forget front of the {@link ExecutionCatalog}: a failing catalog is logged and never
 * affects the execution that produced the record.
 */
public class CatalogPublisher {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(CatalogPublisher.class);

  private final ExecutionCatalog catalog;

  public CatalogPublisher(ExecutionCatalog catalog) {
    this.catalog = catalog;
  }

  public static CatalogPublisher disabled() {
    return new CatalogPublisher(null);
  }

  public boolean isEnabled() {
    return catalog != null;
  }

  /** @return whether the record was accepted */
  public boolean publish(ExecutionRecord record) {
    if (catalog == null) return false;
    try {
      catalog.record(record);
      log.debug("Execution {} recorded in catalog", record.executionId());
      return true;
    } catch (RuntimeException e) {
      log.warn(
          "Could not record execution {} in catalog: {}", record.executionId(), e.getMessage());
      return false;
    }
  }
}
