package dk.trustworks.filebridge.source;

/**
 * One ancestor container of a file record (a site or a drive).
 */
public record Breadcrumb(String entityId, String name, String entityType) {}
