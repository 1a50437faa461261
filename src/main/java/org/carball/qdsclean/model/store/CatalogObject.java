package org.carball.qdsclean.model.store;

/**
 * An entry of the database object catalog (sys.objects joined to sys.schemas).
 */
public record CatalogObject(long objectId, String schemaName, String objectName) {}
