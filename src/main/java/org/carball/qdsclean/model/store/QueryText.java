package org.carball.qdsclean.model.store;

/**
 * A row of sys.query_store_query_text.
 */
public record QueryText(long queryTextId, String sqlText) {}
