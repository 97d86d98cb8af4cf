package com.media.lifecycle.source;

/**
 * Tag defined in a catalog. Catalog items reference tags by id.
 */
public record CatalogTag(int id, String label) {}
