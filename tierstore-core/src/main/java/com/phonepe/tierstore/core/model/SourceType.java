package com.phonepe.tierstore.core.model;

/**
 * Discriminator for {@link RecordSource} subtypes
 */
public enum SourceType {
    /**
     * Produced first hand by the owner of the store
     */
    DIRECT_EXPERIENCE,
    /**
     * Looked up from somewhere else in answer to a query
     */
    RESEARCHED,
}
