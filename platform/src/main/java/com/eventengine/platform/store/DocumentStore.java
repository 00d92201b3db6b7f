package com.eventengine.platform.store;

import com.eventengine.platform.base.Result;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-model persistence: named collections of JSON documents keyed by document id.
 *
 * Aggregate state is projected into the collection named by the aggregate's
 * {@code aggregateCollection}, one document per aggregate instance.
 */
public interface DocumentStore {

    /**
     * Documents of a collection that match the filter, in storage order.
     *
     * @param collectionName The collection to read
     * @param filter Document predicate
     * @param skip Number of matching documents to skip
     * @param limit Maximum number of documents to return
     * @return Matching documents; an unknown collection yields an empty list
     */
    Result<List<Map<String, Object>>> filterDocs(String collectionName, Filter filter, int skip, int limit);

    /**
     * Insert or replace a document.
     */
    Result<Map<String, Object>> upsertDoc(String collectionName, String docId, Map<String, Object> doc);

    /**
     * Fetch a single document.
     */
    Result<Optional<Map<String, Object>>> getDoc(String collectionName, String docId);
}
