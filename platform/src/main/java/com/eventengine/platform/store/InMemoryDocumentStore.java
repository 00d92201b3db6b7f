package com.eventengine.platform.store;

import com.eventengine.platform.base.Result;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.eventengine.platform.base.OrderedMaps.immutableCopy;

/**
 * DocumentStore kept in memory. Documents keep their first insertion order,
 * an upsert of an existing id replaces the document in place.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    @Override
    public Result<List<Map<String, Object>>> filterDocs(String collectionName, Filter filter, int skip, int limit) {
        return Result.of(() -> {
            if (skip < 0 || limit < 0) {
                throw new IllegalArgumentException("skip and limit must be >= 0, got skip=" + skip + ", limit=" + limit);
            }
            var collection = collections.get(collectionName);
            if (collection == null) {
                return List.of();
            }
            synchronized (collection) {
                return collection.values().stream()
                        .filter(filter::matches)
                        .skip(skip)
                        .limit(limit)
                        .toList();
            }
        });
    }

    @Override
    public Result<Map<String, Object>> upsertDoc(String collectionName, String docId, Map<String, Object> doc) {
        return Result.of(() -> {
            var copy = immutableCopy(doc);
            var collection = collections.computeIfAbsent(collectionName, name -> new LinkedHashMap<>());
            synchronized (collection) {
                collection.put(docId, copy);
            }
            return copy;
        });
    }

    @Override
    public Result<Optional<Map<String, Object>>> getDoc(String collectionName, String docId) {
        var collection = collections.get(collectionName);
        if (collection == null) {
            return Result.success(Optional.empty());
        }
        synchronized (collection) {
            return Result.success(Optional.ofNullable(collection.get(docId)));
        }
    }

    /**
     * Names of all collections that hold at least one document.
     */
    public List<String> collectionNames() {
        return new ArrayList<>(collections.keySet());
    }
}
