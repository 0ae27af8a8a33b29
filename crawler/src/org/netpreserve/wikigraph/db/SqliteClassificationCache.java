package org.netpreserve.wikigraph.db;

import org.netpreserve.wikigraph.ClassificationCache;

import java.time.Instant;
import java.util.Optional;

public class SqliteClassificationCache implements ClassificationCache {
    private final ClassificationDAO dao;

    public SqliteClassificationCache(ClassificationDAO dao) {
        this.dao = dao;
    }

    @Override
    public Optional<Boolean> get(String title) {
        return dao.find(title);
    }

    @Override
    public void set(String title, boolean accepted) {
        dao.save(title, accepted, Instant.now());
    }
}
