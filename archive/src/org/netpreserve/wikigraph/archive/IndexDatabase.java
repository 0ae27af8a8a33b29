package org.netpreserve.wikigraph.archive;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * SQLite backed {@link OffsetIndex}.
 */
public interface IndexDatabase extends OffsetIndex, AutoCloseable, Transactional<IndexDatabase> {
    static IndexDatabase newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    /**
     * Opens an index that must already exist, as built by {@link IndexBuilder}.
     */
    static IndexDatabase openExisting(Path path) throws IOException {
        if (!Files.isRegularFile(path)) throw new NoSuchFileException(path.toString(), null, "index database not found");
        return open(path);
    }

    static IndexDatabase open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static IndexDatabase open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setConnectionInitSql("PRAGMA synchronous = NORMAL; PRAGMA busy_timeout = 60000;");
        config.setMaximumPoolSize(1);
        config.setPoolName("index");
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        IndexDatabase db = jdbi.onDemand(IndexDatabase.class);
        db.init();
        return db;
    }

    default void init() {
        // we can't use @SqlScript because we need to use executeAsSeparateStatements() on sqlite
        try (var stream = Objects.requireNonNull(IndexDatabase.class.getResourceAsStream("index-schema.sql"),
                "missing index-schema.sql")) {
            var schema = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    IndexEntryDAO entries();

    @Override
    default List<IndexEntry> lookup(String title) {
        return entries().findByTitle(title);
    }

    @Override
    default List<IndexEntry> lookupById(String documentId) {
        return entries().findById(documentId);
    }

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
