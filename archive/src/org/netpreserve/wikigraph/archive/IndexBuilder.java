package org.netpreserve.wikigraph.archive;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Loads the dump's {@code multistream-index.txt} listing into an {@link IndexDatabase}.
 * <p>
 * Each listing line has the form {@code offset:pageId:title}. Titles may themselves contain colons so only the
 * first two are treated as separators. The end offset of an entry is the next larger distinct stream offset in the
 * listing, or {@link IndexEntry#END_OF_ARCHIVE} for entries in the final stream.
 */
public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);
    private static final int BATCH_SIZE = 10_000;
    private final IndexDatabase db;

    public IndexBuilder(IndexDatabase db) {
        this.db = db;
    }

    public record Result(long entries, long streams, long skipped) {
    }

    /**
     * Replaces the contents of the index with the entries of the listing. Listings ending in {@code .bz2} are
     * decompressed on the fly.
     */
    public Result build(Path listing) throws IOException {
        // first pass: collect the stream offsets so that each entry can be given the offset of the following stream
        NavigableSet<Long> streamOffsets = new TreeSet<>();
        long skipped = 0;
        try (var reader = openListing(listing)) {
            for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                var entry = parseLine(line);
                if (entry == null) {
                    skipped++;
                    continue;
                }
                streamOffsets.add(entry.offset());
            }
        }
        log.info("Found {} streams in {}", streamOffsets.size(), listing);

        // one transaction so that a failed rebuild leaves the previous index untouched
        long entries = db.inTransaction(tx -> {
            var dao = tx.entries();
            dao.deleteAll();
            long inserted = 0;
            long lineNumber = 0;
            try (var reader = openListing(listing)) {
                var batch = new ArrayList<IndexEntry>(BATCH_SIZE);
                for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                    lineNumber++;
                    var parsed = parseLine(line);
                    if (parsed == null) {
                        log.warn("Skipping malformed index line {}: {}", lineNumber, line);
                        continue;
                    }
                    Long next = streamOffsets.higher(parsed.offset());
                    batch.add(new IndexEntry(parsed.title(), parsed.pageId(), parsed.offset(),
                            next == null ? IndexEntry.END_OF_ARCHIVE : next));
                    if (batch.size() >= BATCH_SIZE) {
                        inserted += flush(dao, batch);
                        if (inserted % 1_000_000 == 0) log.info("Indexed {} entries", inserted);
                    }
                }
                inserted += flush(dao, batch);
            }
            return inserted;
        });
        log.info("Indexed {} entries in {} streams ({} lines skipped)", entries, streamOffsets.size(), skipped);
        return new Result(entries, streamOffsets.size(), skipped);
    }

    private static int flush(IndexEntryDAO dao, List<IndexEntry> batch) {
        if (batch.isEmpty()) return 0;
        int size = batch.size();
        dao.insertAll(batch);
        batch.clear();
        return size;
    }

    private static BufferedReader openListing(Path listing) throws IOException {
        InputStream stream = new BufferedInputStream(Files.newInputStream(listing));
        if (listing.getFileName().toString().endsWith(".bz2")) {
            stream = new BZip2CompressorInputStream(stream, true);
        }
        return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
    }

    record ListingLine(long offset, String pageId, String title) {
    }

    static @Nullable ListingLine parseLine(String line) {
        int first = line.indexOf(':');
        if (first <= 0) return null;
        int second = line.indexOf(':', first + 1);
        if (second < 0) return null;
        String pageId = line.substring(first + 1, second);
        String title = line.substring(second + 1);
        if (pageId.isEmpty() || title.isEmpty()) return null;
        try {
            return new ListingLine(Long.parseLong(line.substring(0, first)), pageId, title);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
