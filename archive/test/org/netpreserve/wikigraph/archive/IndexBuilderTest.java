package org.netpreserve.wikigraph.archive;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndexBuilderTest {
    @Test
    void parseLineSplitsOnTheFirstTwoColonsOnly() {
        var line = IndexBuilder.parseLine("616:12:Wikipedia:Manual of Style: Titles");
        assertNotNull(line);
        assertEquals(616, line.offset());
        assertEquals("12", line.pageId());
        assertEquals("Wikipedia:Manual of Style: Titles", line.title());

        assertNull(IndexBuilder.parseLine(""));
        assertNull(IndexBuilder.parseLine("616:12"));
        assertNull(IndexBuilder.parseLine("abc:12:Title"));
        assertNull(IndexBuilder.parseLine("616::Title"));
    }

    @Test
    void endOffsetIsTheNextStreamOrTheSentinel(@TempDir Path tempDir) throws IOException {
        Path listing = tempDir.resolve("index.txt");
        Files.writeString(listing, """
                100:1:Alpha
                100:2:Beta
                250:3:Gamma
                this line is broken
                250:4:Delta: the sequel
                900:5:Epsilon
                """);
        try (var db = IndexDatabase.newDatabaseInMemory()) {
            var result = new IndexBuilder(db).build(listing);
            assertEquals(new IndexBuilder.Result(5, 3, 1), result);

            assertEquals(List.of(new IndexEntry("Alpha", "1", 100, 250)), db.lookup("Alpha"));
            assertEquals(List.of(new IndexEntry("Beta", "2", 100, 250)), db.lookup("Beta"));
            assertEquals(List.of(new IndexEntry("Delta: the sequel", "4", 250, 900)), db.lookup("Delta: the sequel"));
            var last = db.lookup("Epsilon").get(0);
            assertTrue(last.readsToEnd());
            assertEquals(List.of(new IndexEntry("Gamma", "3", 250, 900)), db.lookupById("3"));
        }
    }

    @Test
    void rebuildingReplacesPreviousEntries(@TempDir Path tempDir) throws IOException {
        Path listing = tempDir.resolve("index.txt");
        try (var db = IndexDatabase.newDatabaseInMemory()) {
            Files.writeString(listing, "0:1:Old\n");
            new IndexBuilder(db).build(listing);
            Files.writeString(listing, "0:2:New\n");
            new IndexBuilder(db).build(listing);
            assertEquals(List.of(), db.lookup("Old"));
            assertEquals(1, db.entries().count());
        }
    }

    @Test
    void failedRebuildKeepsThePreviousIndex(@TempDir Path tempDir) throws IOException {
        Path listing = tempDir.resolve("index.txt");
        try (var db = IndexDatabase.newDatabaseInMemory()) {
            Files.writeString(listing, "0:1:Old\n");
            new IndexBuilder(db).build(listing);
            Files.writeString(listing, "0:2:New\n-5:3:Before the start of the archive\n");
            assertThrows(IllegalArgumentException.class, () -> new IndexBuilder(db).build(listing));
            assertEquals(List.of(new IndexEntry("Old", "1", 0, IndexEntry.END_OF_ARCHIVE)), db.lookup("Old"));
            assertEquals(List.of(), db.lookup("New"));
            assertEquals(1, db.entries().count());
        }
    }

    @Test
    void readsCompressedListings(@TempDir Path tempDir) throws IOException {
        Path listing = tempDir.resolve("index.txt.bz2");
        Files.write(listing, TestArchive.compress("0:1:A\n0:2:B\n"));
        try (var db = IndexDatabase.newDatabaseInMemory()) {
            assertEquals(new IndexBuilder.Result(2, 1, 0), new IndexBuilder(db).build(listing));
            assertEquals(1, db.entries().countStreams());
        }
    }
}
