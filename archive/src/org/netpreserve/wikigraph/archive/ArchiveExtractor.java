package org.netpreserve.wikigraph.archive;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Pulls single pages out of a Wikipedia {@code pages-articles-multistream.xml.bz2} dump.
 * <p>
 * The dump is a concatenation of independent bzip2 streams of roughly a hundred pages each. The offset index gives
 * the byte range of the stream containing a page, so only that range is read and decompressed, and the
 * {@link DocumentScanner} then picks the requested page out of its neighbours.
 * <p>
 * Every extraction opens its own file channel and scans with fresh parser state, so instances can be shared between
 * threads.
 */
public class ArchiveExtractor implements DocumentSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);
    private final Path archive;
    private final OffsetIndex index;
    private final DocumentScanner scanner = new DocumentScanner();
    private final Cache<String, ExtractedDocument> recentDocuments;

    public ArchiveExtractor(Path archive, OffsetIndex index) throws IOException {
        this(archive, index, 0);
    }

    /**
     * @param cacheSize maximum total characters of recently retrieved pages to keep, 0 to disable
     * @throws NoSuchFileException if the archive does not exist
     */
    public ArchiveExtractor(Path archive, OffsetIndex index, long cacheSize) throws IOException {
        if (!Files.isRegularFile(archive)) {
            throw new NoSuchFileException(archive.toString(), null, "archive not found");
        }
        this.archive = archive;
        this.index = index;
        this.recentDocuments = Caffeine.newBuilder()
                .maximumWeight(cacheSize)
                .weigher((String title, ExtractedDocument document) -> document.rawText().length())
                .build();
    }

    @Override
    public IndexEntry resolve(String title) throws ArticleNotFoundException {
        return pickEntry(title, index.lookup(title));
    }

    @Override
    public ExtractedDocument retrieve(String title) throws ExtractionException {
        var cached = recentDocuments.getIfPresent(title);
        if (cached != null) return cached;
        var document = extract(resolve(title));
        recentDocuments.put(title, document);
        return document;
    }

    public ExtractedDocument retrieveById(String documentId) throws ExtractionException {
        List<IndexEntry> entries = index.lookupById(documentId);
        if (entries.isEmpty()) throw new ArticleNotFoundException("#" + documentId);
        return extract(entries.get(0));
    }

    /**
     * Reads, decompresses and scans the stream an index entry points at.
     */
    public ExtractedDocument extract(IndexEntry entry) throws ExtractionException {
        long start = System.nanoTime();
        byte[] block;
        try {
            block = decompress(readSpan(entry));
        } catch (IOException e) {
            throw new CorruptArchiveException(entry, e);
        }
        var scan = scanner.scanBlock(block, entry.documentId());
        if (!scan.found()) throw new ScanNotFoundException(entry, scan.error());
        String text = scan.page();
        log.atDebug()
                .addKeyValue("title", entry.title())
                .addKeyValue("id", entry.documentId())
                .addKeyValue("blockSize", block.length)
                .addKeyValue("millis", (System.nanoTime() - start) / 1_000_000)
                .log("Extracted page");
        return new ExtractedDocument(entry.documentId(), entry.title(), text);
    }

    private static IndexEntry pickEntry(String title, List<IndexEntry> entries) throws ArticleNotFoundException {
        if (entries.isEmpty()) throw new ArticleNotFoundException(title);
        if (entries.size() > 1) {
            log.warn("Got {} index entries for title={}, using the first (id {})", entries.size(), title,
                    entries.get(0).documentId());
        }
        return entries.get(0);
    }

    /**
     * Reads the compressed bytes of one stream. Bytes before the start offset are skipped by positioning the
     * channel rather than reading them.
     */
    byte[] readSpan(IndexEntry entry) throws IOException {
        try (var channel = FileChannel.open(archive, StandardOpenOption.READ)) {
            long end = entry.readsToEnd() ? channel.size() : Math.min(entry.endOffset(), channel.size());
            long length = end - entry.startOffset();
            if (length <= 0) {
                throw new EOFException("span starts at " + entry.startOffset() + " past end of archive (" +
                                       channel.size() + " bytes)");
            }
            if (length > Integer.MAX_VALUE - 8) throw new IOException("span too large: " + length + " bytes");
            var buffer = ByteBuffer.allocate((int) length);
            channel.position(entry.startOffset());
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) throw new EOFException("archive truncated at " + channel.position());
            }
            return buffer.array();
        }
    }

    static byte[] decompress(byte[] span) throws IOException {
        try (var stream = new BZip2CompressorInputStream(new ByteArrayInputStream(span), true)) {
            return stream.readAllBytes();
        }
    }

    /**
     * Drops the cached pages and closes the index.
     */
    @Override
    public void close() {
        recentDocuments.invalidateAll();
        index.close();
    }
}
