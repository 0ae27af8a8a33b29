package org.netpreserve.wikigraph.archive;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reconstructs the XML of a single page out of a decompressed block holding many pages.
 * <p>
 * The block is read as a stream of StAX events. Events are re-serialized into a buffer which is discarded whenever
 * a new page starts, so at the end of the matching page the buffer holds exactly that page. Blocks are not
 * well-formed documents on their own (several top-level pages, the dump header in the first stream, a dangling
 * {@code </mediawiki>} in the last), so they are wrapped in a synthetic root element and parse errors after the
 * target page has been found are ignored.
 * <p>
 * Tags are reconstructed rather than copied: attributes keep their order, text is re-escaped, and comments and
 * processing instructions are dropped.
 * <p>
 * Scans share no state, so one scanner can be used from several threads.
 */
public class DocumentScanner {
    private static final Logger log = LoggerFactory.getLogger(DocumentScanner.class);
    private static final byte[] BLOCK_START = "<wikigraph-block>".getBytes(StandardCharsets.UTF_8);
    private static final byte[] BLOCK_END = "</wikigraph-block>".getBytes(StandardCharsets.UTF_8);

    public static final String PAGE_TAG = "page";
    public static final String ID_TAG = "id";

    private final String pageTag;
    private final String idTag;

    public DocumentScanner() {
        this(PAGE_TAG, ID_TAG);
    }

    public DocumentScanner(String pageTag, String idTag) {
        this.pageTag = pageTag;
        this.idTag = idTag;
    }

    /**
     * Factories aren't documented as thread-safe, so every scan gets its own.
     */
    private static XMLInputFactory newInputFactory() {
        var inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
        inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return inputFactory;
    }

    /**
     * Outcome of a scan.
     *
     * @param page  the reconstructed page, or null if it wasn't found
     * @param error why the block could not be read to the end, if it became unreadable before the page was found
     */
    public record Result(@Nullable String page, @Nullable XMLStreamException error) {
        public boolean found() {
            return page != null;
        }
    }

    enum State {
        SEARCHING, DONE
    }

    /**
     * Everything a single scan knows. Lives only for the duration of one {@link #scan} call.
     */
    static final class ScanState {
        final String targetId;
        State state = State.SEARCHING;
        final StringBuilder lines = new StringBuilder();
        @Nullable String observedId;
        boolean awaitingId;
        int depth;
        int pageDepth = -1;
        @Nullable String result;

        ScanState(String targetId) {
            this.targetId = targetId;
        }

        void startPage() {
            lines.setLength(0);
            observedId = null;
            awaitingId = false;
            pageDepth = depth;
        }
    }

    public Optional<String> scan(String block, String documentId) {
        return scan(block.getBytes(StandardCharsets.UTF_8), documentId);
    }

    public Optional<String> scan(byte[] block, String documentId) {
        return Optional.ofNullable(scanBlock(block, documentId).page());
    }

    /**
     * Scans a UTF-8 encoded block for the page whose first direct {@code <id>} child equals {@code documentId}.
     */
    public Result scanBlock(byte[] block, String documentId) {
        var scan = new ScanState(documentId.trim());
        InputStream input = new SequenceInputStream(Collections.enumeration(List.of(
                new ByteArrayInputStream(BLOCK_START),
                new ByteArrayInputStream(block),
                new ByteArrayInputStream(BLOCK_END))));
        XMLStreamException error = null;
        XMLStreamReader reader = null;
        try {
            reader = newInputFactory().createXMLStreamReader(input, StandardCharsets.UTF_8.name());
            reader.nextTag(); // synthetic root
            while (scan.state == State.SEARCHING && reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.END_ELEMENT && scan.depth == 0) break; // synthetic root
                handle(scan, reader, event);
            }
        } catch (XMLStreamException e) {
            if (scan.state == State.DONE) {
                log.trace("Ignoring malformed content after page {}: {}", documentId, e.getMessage());
            } else {
                error = e;
            }
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.trace("Error closing reader", e);
                }
            }
        }
        return new Result(scan.result, error);
    }

    private void handle(ScanState scan, XMLStreamReader reader, int event) {
        switch (event) {
            case XMLStreamConstants.START_ELEMENT -> {
                scan.depth++;
                String name = reader.getLocalName();
                if (name.equals(pageTag)) {
                    scan.startPage();
                } else if (name.equals(idTag) && scan.pageDepth >= 0 && scan.depth == scan.pageDepth + 1
                           && scan.observedId == null) {
                    scan.awaitingId = true;
                }
                appendStartTag(scan.lines, reader);
            }
            case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                String text = reader.getText();
                if (scan.awaitingId && scan.observedId == null) {
                    scan.observedId = text;
                }
                escapeText(scan.lines, text);
            }
            case XMLStreamConstants.END_ELEMENT -> {
                String name = reader.getLocalName();
                scan.lines.append("</").append(qualifiedName(reader.getPrefix(), name)).append('>');
                if (name.equals(idTag)) {
                    scan.awaitingId = false;
                } else if (name.equals(pageTag) && scan.depth == scan.pageDepth) {
                    if (scan.observedId != null && scan.observedId.trim().equals(scan.targetId)) {
                        scan.result = scan.lines.toString();
                        scan.state = State.DONE;
                    }
                    scan.pageDepth = -1;
                }
                scan.depth--;
            }
            default -> {
                // comments and processing instructions are not part of the reconstruction
            }
        }
    }

    private static void appendStartTag(StringBuilder out, XMLStreamReader reader) {
        out.append('<').append(qualifiedName(reader.getPrefix(), reader.getLocalName()));
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            String prefix = reader.getNamespacePrefix(i);
            out.append(' ').append(prefix == null || prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix).append("=\"");
            escapeAttribute(out, reader.getNamespaceURI(i));
            out.append('"');
        }
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            out.append(' ').append(qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)))
                    .append("=\"");
            escapeAttribute(out, reader.getAttributeValue(i));
            out.append('"');
        }
        out.append('>');
    }

    private static String qualifiedName(@Nullable String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    static void escapeText(StringBuilder out, String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                default -> out.append(c);
            }
        }
    }

    static void escapeAttribute(StringBuilder out, @Nullable String value) {
        if (value == null) return;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '"' -> out.append("&quot;");
                default -> out.append(c);
            }
        }
    }
}
