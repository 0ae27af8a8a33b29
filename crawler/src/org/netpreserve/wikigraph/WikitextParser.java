package org.netpreserve.wikigraph;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses a MediaWiki export {@code <page>} into an {@link Article}, collecting the article links of its wikitext.
 */
public class WikitextParser implements DocumentParser {
    private static final Pattern WIKILINK = Pattern.compile("\\[\\[([^\\[\\]|]*)(?:\\|[^\\[\\]]*)?]]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s_]+");
    private static final Pattern INTERWIKI_PREFIX = Pattern.compile("[a-z]{2,3}(?:-[a-z]+)*");
    private static final Set<String> NON_ARTICLE_NAMESPACES = Set.of(
            "media", "special", "talk", "user", "user talk", "wikipedia", "wp", "wikipedia talk", "file", "image",
            "file talk", "mediawiki", "template", "template talk", "help", "category", "category talk", "portal",
            "draft", "module", "timedtext", "book", "education program", "gadget", "topic",
            "wiktionary", "wikt", "wikisource", "wikiquote", "wikinews", "wikibooks", "wikiversity", "wikivoyage",
            "wikispecies", "wikidata", "commons", "meta", "mw", "phab", "foundation");

    private final XMLInputFactory inputFactory;

    public WikitextParser() {
        inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    @Override
    public Article parse(String rawText) throws DocumentParseException {
        String id = null;
        String title = null;
        String redirect = null;
        String text = null;
        try {
            XMLStreamReader reader = inputFactory.createXMLStreamReader(new StringReader(rawText));
            if (reader.nextTag() != XMLStreamConstants.START_ELEMENT || !reader.getLocalName().equals("page")) {
                throw new DocumentParseException("Expected <page> but found <" + reader.getLocalName() + ">");
            }
            int depth = 1;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.END_ELEMENT) {
                    depth--;
                    continue;
                }
                if (event != XMLStreamConstants.START_ELEMENT) continue;
                depth++;
                String name = reader.getLocalName();
                if (depth == 2) {
                    switch (name) {
                        case "title" -> title = reader.getElementText();
                        case "id" -> {
                            if (id == null) id = reader.getElementText().trim();
                        }
                        case "redirect" -> redirect = reader.getAttributeValue(null, "title");
                        default -> {
                            continue;
                        }
                    }
                    if (reader.getEventType() == XMLStreamConstants.END_ELEMENT) depth--;
                } else if (depth == 3 && name.equals("text")) {
                    text = reader.getElementText(); // later revisions overwrite earlier ones
                    depth--;
                }
            }
            reader.close();
        } catch (XMLStreamException e) {
            throw new DocumentParseException("Malformed page: " + e.getMessage(), e);
        }
        if (id == null || title == null) throw new DocumentParseException("Page is missing its title or id");
        if (text == null) text = "";

        if (redirect != null) {
            String target = normalizeTitle(redirect);
            return new Article(id, title, target == null ? List.of() : List.of(target), text, target);
        }
        return new Article(id, title, extractLinks(text), text);
    }

    /**
     * Returns the distinct article titles linked from the wikitext in order of first appearance.
     */
    static List<String> extractLinks(String wikitext) {
        var links = new LinkedHashSet<String>();
        var matcher = WIKILINK.matcher(wikitext);
        while (matcher.find()) {
            String target = normalizeTitle(matcher.group(1));
            if (target != null) links.add(target);
        }
        return new ArrayList<>(links);
    }

    /**
     * Normalizes a link target the way MediaWiki resolves titles. Returns null for links that don't point at an
     * article: empty targets, same-page anchors, other namespaces and interwiki links.
     */
    static @Nullable String normalizeTitle(String target) {
        int hash = target.indexOf('#');
        if (hash >= 0) target = target.substring(0, hash);
        target = WHITESPACE.matcher(target).replaceAll(" ").strip();
        if (target.startsWith(":")) target = target.substring(1).strip();
        if (target.isEmpty()) return null;

        int colon = target.indexOf(':');
        if (colon > 0) {
            String prefix = target.substring(0, colon).strip();
            if (NON_ARTICLE_NAMESPACES.contains(prefix.toLowerCase(Locale.ROOT))) return null;
            if (INTERWIKI_PREFIX.matcher(prefix).matches()) return null;
        }
        return StringUtils.capitalize(target);
    }
}
