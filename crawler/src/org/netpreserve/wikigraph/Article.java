package org.netpreserve.wikigraph;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed page.
 *
 * @param id       page id
 * @param title    page title
 * @param links    titles of linked articles in the order they appear, or null if the page was never parsed
 * @param text     wikitext of the latest revision
 * @param redirect normalized title the page redirects to, or null if it isn't a redirect
 */
public record Article(String id, String title, @Nullable List<String> links, String text,
                      @Nullable String redirect) {
    public Article(String id, String title, @Nullable List<String> links, String text) {
        this(id, title, links, text, null);
    }

    /**
     * Creates a placeholder for a page that is known to exist but has not been read.
     */
    public static Article unparsed(String id, String title) {
        return new Article(id, title, null, "");
    }

    /**
     * The properties stored on the article's graph node. Links and text are left off so that a parsed
     * article and its unparsed placeholder map to the same node.
     */
    public Map<String, Object> nodeProperties() {
        var properties = new LinkedHashMap<String, Object>();
        properties.put("id", id);
        properties.put("title", title);
        return properties;
    }
}
