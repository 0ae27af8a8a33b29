package org.netpreserve.wikigraph;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Accepts articles that carry an infobox of one of the given types, e.g. {@code {{Infobox musical artist}}}.
 * Matching ignores case and treats runs of spaces and underscores alike.
 */
public class InfoboxClassifier implements Classifier {
    private final Pattern infobox;

    public InfoboxClassifier(List<String> infoboxTypes) {
        if (infoboxTypes.isEmpty()) throw new IllegalArgumentException("at least one infobox type is required");
        String types = infoboxTypes.stream()
                .map(type -> Pattern.quote(type.strip().replaceAll("[\\s_]+", " ")).replace(" ", "\\E[\\s_]+\\Q"))
                .collect(Collectors.joining("|"));
        this.infobox = Pattern.compile("\\{\\{\\s*Infobox[\\s_]+(?:" + types + ")\\s*(?:\\||}}|<!--|$)",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    }

    @Override
    public boolean classify(Article article) {
        return infobox.matcher(article.text()).find();
    }
}
