package org.carball.sqlinspector.analyzer;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Treats a stack as rendering when any frame mentions one of the keywords,
 * ignoring case.
 */
public class KeywordRenderingClassifier implements RenderingFrameClassifier {

    private final List<String> keywords;

    public KeywordRenderingClassifier(List<String> keywords) {
        this.keywords = keywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    @Override
    public boolean isRendering(List<String> shortenedStack) {
        if (keywords.isEmpty()) {
            return false;
        }
        return shortenedStack.stream()
                .map(frame -> frame.toLowerCase(Locale.ROOT))
                .anyMatch(frame -> keywords.stream().anyMatch(frame::contains));
    }
}
