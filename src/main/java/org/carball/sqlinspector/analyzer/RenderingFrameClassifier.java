package org.carball.sqlinspector.analyzer;

import java.util.List;

/**
 * Decides whether a query ran while a template was being rendered.
 */
@FunctionalInterface
public interface RenderingFrameClassifier {

    /**
     * @param shortenedStack formatted caller frames with internal frames removed, innermost first
     */
    boolean isRendering(List<String> shortenedStack);
}
