package org.carball.sqlinspector.analyzer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats caller frames for display. Frames from library or JDK packages and
 * generated classes are wrapped in {@code <...>} so they can be elided.
 */
public class StackFrameFormatter {

    public static final String INTERNAL_MARKER = "<";

    private final List<String> internalPrefixes;

    public StackFrameFormatter(List<String> internalPrefixes) {
        this.internalPrefixes = List.copyOf(internalPrefixes);
    }

    public List<String> format(List<StackTraceElement> frames) {
        return frames.stream()
                .map(this::format)
                .collect(Collectors.toList());
    }

    public String format(StackTraceElement frame) {
        String text = frame.getClassName() + "." + frame.getMethodName() + "(" + location(frame) + ")";
        return isInternal(frame) ? INTERNAL_MARKER + text + ">" : text;
    }

    /**
     * Drops every internal frame from an already formatted stack.
     */
    public static List<String> shorten(List<String> formattedStack) {
        return formattedStack.stream()
                .filter(frame -> !frame.startsWith(INTERNAL_MARKER))
                .collect(Collectors.toList());
    }

    boolean isInternal(StackTraceElement frame) {
        String className = frame.getClassName();
        if (className.contains("$$") || frame.getMethodName().startsWith("lambda$")) {
            return true;
        }
        return internalPrefixes.stream().anyMatch(className::startsWith);
    }

    private static String location(StackTraceElement frame) {
        if (frame.isNativeMethod()) {
            return "Native Method";
        }
        if (frame.getFileName() == null) {
            return "Unknown Source";
        }
        return frame.getLineNumber() >= 0
                ? frame.getFileName() + ":" + frame.getLineNumber()
                : frame.getFileName();
    }
}
