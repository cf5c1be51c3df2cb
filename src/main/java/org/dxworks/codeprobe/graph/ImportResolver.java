package org.dxworks.codeprobe.graph;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Turns a module specifier into a graph node identifier.
 *
 * <p>Relative specifiers ({@code ./x}, {@code ../x}) are resolved against the directory of the
 * importing file, segment by segment, and get {@value #DEFAULT_EXTENSION} when the last segment has
 * no extension. Anything else names an external package and is returned unchanged.</p>
 */
public final class ImportResolver {

    public static final String DEFAULT_EXTENSION = ".js";

    private ImportResolver() {}

    public static String resolve(String fromFile, String specifier) {
        if (!isRelative(specifier)) {
            return specifier;
        }

        Deque<String> segments = new ArrayDeque<>();
        String[] fromParts = fromFile.split("/", -1);
        // drop the file name, keep its directory
        for (int i = 0; i < fromParts.length - 1; i++) {
            segments.addLast(fromParts[i]);
        }

        for (String part : specifier.split("/")) {
            if (part.equals("..")) {
                if (!segments.isEmpty()) segments.removeLast();
            } else if (!part.equals(".") && !part.isEmpty()) {
                segments.addLast(part);
            }
        }

        String resolved = String.join("/", segments);
        return hasExtension(segments.peekLast()) ? resolved : resolved + DEFAULT_EXTENSION;
    }

    public static boolean isRelative(String specifier) {
        return specifier.startsWith("./") || specifier.startsWith("../")
                || specifier.equals(".") || specifier.equals("..");
    }

    private static boolean hasExtension(String segment) {
        return segment != null && segment.lastIndexOf('.') > 0;
    }
}
