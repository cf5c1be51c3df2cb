package org.dxworks.codeprobe.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codeprobe.model.DependencyAnalysis;
import org.dxworks.codeprobe.model.FileAnalysis;
import org.dxworks.codeprobe.model.ProjectAnalysis;

import java.io.UncheckedIOException;

/**
 * Structured output. The dependency graph serializes as an object mapping each file to the array
 * of files it references; cycles serialize as arrays of file identifiers.
 */
public final class JsonReporter {

    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT = new ObjectMapper();

    private JsonReporter() {}

    public static String toJson(FileAnalysis analysis) {
        return write(PRETTY, analysis);
    }

    public static String toJson(ProjectAnalysis analysis) {
        return write(PRETTY, analysis);
    }

    public static String toJson(DependencyAnalysis analysis) {
        return write(PRETTY, analysis);
    }

    /** Single-line form for JSONL streams. */
    public static String toJsonLine(Object value) {
        return write(COMPACT, value);
    }

    private static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
