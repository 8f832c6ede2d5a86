package com.querygen.compiler.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of source texts keyed by source key (usually a root-relative file path).
 */
public final class Sources {

    private final Map<String, String> texts;

    private Sources(Map<String, String> texts) {
        this.texts = Collections.unmodifiableMap(new LinkedHashMap<>(texts));
    }

    public static Sources of(Map<String, String> texts) {
        return new Sources(texts);
    }

    public static Sources empty() {
        return new Sources(Map.of());
    }

    public Optional<String> get(String sourceKey) {
        return Optional.ofNullable(texts.get(sourceKey));
    }

    public Map<String, String> asMap() {
        return texts;
    }

    public int size() {
        return texts.size();
    }

    /**
     * Resolve an abstract location to file/line/column and literal text.
     * Empty when the source is unknown or the span falls outside it.
     */
    public Optional<SourceLocation> resolve(Location location) {
        String text = texts.get(location.getSourceKey());
        if (text == null) {
            return Optional.empty();
        }
        Span span = location.getSpan();
        if (span.getEnd() > text.length()) {
            return Optional.empty();
        }

        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < span.getStart(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = text.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }

        return Optional.of(SourceLocation.builder()
                .sourceKey(location.getSourceKey())
                .line(line)
                .column(span.getStart() - lineStart + 1)
                .text(text.substring(span.getStart(), span.getEnd()))
                .lineText(text.substring(lineStart, lineEnd))
                .build());
    }
}
