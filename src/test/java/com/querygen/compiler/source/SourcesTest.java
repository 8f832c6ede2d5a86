package com.querygen.compiler.source;

import java.util.List;
import java.util.Map;

import com.querygen.compiler.error.ResolvedError;
import com.querygen.compiler.error.ValidationError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SourcesTest {

    private final Sources sources = Sources.of(Map.of("a.graphql", "query A {\n  user { email }\n}\n"));

    @Test
    void testResolveComputesLineColumnAndText() {
        int start = "query A {\n  user { ".length();
        SourceLocation location = sources.resolve(Location.of("a.graphql", start, start + 5)).orElseThrow();

        assertThat(location.getLine()).isEqualTo(2);
        assertThat(location.getColumn()).isEqualTo(10);
        assertThat(location.getText()).isEqualTo("email");
        assertThat(location.getLineText()).isEqualTo("  user { email }");
        assertThat(location).hasToString("a.graphql:2:10");
    }

    @Test
    void testResolveUnknownSourceOrOutOfRangeIsEmpty() {
        assertThat(sources.resolve(Location.of("missing.graphql", 0, 1))).isEmpty();
        assertThat(sources.resolve(Location.of("a.graphql", 0, 1000))).isEmpty();
    }

    @Test
    void testValidationErrorResolvesAndFormatsCaret() {
        int start = "query A {\n  user { ".length();
        ResolvedError error = ValidationError.of("Unknown field 'email' on type 'User'",
                Location.of("a.graphql", start, start + 5)).withSources(sources);

        assertThat(error.getLocations()).hasSize(1);
        assertThat(error.format()).contains("  user { email }").contains("^^^^^");
    }

    @Test
    void testUnresolvableLocationIsAnInternalError() {
        ValidationError error = new ValidationError("boom", List.of(Location.of("nope.graphql", 0, 1)));

        assertThatThrownBy(() -> error.withSources(sources))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unresolvable location");
    }

    @Test
    void testSpanRejectsNegativeRanges() {
        assertThatThrownBy(() -> Span.of(5, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
