package com.querygen.compiler.error;

import java.util.List;

import com.querygen.compiler.source.Location;
import com.querygen.compiler.source.SourceLocation;
import com.querygen.compiler.source.Sources;

import lombok.NonNull;
import lombok.Value;

/**
 * A type or semantic rule violation with abstract locations.
 *
 * Locations stay unresolved until {@link #withSources(Sources)} attaches literal source context.
 */
@Value
public class ValidationError {

    @NonNull
    String message;

    @NonNull
    List<Location> locations;

    public ValidationError(String message, List<Location> locations) {
        this.message = message;
        this.locations = List.copyOf(locations);
    }

    public static ValidationError of(String message, Location... locations) {
        return new ValidationError(message, List.of(locations));
    }

    /**
     * Resolve every location against the source set.
     *
     * @throws IllegalStateException if a location does not point into a known source
     */
    public ResolvedError withSources(Sources sources) {
        List<SourceLocation> resolved = locations.stream()
                .map(location -> sources.resolve(location)
                        .orElseThrow(() -> new IllegalStateException(
                                "Unresolvable location " + location + " for error: " + message)))
                .toList();
        return new ResolvedError(message, resolved);
    }
}
