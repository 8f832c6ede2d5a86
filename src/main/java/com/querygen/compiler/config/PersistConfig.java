package com.querygen.compiler.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Operation text persistence settings. When present, artifacts reference operations by id.
 */
@Value
@Builder
public class PersistConfig {

    /** Digest algorithm used to derive operation ids (e.g. MD5, SHA-256). */
    @NonNull
    @Builder.Default
    String algorithm = "MD5";
}
