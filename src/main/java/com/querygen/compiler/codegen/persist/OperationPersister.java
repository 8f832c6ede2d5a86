package com.querygen.compiler.codegen.persist;

import java.util.concurrent.CompletableFuture;

/**
 * Stores operation text somewhere the server can look it up and returns the id to send instead.
 *
 * Implementations may complete on another thread; callers must not block on the result.
 */
public interface OperationPersister {

    CompletableFuture<String> persist(String operationText);
}
