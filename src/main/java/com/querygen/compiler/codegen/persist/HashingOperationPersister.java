package com.querygen.compiler.codegen.persist;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.codegen.util.HashUtil;

/**
 * Content-addressed persister: the id is the hex digest of the operation text.
 */
public class HashingOperationPersister implements OperationPersister {
    private static final Logger log = LoggerFactory.getLogger(HashingOperationPersister.class);

    private final String algorithm;
    private final Executor executor;

    public HashingOperationPersister(String algorithm, Executor executor) {
        if (!HashUtil.isSupported(algorithm)) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm);
        }
        this.algorithm = algorithm;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> persist(String operationText) {
        return CompletableFuture.supplyAsync(() -> {
            String id = HashUtil.digest(algorithm, operationText);
            log.trace("Persisted operation {}", id);
            return id;
        }, executor);
    }
}
