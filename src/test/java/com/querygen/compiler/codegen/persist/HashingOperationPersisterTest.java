package com.querygen.compiler.codegen.persist;

import java.util.concurrent.Executor;

import com.querygen.compiler.codegen.util.HashUtil;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HashingOperationPersisterTest {

    private final Executor direct = Runnable::run;

    @Test
    void testIdIsTheHexDigestOfTheText() {
        String md5 = new HashingOperationPersister("MD5", direct).persist("query A { a }").join();
        String sha = new HashingOperationPersister("SHA-256", direct).persist("query A { a }").join();

        assertThat(md5).hasSize(32).isEqualTo(HashUtil.md5("query A { a }"));
        assertThat(sha).hasSize(64);
    }

    @Test
    void testSameTextGetsSameId() {
        HashingOperationPersister persister = new HashingOperationPersister("MD5", direct);

        assertThat(persister.persist("query A { a }").join()).isEqualTo(persister.persist("query A { a }").join());
        assertThat(persister.persist("query A { a }").join()).isNotEqualTo(persister.persist("query B { b }").join());
    }

    @Test
    void testUnsupportedAlgorithmIsRejected() {
        assertThatThrownBy(() -> new HashingOperationPersister("NOPE-1", direct))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE-1");
    }
}
