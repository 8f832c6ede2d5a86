package com.querygen.compiler.transform;

import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.program.Program;

import lombok.NonNull;
import lombok.Value;

/**
 * Ordered transforms producing one target program.
 */
@Value
public class TransformChain {
    private static final Logger log = LoggerFactory.getLogger(TransformChain.class);

    @NonNull
    String target;
    @NonNull
    List<ProgramTransform> transforms;

    public TransformChain(String target, List<ProgramTransform> transforms) {
        this.target = target;
        this.transforms = List.copyOf(transforms);
    }

    public static TransformChain of(String target, ProgramTransform... transforms) {
        return new TransformChain(target, List.of(transforms));
    }

    public Program apply(Program program, Set<String> baseFragmentNames) {
        Program current = program;
        for (ProgramTransform transform : transforms) {
            current = transform.apply(current, baseFragmentNames);
            log.trace("{}: {} -> {} definition(s)", target, transform.getName(), current.documentCount());
        }
        return current;
    }
}
