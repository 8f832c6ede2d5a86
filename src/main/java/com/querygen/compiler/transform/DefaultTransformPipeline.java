package com.querygen.compiler.transform;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.querygen.compiler.program.Program;
import com.querygen.compiler.transform.transforms.GenerateIdField;
import com.querygen.compiler.transform.transforms.InlineFragments;
import com.querygen.compiler.transform.transforms.RemoveBaseFragments;
import com.querygen.compiler.transform.transforms.RemoveFragmentDefinitions;
import com.querygen.compiler.transform.transforms.SkipRedundantNodes;

/**
 * Applies each registered chain to the same input program. Chains are independent of each other.
 */
public class DefaultTransformPipeline implements TransformPipeline {

    private final List<TransformChain> chains;

    public DefaultTransformPipeline(List<TransformChain> chains) {
        this.chains = List.copyOf(chains);
    }

    /**
     * The reader, normalization and operation text chains.
     */
    public static DefaultTransformPipeline standard() {
        return new DefaultTransformPipeline(List.of(
                TransformChain.of(TargetPrograms.READER,
                        new SkipRedundantNodes(),
                        new RemoveBaseFragments()),
                TransformChain.of(TargetPrograms.NORMALIZATION,
                        new InlineFragments(),
                        new GenerateIdField(),
                        new SkipRedundantNodes(),
                        new RemoveFragmentDefinitions()),
                TransformChain.of(TargetPrograms.OPERATION_TEXT,
                        new GenerateIdField(),
                        new SkipRedundantNodes())));
    }

    public List<TransformChain> getChains() {
        return chains;
    }

    @Override
    public TargetPrograms apply(Program program, Set<String> baseFragmentNames) {
        Map<String, Program> targets = new LinkedHashMap<>();
        for (TransformChain chain : chains) {
            if (targets.put(chain.getTarget(), chain.apply(program, baseFragmentNames)) != null) {
                throw new IllegalStateException("Two chains produce target '" + chain.getTarget() + "'");
            }
        }
        return new TargetPrograms(targets);
    }
}
