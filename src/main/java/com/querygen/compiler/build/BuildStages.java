package com.querygen.compiler.build;

import java.util.concurrent.Executor;

import com.querygen.compiler.codegen.ArtifactGenerator;
import com.querygen.compiler.codegen.TemplateArtifactGenerator;
import com.querygen.compiler.codegen.writer.ArtifactWriter;
import com.querygen.compiler.codegen.writer.FileSystemArtifactWriter;
import com.querygen.compiler.codegen.writer.VerifyingArtifactWriter;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.ir.IrBuilder;
import com.querygen.compiler.ir.TypeCheckingIrBuilder;
import com.querygen.compiler.schema.ExtendingSchemaBuilder;
import com.querygen.compiler.schema.SchemaBuilder;
import com.querygen.compiler.transform.DefaultTransformPipeline;
import com.querygen.compiler.transform.TransformPipeline;
import com.querygen.compiler.validate.ProgramValidator;
import com.querygen.compiler.validate.RuleBasedValidator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The six stage collaborators a {@link ProjectBuilder} sequences.
 */
@Value
@Builder(toBuilder = true)
public class BuildStages {
    @NonNull
    SchemaBuilder schemaBuilder;
    @NonNull
    IrBuilder irBuilder;
    @NonNull
    ProgramValidator validator;
    @NonNull
    TransformPipeline transformPipeline;
    @NonNull
    ArtifactGenerator artifactGenerator;
    @NonNull
    ArtifactWriter artifactWriter;

    /**
     * Standard stages. In validate mode artifacts are verified against disk instead of written.
     */
    public static BuildStages defaults(CompilerConfig config, Executor executor) {
        return BuildStages.builder()
                .schemaBuilder(new ExtendingSchemaBuilder())
                .irBuilder(new TypeCheckingIrBuilder())
                .validator(RuleBasedValidator.withDefaultRules(config.getMaxSelectionDepth()))
                .transformPipeline(DefaultTransformPipeline.standard())
                .artifactGenerator(new TemplateArtifactGenerator(executor))
                .artifactWriter(config.isValidate() ? new VerifyingArtifactWriter() : new FileSystemArtifactWriter())
                .build();
    }
}
