package com.querygen.compiler.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.error.StageResult;
import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.model.ExecutableDocument;
import com.querygen.compiler.parser.DocumentParser;
import com.querygen.compiler.parser.ParseException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Parsed executable documents per project.
 */
@Value
@Builder
public class AstSets {
    private static final Logger log = LoggerFactory.getLogger(AstSets.class);

    @Singular("project")
    Map<String, List<ExecutableDocument>> documents;

    public List<ExecutableDocument> get(String projectName) {
        return documents.getOrDefault(projectName, List.of());
    }

    /**
     * Parse every project's documents. Syntax errors from all files are collected.
     */
    public static StageResult<AstSets> parse(CompilerState state) {
        List<ValidationError> errors = new ArrayList<>();
        AstSetsBuilder builder = builder();

        for (ProjectSourceSet project : state.getProjects().values()) {
            List<ExecutableDocument> documents = new ArrayList<>();
            for (String key : project.getDocumentKeys()) {
                String text = state.getSources().get(key)
                        .orElseThrow(() -> new IllegalStateException("Source not loaded: " + key));
                try {
                    documents.add(new DocumentParser(text, key).parse());
                } catch (ParseException e) {
                    log.debug("Syntax error in {}: {}", key, e.getMessage());
                    errors.add(e.toValidationError());
                }
            }
            builder.project(project.getProjectName(), List.copyOf(documents));
        }

        return StageResult.of(builder.build(), errors);
    }
}
