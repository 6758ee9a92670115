package com.modelspec.model;

import com.modelspec.exception.ModelSpecException;
import com.modelspec.exception.Stage;
import com.modelspec.formula.ParsedFormula;

import java.util.Optional;

/**
 * Result of assembling a formula into a model specification.
 * A failed result never carries a partial specification, but keeps the parsed
 * formula when parsing succeeded so a preview can still be rendered.
 */
public final class AssemblyResult {

    private static final AssemblyResult EMPTY =
            new AssemblyResult(AssemblyStatus.EMPTY, null, ParsedFormula.empty(), null);
    private static final AssemblyResult CANCELLED =
            new AssemblyResult(AssemblyStatus.CANCELLED, null, null, null);

    private final AssemblyStatus status;
    private final ModelSpec modelSpec;
    private final ParsedFormula parsedFormula;
    private final ModelSpecException error;

    private AssemblyResult(AssemblyStatus status, ModelSpec modelSpec,
                           ParsedFormula parsedFormula, ModelSpecException error) {
        this.status = status;
        this.modelSpec = modelSpec;
        this.parsedFormula = parsedFormula;
        this.error = error;
    }

    public static AssemblyResult empty() {
        return EMPTY;
    }

    public static AssemblyResult cancelled() {
        return CANCELLED;
    }

    public static AssemblyResult success(ModelSpec modelSpec, ParsedFormula parsedFormula) {
        return new AssemblyResult(AssemblyStatus.SUCCESS, modelSpec, parsedFormula, null);
    }

    /**
     * Create a failed result.
     *
     * @param error         First error encountered
     * @param parsedFormula Parsed formula, or null if parsing itself failed
     */
    public static AssemblyResult failed(ModelSpecException error, ParsedFormula parsedFormula) {
        return new AssemblyResult(AssemblyStatus.FAILED, null, parsedFormula, error);
    }

    public AssemblyStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == AssemblyStatus.SUCCESS;
    }

    public Optional<ModelSpec> getModelSpec() {
        return Optional.ofNullable(modelSpec);
    }

    public Optional<ParsedFormula> getParsedFormula() {
        return Optional.ofNullable(parsedFormula);
    }

    public Optional<ModelSpecException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Stage that failed, or null unless the status is FAILED.
     */
    public Stage getStage() {
        return error != null ? error.getStage() : null;
    }

    /**
     * Whether a parsed formula is available for a partial preview.
     */
    public boolean isPreviewAvailable() {
        return parsedFormula != null && !parsedFormula.isEmpty();
    }

    @Override
    public String toString() {
        return "AssemblyResult{" +
                "status=" + status +
                (modelSpec != null ? ", terms=" + modelSpec.termLabels() : "") +
                (error != null ? ", stage=" + error.getStage() + ", error=" + error.getMessage() : "") +
                '}';
    }
}
