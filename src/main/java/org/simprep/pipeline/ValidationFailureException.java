package org.simprep.pipeline;

import java.util.List;

/**
 * Thrown by a validation task whose structural checks found problems.
 * Carries the individual findings for reporting.
 */
public class ValidationFailureException extends PipelineException {

    private final List<String> findings;

    public ValidationFailureException(String message, List<String> findings) {
        super(message);
        this.findings = List.copyOf(findings);
    }

    public List<String> getFindings() {
        return findings;
    }
}
