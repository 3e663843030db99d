package cn.hjw.dev.threatflow.validate;

import cn.hjw.dev.threatflow.exception.GraphValidationException;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

@Getter
public class ValidationReport {

    private final List<GraphViolation> errors;
    private final List<ValidationWarning> warnings;

    public ValidationReport(List<GraphViolation> errors, List<ValidationWarning> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<GraphError> firstError() {
        return errors.stream().map(GraphViolation::getError).findFirst();
    }

    public void throwIfInvalid() {
        if (!isValid()) {
            throw new GraphValidationException(errors);
        }
    }
}
