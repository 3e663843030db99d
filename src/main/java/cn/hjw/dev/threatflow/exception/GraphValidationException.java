package cn.hjw.dev.threatflow.exception;

import cn.hjw.dev.threatflow.validate.GraphError;
import cn.hjw.dev.threatflow.validate.GraphViolation;
import lombok.Getter;

import java.util.List;

/**
 * 图结构校验失败, 对本次运行是致命的: 不会发生任何编译或外部调用
 */
@Getter
public class GraphValidationException extends WorkflowRuntimeException {

    private final List<GraphViolation> violations;

    public GraphValidationException(List<GraphViolation> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public GraphError getError() {
        return violations.isEmpty() ? null : violations.get(0).getError();
    }

    private static String buildMessage(List<GraphViolation> violations) {
        if (violations.isEmpty()) {
            return "Workflow graph is invalid";
        }
        GraphViolation first = violations.get(0);
        String message = "Workflow graph is invalid: " + first.getError() + " - " + first.getMessage();
        if (violations.size() > 1) {
            message += " (and " + (violations.size() - 1) + " more)";
        }
        return message;
    }
}
