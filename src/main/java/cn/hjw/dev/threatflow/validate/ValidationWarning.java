package cn.hjw.dev.threatflow.validate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 不阻断执行的提示, 例如任务名不在可用任务目录中
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class ValidationWarning {

    private final String nodeId;
    private final String message;
}
