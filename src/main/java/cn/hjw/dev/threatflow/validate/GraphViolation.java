package cn.hjw.dev.threatflow.validate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class GraphViolation {

    private final GraphError error;

    // 相关节点, 图级错误时为 null
    private final String nodeId;

    private final String message;
}
