package cn.hjw.dev.threatflow.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 分支出边标签, 只有 BRANCH 节点的出边才带标签
 */
@Getter
@RequiredArgsConstructor
public enum BranchLabel {

    TRUE_BRANCH("true-branch"),
    FALSE_BRANCH("false-branch");

    private final String wireName;

    public static BranchLabel fromWireName(String name) {
        for (BranchLabel label : values()) {
            if (label.wireName.equalsIgnoreCase(name)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown branch label: " + name);
    }
}
