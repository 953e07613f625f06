package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 解析诊断类型
 */
@Getter
@AllArgsConstructor
public enum DiagnosticTypeEnum {
    PARSE_ERROR("箱位编码无法解析"),
    TOPOLOGY_INCONSISTENCY("配对记录冲突或配对堆栈几何不一致"),
    CONFIGURATION_GAP("40尺堆栈缺少可用搭档或箱型与堆栈不符"),
    OVER_CAPACITY("占用超过容量"),
    SYSTEM_ERROR("接口调用异常");

    private final String desc;
}
