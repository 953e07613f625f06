package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 放箱校验结果码
 */
@Getter
@AllArgsConstructor
public enum PlacementCheckEnum {
    VALID("箱位可用"),
    INVALID_FORMAT("箱位编码格式错误"),
    STACK_NOT_FOUND("堆栈不存在"),
    STACK_INACTIVE("堆栈未启用"),
    SIZE_MISMATCH("40尺箱不能放在20尺堆栈"),
    SPECIAL_STACK("特殊堆栈不能放40尺箱"),
    ROW_OUT_OF_RANGE("排号超出堆栈范围"),
    TIER_OUT_OF_RANGE("层号超出该排最大层高"),
    UNIT_FULL("存储单元已满"),
    SLOT_OCCUPIED("箱位已被占用");

    private final String desc;
}
