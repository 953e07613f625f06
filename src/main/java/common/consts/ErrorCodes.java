package common.consts;

/**
 * 全局错误信息与诊断信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";
    public static final String EMPTY_SNAPSHOT = "堆场快照为空，无法解析";

    // 箱位编码
    public static final String EMPTY_LOCATION_CODE = "箱位编码为空";
    public static final String MALFORMED_LOCATION_CODE = "箱位编码不符合 S<堆栈>R<排>H<层> 格式";
    public static final String NON_POSITIVE_COORDINATE = "堆栈号、排号、层号必须为正整数";

    // 拓扑配置
    public static final String INVALID_BAND = "配对号段配置非法";
    public static final String OVERLAPPING_BANDS = "配对号段之间存在重叠";

    // 诊断
    public static final String STACK_NOT_FOUND = "箱位编码指向的堆栈不存在";
    public static final String DUPLICATE_STACK_NUMBER = "堆栈号重复，仅保留第一条记录";
    public static final String INVALID_STACK_NUMBER = "堆栈号缺失或非正数，已忽略";
    public static final String PARTNER_MISSING = "40尺堆栈的拓扑搭档不存在";
    public static final String PARTNER_NOT_ELIGIBLE = "40尺堆栈的拓扑搭档未启用、为特殊堆栈或未声明为40尺";
    public static final String NO_ADJACENT = "40尺堆栈不在任何有效配对位置上";
    public static final String PAIRING_CONFLICT = "堆栈出现在多条持久化配对记录中";
    public static final String PAIRING_NOT_ADJACENT = "持久化配对记录与拓扑规则不符或成员不可配对，已忽略";
    public static final String DUPLICATE_VIRTUAL_NUMBER = "多个配对记录了同一虚拟堆栈号";
    public static final String VIRTUAL_NUMBER_TAKEN = "合成的虚拟堆栈号已被持久化配对占用";
    public static final String GEOMETRY_MISMATCH = "配对堆栈的排/层配置不一致";
    public static final String UNIT_NUMBER_COLLISION = "虚拟堆栈编号与已有物理堆栈编号冲突";
    public static final String LARGE_CONTAINER_ON_SMALL_STACK = "40尺箱位于非40尺堆栈上，按物理堆栈统计";
    public static final String SMALL_CONTAINER_ON_PAIR = "20尺箱位于40尺配对堆栈上，已计入虚拟堆栈";
    public static final String OVER_CAPACITY = "存储单元占用超过容量";
}
