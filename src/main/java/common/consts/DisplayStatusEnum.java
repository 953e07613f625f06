package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 箱位展示状态
 * 优先级：残损 > 维修 > 正常占用
 */
@Getter
@AllArgsConstructor
public enum DisplayStatusEnum {
    DAMAGED("damaged", "残损"),
    MAINTENANCE("maintenance", "维修"),
    OCCUPIED("occupied", "占用");

    private final String code;
    private final String desc;
}
