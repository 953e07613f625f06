package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 集装箱在场状态
 */
@Getter
@AllArgsConstructor
public enum ContainerStatusEnum {
    OCCUPIED("occupied", "正常在场"),
    DAMAGED("damaged", "残损"),
    MAINTENANCE("maintenance", "维修标记");

    private final String code;
    private final String desc;

    /**
     * 未识别的状态按正常在场处理
     */
    public static ContainerStatusEnum getByCode(String code) {
        if (code == null) {
            return OCCUPIED;
        }
        for (ContainerStatusEnum value : values()) {
            if (value.getCode().equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return OCCUPIED;
    }
}
