package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 箱型尺寸 (堆栈声明尺寸 / 集装箱尺寸共用)
 */
@Getter
@AllArgsConstructor
public enum SizeClassEnum {
    SIZE_20("20ft", "20尺"),
    SIZE_40("40ft", "40尺");

    private final String code;
    private final String desc;

    /**
     * 宽松解析: 接受 "20" / "20ft" / "20FT" / " 40ft " 等写法
     * 无法识别时返回 null，由调用方决定缺省值
     */
    public static SizeClassEnum getByCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        if (normalized.endsWith("ft")) {
            normalized = normalized.substring(0, normalized.length() - 2).trim();
        }
        switch (normalized) {
            case "20":
                return SIZE_20;
            case "40":
                return SIZE_40;
            default:
                return null;
        }
    }

    /**
     * 与 getByCode 相同，但缺省为 20 尺 (历史数据里未声明尺寸的堆栈一律按 20 尺处理)
     */
    public static SizeClassEnum getByCodeOrDefault(String code) {
        SizeClassEnum value = getByCode(code);
        return value != null ? value : SIZE_20;
    }
}
