package common.util;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import model.bo.LocationCoordinate;
import model.bo.LocationParseResult;
import model.bo.TopologySettings;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 箱位编码工具类
 * 编码格式：S<堆栈>[-]R<排>[-](H|T)<层>，大小写不敏感，分隔符可选
 * 例如 S07-R2-H3 / s07r2t3 / S7R2H3 均解析为 (7, 2, 3)
 */
public class LocationCodeUtil {

    // T 是历史数据中的层号别名，与 H 等价
    private static final Pattern CODE_PATTERN =
            Pattern.compile("^S(\\d+)-?R(\\d+)-?[HT](\\d+)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s\\-_]+|[\\s\\-_]+$");

    // 超过 9 位的数字会溢出 int
    private static final int MAX_DIGITS = 9;

    private LocationCodeUtil() {
    }

    /**
     * 解析箱位编码
     * 永不抛异常：格式错误、缺少分量、分量非正数都返回失败结果
     *
     * @param code 原始箱位编码
     * @return 解析结果
     */
    public static LocationParseResult parse(String code) {
        if (code == null || code.trim().isEmpty()) {
            return LocationParseResult.failure(code, ErrorCodes.EMPTY_LOCATION_CODE);
        }

        String trimmed = EDGE_SEPARATORS.matcher(code).replaceAll("");
        Matcher matcher = CODE_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return LocationParseResult.failure(code, ErrorCodes.MALFORMED_LOCATION_CODE + ": " + code);
        }

        Integer stack = toPositiveInt(matcher.group(1));
        Integer row = toPositiveInt(matcher.group(2));
        Integer tier = toPositiveInt(matcher.group(3));
        if (stack == null || row == null || tier == null) {
            return LocationParseResult.failure(code, ErrorCodes.NON_POSITIVE_COORDINATE + ": " + code);
        }
        return LocationParseResult.success(code, new LocationCoordinate(stack, row, tier));
    }

    /**
     * 按缺省宽度 (2位) 补零格式化
     */
    public static String format(int stackNumber, int row, int tier) {
        return format(stackNumber, row, tier, TopologySettings.DEFAULT_STACK_PADDING);
    }

    /**
     * 格式化为规范编码 S<堆栈>R<排>H<层>
     *
     * @param padding 堆栈号补零宽度
     */
    public static String format(int stackNumber, int row, int tier, int padding) {
        if (stackNumber <= 0 || row <= 0 || tier <= 0) {
            throw new BusinessException(ErrorCodes.NON_POSITIVE_COORDINATE
                    + ": (" + stackNumber + ", " + row + ", " + tier + ")");
        }
        String stackPart = String.valueOf(stackNumber);
        StringBuilder sb = new StringBuilder("S");
        for (int i = stackPart.length(); i < padding; i++) {
            sb.append('0');
        }
        return sb.append(stackPart).append('R').append(row).append('H').append(tier).toString();
    }

    public static String format(LocationCoordinate coordinate) {
        return format(coordinate.getStackNumber(), coordinate.getRow(), coordinate.getTier());
    }

    private static Integer toPositiveInt(String digits) {
        // 去掉前导零后再判断长度
        String stripped = digits.replaceFirst("^0+", "");
        if (stripped.isEmpty() || stripped.length() > MAX_DIGITS) {
            return null;
        }
        return Integer.parseInt(stripped);
    }
}
