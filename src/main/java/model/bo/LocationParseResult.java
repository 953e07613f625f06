package model.bo;

import lombok.Getter;

/**
 * 箱位编码解析结果
 * 解析失败时不抛异常，而是返回带错误信息的失败结果，由调用方归类为"无法定位"
 */
@Getter
public class LocationParseResult {

    private final String rawCode;
    private final LocationCoordinate coordinate;
    private final String error;

    private LocationParseResult(String rawCode, LocationCoordinate coordinate, String error) {
        this.rawCode = rawCode;
        this.coordinate = coordinate;
        this.error = error;
    }

    public static LocationParseResult success(String rawCode, LocationCoordinate coordinate) {
        return new LocationParseResult(rawCode, coordinate, null);
    }

    public static LocationParseResult failure(String rawCode, String error) {
        return new LocationParseResult(rawCode, null, error);
    }

    public boolean isSuccess() {
        return coordinate != null;
    }
}
