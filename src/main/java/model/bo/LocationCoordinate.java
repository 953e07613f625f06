package model.bo;

import lombok.Value;

/**
 * 箱位坐标 (堆栈号, 排, 层)
 */
@Value
public class LocationCoordinate {
    int stackNumber;
    int row;
    int tier;
}
