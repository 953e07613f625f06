package model.bo;

import common.consts.PlacementCheckEnum;
import lombok.Value;

/**
 * 放箱校验结果
 */
@Value
public class PlacementCheckResult {
    boolean valid;
    PlacementCheckEnum code;
    String message;

    public static PlacementCheckResult ok() {
        return new PlacementCheckResult(true, PlacementCheckEnum.VALID, PlacementCheckEnum.VALID.getDesc());
    }

    public static PlacementCheckResult reject(PlacementCheckEnum code, String message) {
        return new PlacementCheckResult(false, code, message);
    }
}
