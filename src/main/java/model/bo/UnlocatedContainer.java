package model.bo;

import lombok.Value;

/**
 * 无法定位的集装箱 (不计入任何单元，但在结果中保留)
 */
@Value
public class UnlocatedContainer {
    String containerId;
    String locationCode;
    String reason;
}
