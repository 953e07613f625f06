package model.bo;

import common.consts.PairingSourceEnum;
import lombok.Value;

/**
 * 40尺虚拟堆栈配对 (两个相邻物理堆栈)
 * firstStackNumber 总是较小的堆栈号
 */
@Value
public class VirtualStackPair {
    int virtualNumber;
    int firstStackNumber;
    int secondStackNumber;
    PairingSourceEnum source;

    public boolean contains(int stackNumber) {
        return firstStackNumber == stackNumber || secondStackNumber == stackNumber;
    }
}
