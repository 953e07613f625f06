package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 虚拟堆栈编号来源
 */
@Getter
@AllArgsConstructor
public enum PairingSourceEnum {
    PERSISTED("持久化配对记录"),
    SYNTHESIZED("按拓扑规则即时合成");

    private final String desc;
}
