package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 物理堆栈在拓扑中的角色
 */
@Getter
@AllArgsConstructor
public enum StackRoleEnum {
    SPECIAL("特殊堆栈，永不配对"),
    PAIRED("40尺配对成员，由虚拟堆栈统计"),
    STANDALONE("独立物理堆栈"),
    UNMATCHED("声明为40尺但找不到可用搭档");

    private final String desc;
}
