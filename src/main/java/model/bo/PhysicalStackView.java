package model.bo;

import common.consts.StackRoleEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 物理堆栈视图：角色以及归属的逻辑存储单元
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhysicalStackView {
    private int stackNumber;
    private StackRoleEnum role;
    private int ownerUnitNumber;  // 配对成员指向虚拟堆栈号，其余为自身堆栈号
    private Integer partnerNumber; // 仅配对成员有值
}
