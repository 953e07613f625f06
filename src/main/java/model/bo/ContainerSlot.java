package model.bo;

import common.consts.DisplayStatusEnum;
import common.consts.SizeClassEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 归属到某个存储单元的箱位
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContainerSlot {
    private String containerId;
    private int row;
    private int tier;
    private DisplayStatusEnum displayStatus;

    private SizeClassEnum sizeClass;
    private String locationCode;     // 原始箱位编码
    private int sourceStackNumber;   // 编码中写的堆栈号 (物理号或虚拟号)
}
