package model.bo;

import common.consts.PairingSourceEnum;
import common.consts.SizeClassEnum;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 逻辑存储单元
 * 要么是一个未配对的物理堆栈，要么是由两个40尺物理堆栈组成的虚拟堆栈
 */
@Data
@NoArgsConstructor
public class LogicalStorageUnit {
    private int unitNumber;
    private boolean virtual;
    private List<Integer> memberStackNumbers = new ArrayList<>();

    private String sectionId;
    private SizeClassEnum sizeClass;
    private PairingSourceEnum pairingSource; // 仅虚拟堆栈有值
    private boolean active = true;

    private int capacity;
    private int occupancy;
    private boolean overCapacity;

    private List<ContainerSlot> slots = new ArrayList<>();

    public int getAvailable() {
        return Math.max(0, capacity - occupancy);
    }
}
