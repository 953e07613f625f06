package model.bo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次完整解析的输出
 */
@Data
public class YardResolution {
    private List<LogicalStorageUnit> units = new ArrayList<>();
    private List<PhysicalStackView> stacks = new ArrayList<>();
    private List<UnlocatedContainer> unlocated = new ArrayList<>();
    private List<Diagnostic> diagnostics = new ArrayList<>();
    private YardSummary summary;

    /**
     * 查找包含指定物理堆栈的单元，找不到返回 null
     */
    public LogicalStorageUnit findUnitByMember(int stackNumber) {
        for (LogicalStorageUnit unit : units) {
            if (unit.getMemberStackNumbers().contains(stackNumber)) {
                return unit;
            }
        }
        return null;
    }

    /**
     * 按物理堆栈号查找视图，找不到返回 null
     */
    public PhysicalStackView findStackView(int stackNumber) {
        for (PhysicalStackView view : stacks) {
            if (view.getStackNumber() == stackNumber) {
                return view;
            }
        }
        return null;
    }

    /**
     * 按编号查找虚拟单元，找不到返回 null
     */
    public LogicalStorageUnit findVirtualUnit(int unitNumber) {
        for (LogicalStorageUnit unit : units) {
            if (unit.isVirtual() && unit.getUnitNumber() == unitNumber) {
                return unit;
            }
        }
        return null;
    }

    /**
     * 按编号查找物理单元，找不到返回 null
     */
    public LogicalStorageUnit findPhysicalUnit(int unitNumber) {
        for (LogicalStorageUnit unit : units) {
            if (!unit.isVirtual() && unit.getUnitNumber() == unitNumber) {
                return unit;
            }
        }
        return null;
    }
}
