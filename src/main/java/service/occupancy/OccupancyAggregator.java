package service.occupancy;

import common.consts.DisplayStatusEnum;
import common.consts.ErrorCodes;
import model.bo.ContainerSlot;
import model.bo.LogicalStorageUnit;
import model.bo.YardSummary;
import service.support.ResolutionDiagnostics;

import java.util.List;

/**
 * 占用统计
 * 每个箱子只归属一个单元，占用直接由该单元的箱位数得出；配对成员不再单独计数
 */
public class OccupancyAggregator {

    /**
     * 计算每个单元的占用并标记超容量 (不截断)
     */
    public void aggregate(List<LogicalStorageUnit> units, ResolutionDiagnostics diagnostics) {
        for (LogicalStorageUnit unit : units) {
            unit.setOccupancy(unit.getSlots().size());
            boolean over = unit.getOccupancy() > unit.getCapacity();
            unit.setOverCapacity(over);
            if (over) {
                diagnostics.recordOverCapacity(unit.getUnitNumber(), ErrorCodes.OVER_CAPACITY
                        + ": " + unit.getOccupancy() + " / " + unit.getCapacity());
            }
        }
    }

    /**
     * 汇总堆场容量与状态统计
     */
    public YardSummary summarize(List<LogicalStorageUnit> units, int unlocatedCount) {
        YardSummary summary = new YardSummary();
        for (LogicalStorageUnit unit : units) {
            summary.setTotalCapacity(summary.getTotalCapacity() + unit.getCapacity());
            summary.setTotalOccupancy(summary.getTotalOccupancy() + unit.getOccupancy());
            if (unit.isVirtual()) {
                summary.setVirtualUnitCount(summary.getVirtualUnitCount() + 1);
            } else {
                summary.setPhysicalUnitCount(summary.getPhysicalUnitCount() + 1);
            }
            if (unit.isOverCapacity()) {
                summary.setOverCapacityUnitCount(summary.getOverCapacityUnitCount() + 1);
            }
            for (ContainerSlot slot : unit.getSlots()) {
                if (slot.getDisplayStatus() == DisplayStatusEnum.DAMAGED) {
                    summary.setDamagedCount(summary.getDamagedCount() + 1);
                } else if (slot.getDisplayStatus() == DisplayStatusEnum.MAINTENANCE) {
                    summary.setMaintenanceCount(summary.getMaintenanceCount() + 1);
                }
            }
        }
        summary.setUnlocatedCount(unlocatedCount);
        if (summary.getTotalCapacity() > 0) {
            double rate = summary.getTotalOccupancy() * 100.0 / summary.getTotalCapacity();
            summary.setOccupancyRate(Math.round(rate * 10) / 10.0);
        }
        return summary;
    }
}
