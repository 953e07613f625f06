package model.bo;

import lombok.Data;

/**
 * 堆场容量汇总 (每个配对单元只统计一次)
 */
@Data
public class YardSummary {
    private int totalCapacity;
    private int totalOccupancy;
    private double occupancyRate;    // 百分比，保留一位小数

    private int physicalUnitCount;
    private int virtualUnitCount;
    private int overCapacityUnitCount;

    private int damagedCount;
    private int maintenanceCount;
    private int unlocatedCount;
}
