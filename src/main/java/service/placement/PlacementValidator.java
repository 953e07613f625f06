package service.placement;

import common.consts.PlacementCheckEnum;
import common.consts.SizeClassEnum;
import common.consts.StackRoleEnum;
import common.util.LocationCodeUtil;
import model.bo.ContainerSlot;
import model.bo.LocationCoordinate;
import model.bo.LocationParseResult;
import model.bo.LogicalStorageUnit;
import model.bo.PhysicalStackView;
import model.bo.PlacementCheckResult;
import model.bo.YardResolution;
import model.entity.PhysicalStack;
import service.occupancy.CapacityCalculator;
import service.topology.StackTopologyResolver;

import java.util.Map;

/**
 * 放箱校验
 * 基于一次解析结果判断某个箱位能否放入指定尺寸的集装箱
 */
public class PlacementValidator {

    private final StackTopologyResolver topology;
    private final CapacityCalculator capacityCalculator;

    public PlacementValidator(StackTopologyResolver topology, CapacityCalculator capacityCalculator) {
        this.topology = topology;
        this.capacityCalculator = capacityCalculator;
    }

    /**
     * @param resolution     当前快照的解析结果
     * @param stacksByNumber 堆栈号 -> 堆栈
     * @param locationCode   目标箱位编码
     * @param sizeClass      待放集装箱尺寸
     */
    public PlacementCheckResult validate(YardResolution resolution, Map<Integer, PhysicalStack> stacksByNumber,
                                         String locationCode, String sizeClass) {
        LocationParseResult parsed = LocationCodeUtil.parse(locationCode);
        if (!parsed.isSuccess()) {
            return PlacementCheckResult.reject(PlacementCheckEnum.INVALID_FORMAT, parsed.getError());
        }
        LocationCoordinate coordinate = parsed.getCoordinate();
        SizeClassEnum size = SizeClassEnum.getByCodeOrDefault(sizeClass);

        // 定位目标单元与几何参照堆栈
        LogicalStorageUnit unit;
        PhysicalStack geometry = stacksByNumber.get(coordinate.getStackNumber());
        if (geometry != null) {
            PhysicalStackView view = resolution.findStackView(coordinate.getStackNumber());
            if (view == null) {
                return PlacementCheckResult.reject(PlacementCheckEnum.STACK_NOT_FOUND,
                        PlacementCheckEnum.STACK_NOT_FOUND.getDesc() + ": " + coordinate.getStackNumber());
            }
            unit = view.getRole() == StackRoleEnum.PAIRED
                    ? resolution.findVirtualUnit(view.getOwnerUnitNumber())
                    : resolution.findPhysicalUnit(view.getOwnerUnitNumber());
        } else {
            unit = resolution.findVirtualUnit(coordinate.getStackNumber());
            if (unit != null) {
                geometry = stacksByNumber.get(unit.getMemberStackNumbers().get(0));
            }
        }
        if (unit == null || geometry == null) {
            return PlacementCheckResult.reject(PlacementCheckEnum.STACK_NOT_FOUND,
                    PlacementCheckEnum.STACK_NOT_FOUND.getDesc() + ": " + coordinate.getStackNumber());
        }

        if (!unit.isActive() || !geometry.isActive()) {
            return PlacementCheckResult.reject(PlacementCheckEnum.STACK_INACTIVE,
                    PlacementCheckEnum.STACK_INACTIVE.getDesc() + ": " + geometry.getStackNumber());
        }
        if (size == SizeClassEnum.SIZE_40) {
            if (topology.isSpecial(geometry)) {
                return PlacementCheckResult.reject(PlacementCheckEnum.SPECIAL_STACK,
                        PlacementCheckEnum.SPECIAL_STACK.getDesc() + ": " + geometry.getStackNumber());
            }
            if (unit.getSizeClass() != SizeClassEnum.SIZE_40) {
                return PlacementCheckResult.reject(PlacementCheckEnum.SIZE_MISMATCH,
                        PlacementCheckEnum.SIZE_MISMATCH.getDesc() + ": " + geometry.getStackNumber());
            }
        }

        int rows = geometry.getRows() == null ? 0 : geometry.getRows();
        if (coordinate.getRow() > rows) {
            return PlacementCheckResult.reject(PlacementCheckEnum.ROW_OUT_OF_RANGE,
                    "排号 " + coordinate.getRow() + " 超出范围 (最大: " + rows + ")");
        }
        int maxTiers = capacityCalculator.maxTiersForRow(geometry, coordinate.getRow());
        if (coordinate.getTier() > maxTiers) {
            return PlacementCheckResult.reject(PlacementCheckEnum.TIER_OUT_OF_RANGE,
                    "层号 " + coordinate.getTier() + " 超出第 " + coordinate.getRow() + " 排范围 (最大: " + maxTiers + ")");
        }

        if (unit.getOccupancy() >= unit.getCapacity()) {
            return PlacementCheckResult.reject(PlacementCheckEnum.UNIT_FULL,
                    PlacementCheckEnum.UNIT_FULL.getDesc() + ": " + unit.getOccupancy() + " / " + unit.getCapacity());
        }
        for (ContainerSlot slot : unit.getSlots()) {
            if (slot.getRow() == coordinate.getRow() && slot.getTier() == coordinate.getTier()) {
                return PlacementCheckResult.reject(PlacementCheckEnum.SLOT_OCCUPIED,
                        PlacementCheckEnum.SLOT_OCCUPIED.getDesc() + ": " + slot.getContainerId());
            }
        }
        return PlacementCheckResult.ok();
    }
}
