package service.classify;

import common.consts.ContainerStatusEnum;
import common.consts.DisplayStatusEnum;
import common.consts.ErrorCodes;
import common.consts.SizeClassEnum;
import common.util.LocationCodeUtil;
import model.bo.ContainerSlot;
import model.bo.LocationCoordinate;
import model.bo.LocationParseResult;
import model.bo.UnlocatedContainer;
import model.bo.VirtualStackPair;
import model.entity.Container;
import model.entity.PhysicalStack;
import service.support.ResolutionDiagnostics;
import service.topology.StackTopologyResolver;
import service.topology.SynthesisResult;

import java.util.HashMap;
import java.util.Map;

/**
 * 集装箱归类
 * 每个集装箱恰好归属一个逻辑存储单元，或者被标记为无法定位
 *
 * 归属规则：
 * - 编码中的堆栈号属于某个40尺配对 -> 虚拟堆栈
 * - 编码中的堆栈号是未配对的物理堆栈 -> 该物理堆栈
 * - 编码中的堆栈号本身就是虚拟堆栈号 (如 S04 对应配对 {3,5}) -> 虚拟堆栈
 * - 其余情况 -> 无法定位
 */
public class ContainerClassifier {

    private final StackTopologyResolver topology;
    private final Map<Integer, PhysicalStack> stacksByNumber;
    private final SynthesisResult synthesis;
    private final Map<Integer, VirtualStackPair> pairByVirtualNumber = new HashMap<>();

    public ContainerClassifier(StackTopologyResolver topology, Map<Integer, PhysicalStack> stacksByNumber,
                               SynthesisResult synthesis) {
        this.topology = topology;
        this.stacksByNumber = stacksByNumber;
        this.synthesis = synthesis;
        for (VirtualStackPair pair : synthesis.getPairs()) {
            pairByVirtualNumber.put(pair.getVirtualNumber(), pair);
        }
    }

    public Classification classify(Container container, ResolutionDiagnostics diagnostics) {
        String containerId = container.getContainerId();
        LocationParseResult parsed = LocationCodeUtil.parse(container.getLocationCode());
        if (!parsed.isSuccess()) {
            diagnostics.recordParseError(containerId, parsed.getError());
            return Classification.unlocated(new UnlocatedContainer(containerId, container.getLocationCode(), parsed.getError()));
        }

        LocationCoordinate coordinate = parsed.getCoordinate();
        int stackNumber = coordinate.getStackNumber();
        SizeClassEnum size = SizeClassEnum.getByCodeOrDefault(container.getSizeClass());

        Integer unitNumber = ownerUnitOf(stackNumber);
        if (unitNumber == null) {
            String reason = ErrorCodes.STACK_NOT_FOUND + ": " + stackNumber;
            diagnostics.recordConfigurationGap(stackNumber, containerId, reason);
            return Classification.unlocated(new UnlocatedContainer(containerId, container.getLocationCode(), reason));
        }

        PhysicalStack stack = stacksByNumber.get(stackNumber);
        boolean onPair = pairByVirtualNumber.containsKey(unitNumber) && (stack == null || synthesis.isPaired(stackNumber));
        if (onPair && size == SizeClassEnum.SIZE_20) {
            diagnostics.recordConfigurationGap(stackNumber, containerId, ErrorCodes.SMALL_CONTAINER_ON_PAIR);
        } else if (!onPair && size == SizeClassEnum.SIZE_40 && topology.effectiveSizeOf(stack) != SizeClassEnum.SIZE_40) {
            diagnostics.recordConfigurationGap(stackNumber, containerId, ErrorCodes.LARGE_CONTAINER_ON_SMALL_STACK);
        }

        ContainerSlot slot = new ContainerSlot(containerId, coordinate.getRow(), coordinate.getTier(),
                displayStatusOf(container), size, container.getLocationCode(), stackNumber);
        return Classification.located(unitNumber, onPair, slot);
    }

    /**
     * 堆栈号对应的存储单元号：物理号优先，其次虚拟号，找不到返回 null
     */
    public Integer ownerUnitOf(int stackNumber) {
        if (stacksByNumber.containsKey(stackNumber)) {
            VirtualStackPair pair = synthesis.pairOf(stackNumber);
            return pair != null ? pair.getVirtualNumber() : stackNumber;
        }
        VirtualStackPair pair = pairByVirtualNumber.get(stackNumber);
        return pair != null ? pair.getVirtualNumber() : null;
    }

    /**
     * 展示状态：残损 > 维修 > 正常占用
     */
    public static DisplayStatusEnum displayStatusOf(Container container) {
        ContainerStatusEnum status = ContainerStatusEnum.getByCode(container.getStatus());
        boolean hasDamage = container.getDamage() != null && !container.getDamage().isEmpty();
        if (status == ContainerStatusEnum.DAMAGED || hasDamage) {
            return DisplayStatusEnum.DAMAGED;
        }
        if (status == ContainerStatusEnum.MAINTENANCE) {
            return DisplayStatusEnum.MAINTENANCE;
        }
        return DisplayStatusEnum.OCCUPIED;
    }
}
