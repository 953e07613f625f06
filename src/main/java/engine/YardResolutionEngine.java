package engine;

import common.consts.ErrorCodes;
import common.consts.SizeClassEnum;
import common.consts.StackRoleEnum;
import common.exception.BusinessException;
import common.util.LocationCodeUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.LogicalStorageUnit;
import model.bo.PhysicalStackView;
import model.bo.TopologySettings;
import model.bo.VirtualStackPair;
import model.bo.YardResolution;
import model.entity.Container;
import model.entity.PhysicalStack;
import service.classify.Classification;
import service.classify.ContainerClassifier;
import service.occupancy.CapacityCalculator;
import service.occupancy.OccupancyAggregator;
import service.support.ResolutionDiagnostics;
import service.topology.StackTopologyResolver;
import service.topology.SynthesisResult;
import service.topology.VirtualStackSynthesizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 堆场解析引擎
 * 对一份不可变的堆栈 + 集装箱快照做一次完整的单遍计算：
 * 拓扑判定 -> 虚拟堆栈合成 -> 集装箱归类 -> 容量/占用统计
 *
 * 不持有跨调用的可变状态，不做 I/O，可被多个调用方并发使用
 */
@Slf4j
public class YardResolutionEngine {

    private final StackTopologyResolver topology;
    private final VirtualStackSynthesizer synthesizer;
    private final CapacityCalculator capacityCalculator = new CapacityCalculator();
    private final OccupancyAggregator aggregator = new OccupancyAggregator();

    public YardResolutionEngine(TopologySettings settings) {
        this.topology = new StackTopologyResolver(settings);
        this.synthesizer = new VirtualStackSynthesizer(topology);
    }

    /**
     * 全量解析
     *
     * @param stacks     堆栈列表
     * @param containers 集装箱列表
     * @return 逻辑存储单元、物理堆栈视图、无法定位的箱子、诊断与汇总
     */
    public YardResolution resolve(List<PhysicalStack> stacks, List<Container> containers) {
        if (stacks == null && containers == null) {
            throw new BusinessException(ErrorCodes.EMPTY_SNAPSHOT);
        }
        ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
        Map<Integer, PhysicalStack> stacksByNumber = indexStacks(stacks, diagnostics);

        SynthesisResult synthesis = synthesizer.synthesize(stacksByNumber, diagnostics);

        YardResolution resolution = new YardResolution();
        // 虚拟号可能与物理号冲突，两类单元分开索引
        Map<Integer, LogicalStorageUnit> physicalUnits = new LinkedHashMap<>();
        Map<Integer, LogicalStorageUnit> virtualUnits = new LinkedHashMap<>();
        buildUnits(stacksByNumber, synthesis, resolution, diagnostics, physicalUnits, virtualUnits);

        ContainerClassifier classifier = new ContainerClassifier(topology, stacksByNumber, synthesis);
        List<Container> input = containers == null ? Collections.emptyList() : containers;
        for (Container container : input) {
            if (container == null) {
                continue;
            }
            Classification classification = classifier.classify(container, diagnostics);
            if (classification.isLocated()) {
                Map<Integer, LogicalStorageUnit> owners = classification.isVirtualUnit() ? virtualUnits : physicalUnits;
                owners.get(classification.getUnitNumber()).getSlots().add(classification.getSlot());
            } else {
                resolution.getUnlocated().add(classification.getUnlocated());
            }
        }

        List<LogicalStorageUnit> units = new ArrayList<>(physicalUnits.values());
        units.addAll(virtualUnits.values());
        units.sort(Comparator.comparingInt(LogicalStorageUnit::getUnitNumber)
                .thenComparing(LogicalStorageUnit::isVirtual));
        aggregator.aggregate(units, diagnostics);

        resolution.setUnits(units);
        resolution.setDiagnostics(new ArrayList<>(diagnostics.list()));
        resolution.setSummary(aggregator.summarize(units, resolution.getUnlocated().size()));

        log.info("堆场解析完成: 堆栈[{}], 单元[{}], 虚拟堆栈[{}], 集装箱[{}], 无法定位[{}], 诊断[{}]",
                stacksByNumber.size(), units.size(), synthesis.getPairs().size(), input.size(),
                resolution.getUnlocated().size(), resolution.getDiagnostics().size());
        return resolution;
    }

    /**
     * 只做虚拟堆栈合成 (不涉及集装箱)
     */
    public SynthesisResult synthesize(List<PhysicalStack> stacks) {
        ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
        return synthesizer.synthesize(indexStacks(stacks, diagnostics), diagnostics);
    }

    /**
     * 枚举存储单元的所有箱位编码 (按排、层升序)
     * 虚拟堆栈使用较小堆栈号成员的几何配置，编码中的堆栈号为虚拟堆栈号
     *
     * @param unit   存储单元
     * @param stacks 快照中的堆栈列表
     */
    public List<String> locationCodesOf(LogicalStorageUnit unit, Collection<PhysicalStack> stacks) {
        PhysicalStack geometry = null;
        int memberNumber = unit.getMemberStackNumbers().isEmpty() ? unit.getUnitNumber() : unit.getMemberStackNumbers().get(0);
        for (PhysicalStack stack : stacks) {
            if (stack != null && stack.getStackNumber() != null && stack.getStackNumber() == memberNumber) {
                geometry = stack;
                break;
            }
        }
        List<String> codes = new ArrayList<>();
        if (geometry == null || geometry.getRows() == null) {
            return codes;
        }
        int padding = topology.getSettings().getStackPadding();
        for (int row = 1; row <= geometry.getRows(); row++) {
            int tiers = capacityCalculator.maxTiersForRow(geometry, row);
            for (int tier = 1; tier <= tiers; tier++) {
                codes.add(LocationCodeUtil.format(unit.getUnitNumber(), row, tier, padding));
            }
        }
        return codes;
    }

    public StackTopologyResolver getTopology() {
        return topology;
    }

    public CapacityCalculator getCapacityCalculator() {
        return capacityCalculator;
    }

    /**
     * 按堆栈号建立索引：忽略缺号/非正数，重复堆栈号保留第一条
     */
    private Map<Integer, PhysicalStack> indexStacks(List<PhysicalStack> stacks, ResolutionDiagnostics diagnostics) {
        Map<Integer, PhysicalStack> result = new LinkedHashMap<>();
        if (stacks == null) {
            return result;
        }
        for (PhysicalStack stack : stacks) {
            if (stack == null) {
                continue;
            }
            if (stack.getStackNumber() == null || stack.getStackNumber() <= 0) {
                diagnostics.recordConfigurationGap(stack.getStackNumber(), null, ErrorCodes.INVALID_STACK_NUMBER);
                continue;
            }
            if (result.containsKey(stack.getStackNumber())) {
                diagnostics.recordInconsistency(stack.getStackNumber(), ErrorCodes.DUPLICATE_STACK_NUMBER);
                continue;
            }
            result.put(stack.getStackNumber(), stack);
        }
        return result;
    }

    private void buildUnits(Map<Integer, PhysicalStack> stacksByNumber, SynthesisResult synthesis,
                            YardResolution resolution, ResolutionDiagnostics diagnostics,
                            Map<Integer, LogicalStorageUnit> physicalUnits, Map<Integer, LogicalStorageUnit> virtualUnits) {

        for (PhysicalStack stack : stacksByNumber.values()) {
            int number = stack.getStackNumber();
            VirtualStackPair pair = synthesis.pairOf(number);
            if (pair != null) {
                int partner = pair.getFirstStackNumber() == number ? pair.getSecondStackNumber() : pair.getFirstStackNumber();
                resolution.getStacks().add(new PhysicalStackView(number, StackRoleEnum.PAIRED, pair.getVirtualNumber(), partner));
                continue;
            }
            resolution.getStacks().add(new PhysicalStackView(number, roleOf(stack, synthesis), number, null));

            LogicalStorageUnit unit = new LogicalStorageUnit();
            unit.setUnitNumber(number);
            unit.setVirtual(false);
            unit.getMemberStackNumbers().add(number);
            unit.setSectionId(stack.getSectionId());
            unit.setSizeClass(topology.effectiveSizeOf(stack));
            unit.setActive(stack.isActive());
            unit.setCapacity(capacityCalculator.capacityOf(stack));
            physicalUnits.put(number, unit);
        }

        for (VirtualStackPair pair : synthesis.getPairs()) {
            PhysicalStack first = stacksByNumber.get(pair.getFirstStackNumber());
            PhysicalStack second = stacksByNumber.get(pair.getSecondStackNumber());

            LogicalStorageUnit unit = new LogicalStorageUnit();
            unit.setUnitNumber(pair.getVirtualNumber());
            unit.setVirtual(true);
            unit.getMemberStackNumbers().add(pair.getFirstStackNumber());
            unit.getMemberStackNumbers().add(pair.getSecondStackNumber());
            unit.setSectionId(first.getSectionId());
            unit.setSizeClass(SizeClassEnum.SIZE_40);
            unit.setPairingSource(pair.getSource());
            unit.setActive(true);
            unit.setCapacity(capacityCalculator.capacityOfPair(first, second, diagnostics));
            virtualUnits.put(pair.getVirtualNumber(), unit);
        }
    }

    private StackRoleEnum roleOf(PhysicalStack stack, SynthesisResult synthesis) {
        if (topology.isSpecial(stack)) {
            return StackRoleEnum.SPECIAL;
        }
        if (synthesis.getUnmatchedStacks().contains(stack.getStackNumber())) {
            return StackRoleEnum.UNMATCHED;
        }
        return StackRoleEnum.STANDALONE;
    }
}
