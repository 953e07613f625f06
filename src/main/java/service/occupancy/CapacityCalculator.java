package service.occupancy;

import common.consts.ErrorCodes;
import model.entity.PhysicalStack;
import service.support.ResolutionDiagnostics;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 容量计算
 * 优先级：声明容量(>0) > 按排层高覆盖之和 > 排数 x 最大层高
 */
public class CapacityCalculator {

    /**
     * 单个物理堆栈的容量
     */
    public int capacityOf(PhysicalStack stack) {
        if (stack.getDeclaredCapacity() != null && stack.getDeclaredCapacity() > 0) {
            return stack.getDeclaredCapacity();
        }
        Integer overridden = sumOverrides(stack);
        if (overridden != null) {
            return overridden;
        }
        return nullToZero(stack.getRows()) * nullToZero(stack.getMaxTiers());
    }

    /**
     * 配对虚拟堆栈的容量 = 任一成员容量 (不是两者之和)
     * 成员几何配置不一致时记录诊断，以较小堆栈号成员为准
     */
    public int capacityOfPair(PhysicalStack first, PhysicalStack second, ResolutionDiagnostics diagnostics) {
        int firstCapacity = capacityOf(first);
        if (!sameGeometry(first, second) || firstCapacity != capacityOf(second)) {
            diagnostics.recordInconsistency(first.getStackNumber(), ErrorCodes.GEOMETRY_MISMATCH
                    + ": " + describe(first) + " / " + describe(second) + "，采用堆栈 " + first.getStackNumber() + " 的配置");
        }
        return firstCapacity;
    }

    /**
     * 指定排的最大层高，无覆盖时取统一层高
     */
    public int maxTiersForRow(PhysicalStack stack, int row) {
        List<PhysicalStack.RowTierConfig> overrides = stack.getRowTierOverrides();
        if (overrides != null) {
            for (PhysicalStack.RowTierConfig config : overrides) {
                if (config != null && config.getRow() != null && config.getRow() == row && config.getMaxTiers() != null) {
                    return config.getMaxTiers();
                }
            }
        }
        return nullToZero(stack.getMaxTiers());
    }

    public boolean sameGeometry(PhysicalStack a, PhysicalStack b) {
        return Objects.equals(a.getRows(), b.getRows())
                && Objects.equals(a.getMaxTiers(), b.getMaxTiers())
                && normalizedOverrides(a).equals(normalizedOverrides(b));
    }

    // 超出排数的覆盖项不计入容量，没有有效覆盖项时返回 null
    private Integer sumOverrides(PhysicalStack stack) {
        int rows = nullToZero(stack.getRows());
        Integer capacity = null;
        for (Map.Entry<Integer, Integer> entry : normalizedOverrides(stack).entrySet()) {
            if (rows <= 0 || entry.getKey() <= rows) {
                capacity = (capacity == null ? 0 : capacity) + entry.getValue();
            }
        }
        return capacity;
    }

    private Map<Integer, Integer> normalizedOverrides(PhysicalStack stack) {
        Map<Integer, Integer> result = new TreeMap<>();
        if (stack.getRowTierOverrides() == null) {
            return result;
        }
        for (PhysicalStack.RowTierConfig config : stack.getRowTierOverrides()) {
            if (config != null && config.getRow() != null && config.getMaxTiers() != null) {
                result.putIfAbsent(config.getRow(), config.getMaxTiers());
            }
        }
        return result;
    }

    private String describe(PhysicalStack stack) {
        return "S" + stack.getStackNumber() + "(rows=" + stack.getRows() + ", maxTiers=" + stack.getMaxTiers()
                + ", overrides=" + normalizedOverrides(stack) + ")";
    }

    private static int nullToZero(Integer value) {
        return value == null ? 0 : value;
    }
}
