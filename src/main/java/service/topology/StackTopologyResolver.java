package service.topology;

import common.consts.SizeClassEnum;
import model.bo.PairingBand;
import model.bo.TopologySettings;
import model.entity.PhysicalStack;

/**
 * 堆栈拓扑解析器
 * 40尺配对相邻关系的唯一判定来源，其他组件一律通过 adjacentOf 查询
 *
 * 规则：
 * 1. 特殊堆栈永不配对
 * 2. 堆栈号必须落在某个号段内，且是该号段的首号或首号+2
 * 3. 首号的搭档为首号+2，反之为首号-2；搭档为特殊堆栈时同样视为无搭档
 *
 * adjacentOf 在其定义域上是对合：adjacentOf(adjacentOf(n)) == n
 */
public class StackTopologyResolver {

    private final TopologySettings settings;

    public StackTopologyResolver(TopologySettings settings) {
        this.settings = settings;
    }

    /**
     * 计算40尺配对搭档堆栈号
     *
     * @param stackNumber 堆栈号
     * @return 搭档堆栈号，无搭档返回 null
     */
    public Integer adjacentOf(int stackNumber) {
        if (settings.isSpecial(stackNumber)) {
            return null;
        }
        PairingBand band = settings.bandOf(stackNumber);
        if (band == null) {
            return null;
        }
        Integer partner = band.partnerOf(stackNumber);
        if (partner == null || settings.isSpecial(partner)) {
            return null;
        }
        return partner;
    }

    public boolean isSpecial(int stackNumber) {
        return settings.isSpecial(stackNumber);
    }

    public boolean isPairParticipant(int stackNumber) {
        return adjacentOf(stackNumber) != null;
    }

    /**
     * 两个堆栈号是否互为拓扑搭档
     */
    public boolean areAdjacent(int a, int b) {
        Integer partner = adjacentOf(a);
        return partner != null && partner == b;
    }

    /**
     * 合成虚拟堆栈号：两者较小值 + 1 (即配对时跳过的中间号)
     */
    public int virtualNumberOf(int a, int b) {
        return Math.min(a, b) + 1;
    }

    /**
     * 有效箱型：配置覆盖优先，其次为堆栈声明，缺省20尺
     */
    public SizeClassEnum effectiveSizeOf(PhysicalStack stack) {
        if (stack.getStackNumber() != null) {
            SizeClassEnum override = settings.getSizeOverrides().get(stack.getStackNumber());
            if (override != null) {
                return override;
            }
        }
        return SizeClassEnum.getByCodeOrDefault(stack.getSizeClass());
    }

    /**
     * 堆栈是否是特殊堆栈 (声明标记或配置集合任一命中)
     */
    public boolean isSpecial(PhysicalStack stack) {
        return stack.isSpecial() || (stack.getStackNumber() != null && settings.isSpecial(stack.getStackNumber()));
    }

    /**
     * 能否参与40尺配对：启用、非特殊、有效箱型为40尺
     */
    public boolean isPairEligible(PhysicalStack stack) {
        return stack != null && stack.isActive() && !isSpecial(stack) && effectiveSizeOf(stack) == SizeClassEnum.SIZE_40;
    }

    public TopologySettings getSettings() {
        return settings;
    }
}
