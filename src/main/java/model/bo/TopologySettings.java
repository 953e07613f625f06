package model.bo;

import common.consts.ErrorCodes;
import common.consts.SizeClassEnum;
import common.exception.BusinessException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 堆场拓扑配置 (不可变)
 * 显式传入每个解析组件，解析过程不读取任何全局状态
 */
@Getter
public class TopologySettings {

    public static final int DEFAULT_STACK_PADDING = 2;

    private final Set<Integer> specialStacks;
    private final List<PairingBand> bands;
    private final Map<Integer, SizeClassEnum> sizeOverrides;
    private final int stackPadding;

    public TopologySettings(Set<Integer> specialStacks, List<PairingBand> bands,
                            Map<Integer, SizeClassEnum> sizeOverrides, int stackPadding) {
        this.specialStacks = Collections.unmodifiableSet(
                specialStacks == null ? Collections.emptySet() : new LinkedHashSet<>(specialStacks));
        this.bands = bands == null ? Collections.emptyList() : List.copyOf(bands);
        this.sizeOverrides = Collections.unmodifiableMap(
                sizeOverrides == null ? Collections.emptyMap() : new HashMap<>(sizeOverrides));
        this.stackPadding = Math.max(1, stackPadding);

        for (int i = 0; i < this.bands.size(); i++) {
            for (int j = i + 1; j < this.bands.size(); j++) {
                if (this.bands.get(i).overlaps(this.bands.get(j))) {
                    throw new BusinessException(ErrorCodes.OVERLAPPING_BANDS + ": "
                            + this.bands.get(i) + " / " + this.bands.get(j));
                }
            }
        }
    }

    /**
     * 参考堆场的缺省配置：特殊堆栈 1/31/101/103，三个号段 [3,29] [33,55] [61,99]
     */
    public static TopologySettings defaults() {
        return new TopologySettings(
                new LinkedHashSet<>(Arrays.asList(1, 31, 101, 103)),
                Arrays.asList(new PairingBand(3, 29), new PairingBand(33, 55), new PairingBand(61, 99)),
                Collections.emptyMap(),
                DEFAULT_STACK_PADDING);
    }

    public TopologySettings withSizeOverrides(Map<Integer, SizeClassEnum> overrides) {
        return new TopologySettings(specialStacks, bands, overrides, stackPadding);
    }

    public boolean isSpecial(int stackNumber) {
        return specialStacks.contains(stackNumber);
    }

    /**
     * 查找堆栈号所属号段，找不到返回 null
     */
    public PairingBand bandOf(int stackNumber) {
        for (PairingBand band : bands) {
            if (band.contains(stackNumber)) {
                return band;
            }
        }
        return null;
    }
}
