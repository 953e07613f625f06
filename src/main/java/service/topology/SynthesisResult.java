package service.topology;

import lombok.Getter;
import model.bo.VirtualStackPair;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 虚拟堆栈合成结果
 */
@Getter
public class SynthesisResult {

    private final List<VirtualStackPair> pairs;              // 按虚拟堆栈号升序
    private final Map<Integer, VirtualStackPair> pairByMember; // 物理堆栈号 -> 所在配对
    private final Set<Integer> unmatchedStacks;              // 有资格配对却找不到搭档的40尺堆栈

    public SynthesisResult(List<VirtualStackPair> pairs, Map<Integer, VirtualStackPair> pairByMember,
                           Set<Integer> unmatchedStacks) {
        this.pairs = Collections.unmodifiableList(pairs);
        this.pairByMember = Collections.unmodifiableMap(pairByMember);
        this.unmatchedStacks = Collections.unmodifiableSet(unmatchedStacks);
    }

    public VirtualStackPair pairOf(int stackNumber) {
        return pairByMember.get(stackNumber);
    }

    public boolean isPaired(int stackNumber) {
        return pairByMember.containsKey(stackNumber);
    }
}
