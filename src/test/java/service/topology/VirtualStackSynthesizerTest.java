package service.topology;

import common.consts.DiagnosticTypeEnum;
import common.consts.PairingSourceEnum;
import model.bo.Diagnostic;
import model.bo.TopologySettings;
import model.bo.VirtualStackPair;
import model.entity.PhysicalStack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.support.ResolutionDiagnostics;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static testutil.YardFixtures.*;

@DisplayName("虚拟堆栈合成")
class VirtualStackSynthesizerTest {

    private VirtualStackSynthesizer synthesizer;
    private ResolutionDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        synthesizer = new VirtualStackSynthesizer(new StackTopologyResolver(TopologySettings.defaults()));
        diagnostics = new ResolutionDiagnostics();
    }

    private static Map<Integer, PhysicalStack> index(PhysicalStack... stacks) {
        Map<Integer, PhysicalStack> result = new LinkedHashMap<>();
        for (PhysicalStack stack : stacks) {
            result.put(stack.getStackNumber(), stack);
        }
        return result;
    }

    @Test
    @DisplayName("堆栈3与5均为40尺且无持久化记录 -> 合成虚拟堆栈4")
    void testSynthesizeSimplePair() {
        SynthesisResult result = synthesizer.synthesize(index(stack40(3), stack40(5)), diagnostics);

        assertEquals(1, result.getPairs().size());
        VirtualStackPair pair = result.getPairs().get(0);
        assertEquals(4, pair.getVirtualNumber());
        assertEquals(3, pair.getFirstStackNumber());
        assertEquals(5, pair.getSecondStackNumber());
        assertEquals(PairingSourceEnum.SYNTHESIZED, pair.getSource());
        assertSame(pair, result.pairOf(3));
        assertSame(pair, result.pairOf(5));
        assertTrue(diagnostics.list().isEmpty());
    }

    @Test
    @DisplayName("持久化记录只覆盖虚拟堆栈号")
    void testPersistedNumberReused() {
        SynthesisResult result = synthesizer.synthesize(
                index(persisted(stack40(61), 63, 162), persisted(stack40(63), 61, 162)), diagnostics);

        VirtualStackPair pair = result.getPairs().get(0);
        assertEquals(162, pair.getVirtualNumber());
        assertEquals(PairingSourceEnum.PERSISTED, pair.getSource());
        assertTrue(diagnostics.list().isEmpty());
    }

    @Test
    @DisplayName("特殊堆栈声明为40尺也不配对")
    void testSpecialStackStandalone() {
        SynthesisResult result = synthesizer.synthesize(index(stack40(1), stack40(3)), diagnostics);

        assertTrue(result.getPairs().isEmpty());
        assertFalse(result.isPaired(1));
        // 1 不参与配对，3 缺少搭档 5
        assertFalse(result.getUnmatchedStacks().contains(1));
        assertTrue(result.getUnmatchedStacks().contains(3));
        assertEquals(1, diagnostics.count(DiagnosticTypeEnum.CONFIGURATION_GAP));
    }

    @Test
    @DisplayName("搭档不存在、为20尺、未启用时保持未配对并记录配置缺口")
    void testConfigurationGaps() {
        PhysicalStack inactive = stack40(13);
        inactive.setActive(false);
        SynthesisResult result = synthesizer.synthesize(
                index(stack40(3), stack40(7), stack20(9), stack40(11), inactive, stack40(4)), diagnostics);

        assertTrue(result.getPairs().isEmpty());
        assertEquals(Arrays.asList(3, 4, 7, 11), List.copyOf(result.getUnmatchedStacks()));
        assertEquals(4, diagnostics.count(DiagnosticTypeEnum.CONFIGURATION_GAP));
        assertEquals(0, diagnostics.count(DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY));
    }

    @Test
    @DisplayName("同一堆栈出现在两条持久化配对中：不成立的配对被丢弃并记录不一致，有效记录保留")
    void testConflictingPersistedPairings() {
        // 5 同时声称与 3 (虚拟号 40) 和 7 (虚拟号 6) 配对；{5,7} 不满足拓扑
        PhysicalStack s3 = persisted(stack40(3), 5, 40);
        PhysicalStack s5 = persisted(stack40(5), 3, 40);
        PhysicalStack s7 = persisted(stack40(7), 5, 6);
        SynthesisResult result = synthesizer.synthesize(index(s3, s5, s7, stack40(9)), diagnostics);

        List<Diagnostic> inconsistencies = diagnostics.list().stream()
                .filter(d -> d.getType() == DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY)
                .collect(Collectors.toList());
        assertEquals(1, inconsistencies.size());
        assertEquals(5, inconsistencies.get(0).getStackNumber());

        assertEquals(2, result.getPairs().size());
        assertEquals(40, result.pairOf(3).getVirtualNumber());
        assertEquals(PairingSourceEnum.PERSISTED, result.pairOf(3).getSource());
        assertEquals(8, result.pairOf(7).getVirtualNumber());
    }

    @Test
    @DisplayName("不可配对堆栈上的过期记录即使编号更小也不影响有效配对")
    void testStaleRecordOnIneligibleStack() {
        SynthesisResult result = synthesizer.synthesize(index(
                persisted(stack40(3), 5, 40), persisted(stack40(5), 3, 40), persisted(stack20(9), 3, 2)), diagnostics);

        assertEquals(1, result.getPairs().size());
        assertEquals(40, result.pairOf(3).getVirtualNumber());
        assertEquals(PairingSourceEnum.PERSISTED, result.pairOf(3).getSource());
        assertEquals(1, diagnostics.count(DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY));
    }

    @Test
    @DisplayName("合成编号与持久化编号相同：持久化保留，合成配对顺延并记录不一致")
    void testSynthesizedNumberTakenByPersisted() {
        SynthesisResult result = synthesizer.synthesize(index(
                persisted(stack40(3), 5, 8), persisted(stack40(5), 3, 8), stack40(7), stack40(9)), diagnostics);

        assertEquals(2, result.getPairs().size());
        assertEquals(8, result.pairOf(3).getVirtualNumber());
        assertEquals(PairingSourceEnum.PERSISTED, result.pairOf(3).getSource());
        // 顺延到最大堆栈号 9 之后
        assertEquals(10, result.pairOf(7).getVirtualNumber());
        assertEquals(PairingSourceEnum.SYNTHESIZED, result.pairOf(7).getSource());
        assertEquals(1, diagnostics.count(DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY));
        assertEquals(7, diagnostics.list().get(0).getStackNumber());
    }

    @Test
    @DisplayName("两个配对记录了同一虚拟号：较小堆栈号的配对保留，另一个改用合成编号")
    void testTwoPairsPersistSameNumber() {
        SynthesisResult result = synthesizer.synthesize(index(
                persisted(stack40(3), 5, 150), persisted(stack40(5), 3, 150),
                persisted(stack40(7), 9, 150), persisted(stack40(9), 7, 150)), diagnostics);

        assertEquals(150, result.pairOf(3).getVirtualNumber());
        assertEquals(8, result.pairOf(7).getVirtualNumber());
        assertEquals(PairingSourceEnum.SYNTHESIZED, result.pairOf(7).getSource());
        assertEquals(1, diagnostics.count(DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY));
    }

    @Test
    @DisplayName("同一配对记录了两个虚拟号时取较小者")
    void testSamePairDifferentNumbers() {
        SynthesisResult result = synthesizer.synthesize(
                index(persisted(stack40(3), 5, 204), persisted(stack40(5), 3, 104)), diagnostics);

        assertEquals(104, result.pairOf(3).getVirtualNumber());
        assertEquals(PairingSourceEnum.PERSISTED, result.pairOf(3).getSource());
        assertEquals(1, diagnostics.count(DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY));
    }

    @Test
    @DisplayName("两次合成结果完全一致")
    void testIdempotent() {
        Map<Integer, PhysicalStack> stacks = index(stack40(61), stack40(63), stack40(65), stack40(67),
                persisted(stack40(33), 35, 134), stack40(35), stack40(1), stack20(3), stack40(5));

        SynthesisResult first = synthesizer.synthesize(stacks, new ResolutionDiagnostics());
        SynthesisResult second = synthesizer.synthesize(stacks, new ResolutionDiagnostics());

        assertEquals(first.getPairs(), second.getPairs());
        assertEquals(Arrays.asList(62, 66, 134),
                first.getPairs().stream().map(VirtualStackPair::getVirtualNumber).collect(Collectors.toList()));
    }
}
