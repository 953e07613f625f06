package service.topology;

import common.consts.ErrorCodes;
import common.consts.PairingSourceEnum;
import model.bo.VirtualStackPair;
import model.entity.PhysicalStack;
import service.support.ResolutionDiagnostics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 虚拟堆栈合成器
 * 持久化配对与即时合成走同一条路径：持久化记录只覆盖虚拟堆栈号，配对关系始终由拓扑规则决定
 * 所有虚拟堆栈号互不重复
 * 同一输入多次执行得到完全相同的虚拟堆栈号与成员
 */
public class VirtualStackSynthesizer {

    private final StackTopologyResolver topology;

    public VirtualStackSynthesizer(StackTopologyResolver topology) {
        this.topology = topology;
    }

    /**
     * @param stacksByNumber 堆栈号 -> 堆栈 (已去重)
     * @param diagnostics    诊断收集器
     */
    public SynthesisResult synthesize(Map<Integer, PhysicalStack> stacksByNumber, ResolutionDiagnostics diagnostics) {
        // 1. 按拓扑规则确定配对成员 (较小堆栈号 -> 较大堆栈号)，按堆栈号顺序处理保证结果确定
        Map<Integer, Integer> members = new TreeMap<>();
        Set<Integer> unmatched = new TreeSet<>();
        Set<Integer> processed = new HashSet<>();
        for (Integer number : new TreeSet<>(stacksByNumber.keySet())) {
            PhysicalStack stack = stacksByNumber.get(number);
            if (processed.contains(number) || !topology.isPairEligible(stack)) {
                continue;
            }
            processed.add(number);

            Integer partnerNumber = topology.adjacentOf(number);
            if (partnerNumber == null) {
                unmatched.add(number);
                diagnostics.recordConfigurationGap(number, null, ErrorCodes.NO_ADJACENT);
                continue;
            }
            PhysicalStack partner = stacksByNumber.get(partnerNumber);
            if (partner == null) {
                unmatched.add(number);
                diagnostics.recordConfigurationGap(number, null, ErrorCodes.PARTNER_MISSING + ": " + partnerNumber);
                continue;
            }
            if (!topology.isPairEligible(partner)) {
                unmatched.add(number);
                diagnostics.recordConfigurationGap(number, null, ErrorCodes.PARTNER_NOT_ELIGIBLE + ": " + partnerNumber);
                continue;
            }
            processed.add(partnerNumber);
            members.put(Math.min(number, partnerNumber), Math.max(number, partnerNumber));
        }

        // 2. 持久化编号先占位，合成编号不得与之重复
        Map<Integer, Integer> persisted = collectPersistedPairings(stacksByNumber, members, diagnostics);
        Set<Integer> usedVirtualNumbers = new HashSet<>(persisted.values());

        Map<Integer, Integer> assigned = new TreeMap<>();
        List<Integer> displaced = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : members.entrySet()) {
            int first = entry.getKey();
            Integer persistedNumber = persisted.get(first);
            if (persistedNumber != null) {
                assigned.put(first, persistedNumber);
                continue;
            }
            int synthesized = topology.virtualNumberOf(first, entry.getValue());
            if (usedVirtualNumbers.contains(synthesized)) {
                displaced.add(first);
                continue;
            }
            usedVirtualNumbers.add(synthesized);
            assigned.put(first, synthesized);
        }

        // 3. 合成编号被占用的配对顺延到所有堆栈号与已用编号之后
        int next = Math.max(maxOf(stacksByNumber.keySet()), maxOf(usedVirtualNumbers)) + 1;
        for (Integer first : displaced) {
            int synthesized = topology.virtualNumberOf(first, members.get(first));
            diagnostics.recordInconsistency(first, ErrorCodes.VIRTUAL_NUMBER_TAKEN
                    + ": 配对 {" + first + ", " + members.get(first) + "} 的虚拟堆栈号 " + synthesized
                    + " 改为 " + next);
            assigned.put(first, next);
            usedVirtualNumbers.add(next);
            next++;
        }

        List<VirtualStackPair> pairs = new ArrayList<>();
        Map<Integer, VirtualStackPair> pairByMember = new HashMap<>();
        for (Map.Entry<Integer, Integer> entry : members.entrySet()) {
            int first = entry.getKey();
            int second = entry.getValue();
            int virtualNumber = assigned.get(first);
            PairingSourceEnum source = persisted.containsKey(first) ? PairingSourceEnum.PERSISTED : PairingSourceEnum.SYNTHESIZED;
            if (stacksByNumber.containsKey(virtualNumber)) {
                diagnostics.recordInconsistency(virtualNumber, ErrorCodes.UNIT_NUMBER_COLLISION
                        + ": 配对 {" + first + ", " + second + "}");
            }
            VirtualStackPair pair = new VirtualStackPair(virtualNumber, first, second, source);
            pairs.add(pair);
            pairByMember.put(first, pair);
            pairByMember.put(second, pair);
        }

        pairs.sort(Comparator.comparingInt(VirtualStackPair::getVirtualNumber));
        return new SynthesisResult(pairs, pairByMember, unmatched);
    }

    /**
     * 收集持久化配对记录
     * 1. 不对应任何已形成配对的记录 (不相邻、成员缺失或不可配对)：丢弃
     * 2. 同一配对出现多个虚拟堆栈号：取最小者
     * 3. 多个配对记录了同一虚拟堆栈号：较小堆栈号的配对保留，其余改用合成编号
     * 以上情况都记录为拓扑不一致
     *
     * @param members 已形成的配对 (较小堆栈号 -> 较大堆栈号)
     * @return 配对较小堆栈号 -> 虚拟堆栈号，编号互不重复
     */
    private Map<Integer, Integer> collectPersistedPairings(Map<Integer, PhysicalStack> stacksByNumber,
                                                          Map<Integer, Integer> members,
                                                          ResolutionDiagnostics diagnostics) {
        Map<Long, Integer> raw = new TreeMap<>();
        for (PhysicalStack stack : stacksByNumber.values()) {
            PhysicalStack.PersistedPairing pairing = stack.getPersistedPairing();
            if (pairing == null || pairing.getPartnerNumber() == null) {
                continue;
            }
            int self = stack.getStackNumber();
            int partner = pairing.getPartnerNumber();
            Integer virtualNumber = pairing.getVirtualNumber();
            if (partner == self || virtualNumber == null || virtualNumber <= 0) {
                diagnostics.recordInconsistency(self, ErrorCodes.PAIRING_NOT_ADJACENT
                        + ": 搭档 " + partner + ", 虚拟堆栈号 " + virtualNumber);
                continue;
            }
            long key = pairKey(Math.min(self, partner), Math.max(self, partner));
            Integer existing = raw.get(key);
            if (existing != null && !existing.equals(virtualNumber)) {
                diagnostics.recordInconsistency(Math.min(self, partner), ErrorCodes.PAIRING_CONFLICT
                        + ": 同一配对记录了虚拟堆栈号 " + existing + " 与 " + virtualNumber + "，取较小者");
                raw.put(key, Math.min(existing, virtualNumber));
            } else {
                raw.put(key, virtualNumber);
            }
        }

        List<Map.Entry<Long, Integer>> candidates = new ArrayList<>();
        for (Map.Entry<Long, Integer> entry : raw.entrySet()) {
            int first = firstOf(entry.getKey());
            int second = secondOf(entry.getKey());
            Integer formedPartner = members.get(first);
            if (formedPartner == null || formedPartner != second) {
                diagnostics.recordInconsistency(first, ErrorCodes.PAIRING_NOT_ADJACENT
                        + ": {" + first + ", " + second + "} -> " + entry.getValue());
                continue;
            }
            candidates.add(entry);
        }
        candidates.sort(Map.Entry.<Long, Integer>comparingByValue().thenComparing(Map.Entry.<Long, Integer>comparingByKey()));

        Map<Integer, Integer> accepted = new LinkedHashMap<>();
        Map<Integer, Integer> ownerOfNumber = new HashMap<>();
        for (Map.Entry<Long, Integer> candidate : candidates) {
            int first = firstOf(candidate.getKey());
            Integer owner = ownerOfNumber.get(candidate.getValue());
            if (owner != null) {
                diagnostics.recordInconsistency(first, ErrorCodes.DUPLICATE_VIRTUAL_NUMBER
                        + ": " + candidate.getValue() + " 已属于配对 {" + owner + ", " + members.get(owner)
                        + "}，配对 {" + first + ", " + secondOf(candidate.getKey()) + "} 改用合成编号");
                continue;
            }
            ownerOfNumber.put(candidate.getValue(), first);
            accepted.put(first, candidate.getValue());
        }
        return accepted;
    }

    private static int maxOf(Set<Integer> numbers) {
        int max = 0;
        for (Integer number : numbers) {
            max = Math.max(max, number);
        }
        return max;
    }

    private static long pairKey(int first, int second) {
        return ((long) first << 32) | (second & 0xFFFFFFFFL);
    }

    private static int firstOf(long key) {
        return (int) (key >> 32);
    }

    private static int secondOf(long key) {
        return (int) key;
    }
}
