package common.config;

import common.consts.SizeClassEnum;
import lombok.Data;
import model.bo.PairingBand;
import model.bo.TopologySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 堆场拓扑配置
 * 特殊堆栈、配对号段、箱型覆盖统一在这里管理，不在代码各处硬编码。
 *
 * 缺省值对应参考堆场，可以通过 Spring 配置文件覆盖：
 *
 * yard.topology.special-stacks
 * yard.topology.bands[n].start / end / first-numbers
 * yard.topology.size-overrides.[堆栈号]
 * yard.topology.location-stack-padding
 */
@Configuration
@ConfigurationProperties(prefix = "yard.topology")
@Data
public class YardTopologyProperties {

    /**
     * 特殊堆栈号，永不参与40尺配对
     */
    private List<Integer> specialStacks = new ArrayList<>(Arrays.asList(1, 31, 101, 103));

    /**
     * 配对号段
     */
    private List<Band> bands = new ArrayList<>(Arrays.asList(
            new Band(3, 29, null),
            new Band(33, 55, null),
            new Band(61, 99, null)));

    /**
     * 堆栈号 -> 箱型 (20ft/40ft)，覆盖堆栈自身声明
     */
    private Map<Integer, String> sizeOverrides = new HashMap<>();

    /**
     * 格式化箱位编码时堆栈号补零宽度
     */
    private int locationStackPadding = TopologySettings.DEFAULT_STACK_PADDING;

    @Data
    public static class Band {
        private int start;
        private int end;
        private List<Integer> firstNumbers; // 为空时按 start, start+4, ... 推导

        public Band() {
        }

        public Band(int start, int end, List<Integer> firstNumbers) {
            this.start = start;
            this.end = end;
            this.firstNumbers = firstNumbers;
        }
    }

    /**
     * 转换为解析器使用的不可变配置，非法配置直接抛出 BusinessException
     */
    public TopologySettings toSettings() {
        List<PairingBand> pairingBands = new ArrayList<>();
        for (Band band : bands) {
            pairingBands.add(new PairingBand(band.getStart(), band.getEnd(), band.getFirstNumbers()));
        }
        Map<Integer, SizeClassEnum> overrides = new HashMap<>();
        for (Map.Entry<Integer, String> entry : sizeOverrides.entrySet()) {
            SizeClassEnum size = SizeClassEnum.getByCode(entry.getValue());
            if (size != null) {
                overrides.put(entry.getKey(), size);
            }
        }
        return new TopologySettings(new LinkedHashSet<>(specialStacks), pairingBands, overrides, locationStackPadding);
    }
}
