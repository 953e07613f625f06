package model.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 堆场物理堆栈
 * 由堆场配置创建，解析器只读
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhysicalStack {
    private Integer stackNumber;      // 堆栈号 (同一堆场内唯一)
    private String sectionId;         // 所属区段

    // 几何配置
    private Integer rows;             // 排数
    private Integer maxTiers;         // 统一最大层高
    private List<RowTierConfig> rowTierOverrides = new ArrayList<>(); // 按排覆盖的层高 (可选)

    private Integer declaredCapacity; // 声明容量 (可能为空或0)
    private String sizeClass;         // 声明箱型 20ft / 40ft

    @JsonAlias("isSpecial")
    private boolean special;          // 特殊堆栈，永不参与40尺配对
    @JsonAlias("isActive")
    private boolean active = true;    // 是否启用

    private PersistedPairing persistedPairing; // 持久化的配对记录 (可能缺失)

    /**
     * 按排覆盖层高
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RowTierConfig {
        private Integer row;          // 排号 (从1开始)
        private Integer maxTiers;     // 该排最大层高
    }

    /**
     * 持久化的40尺配对记录
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PersistedPairing {
        private Integer partnerNumber; // 搭档堆栈号
        private Integer virtualNumber; // 虚拟堆栈号
    }
}
