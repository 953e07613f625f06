package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 集装箱实体
 * 由外部系统提供，解析器只读
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Container {
    private String containerId;   // 箱号
    private String sizeClass;     // 尺寸 (20ft/40ft)
    private String status;        // 在场状态 (occupied/damaged/maintenance)
    private String locationCode;  // 箱位编码 S<堆栈>R<排>H<层>

    private List<String> damage = new ArrayList<>(); // 残损记录，非空即视为残损

    public Container(String containerId, String sizeClass, String status, String locationCode) {
        this.containerId = containerId;
        this.sizeClass = sizeClass;
        this.status = status;
        this.locationCode = locationCode;
    }
}
