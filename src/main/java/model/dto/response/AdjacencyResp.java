package model.dto.response;

import lombok.Data;

/**
 * 堆栈拓扑查询响应
 */
@Data
public class AdjacencyResp {
    private int stackNumber;
    private boolean special;
    private Integer partnerNumber;   // 无搭档时为空
    private Integer virtualNumber;   // 按拓扑合成的虚拟堆栈号，无搭档时为空
}
