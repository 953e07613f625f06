package model.dto.request;

import lombok.Data;

/**
 * 放箱校验请求
 */
@Data
public class PlacementCheckReq {

    private String locationCode;    // 目标箱位
    private String sizeClass;       // 待放集装箱尺寸

    private YardSnapshotReq snapshot; // 当前堆场快照
}
