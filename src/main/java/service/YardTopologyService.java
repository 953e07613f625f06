package service;

import model.bo.PlacementCheckResult;
import model.bo.YardResolution;
import model.dto.request.PlacementCheckReq;
import model.dto.request.YardSnapshotReq;
import model.dto.response.AdjacencyResp;
import model.dto.response.LocationParseResp;

import java.util.List;

/**
 * 堆场拓扑服务接口
 * 负责把宿主应用提交的快照交给解析引擎，并把诊断写入诊断日志
 */
public interface YardTopologyService {

    /**
     * 全量解析一份堆场快照
     * @param req 堆栈 + 集装箱快照
     * @return 逻辑存储单元及诊断
     */
    YardResolution resolve(YardSnapshotReq req);

    /**
     * 查询堆栈的40尺拓扑搭档
     */
    AdjacencyResp adjacentOf(int stackNumber);

    /**
     * 解析箱位编码 (失败不抛异常)
     */
    LocationParseResp parseLocation(String code);

    /**
     * 生成规范箱位编码
     */
    String formatLocation(int stackNumber, int row, int tier);

    /**
     * 校验箱位能否放入指定尺寸的集装箱
     */
    PlacementCheckResult validatePlacement(PlacementCheckReq req);

    /**
     * 枚举某个存储单元的全部箱位编码
     * @param virtual 为空时优先匹配虚拟堆栈，其次物理堆栈
     */
    List<String> locationCodesOf(YardSnapshotReq req, int unitNumber, Boolean virtual);
}
