package controller;

import common.Result;
import lombok.extern.slf4j.Slf4j;
import model.bo.PlacementCheckResult;
import model.bo.YardResolution;
import model.dto.request.PlacementCheckReq;
import model.dto.request.YardSnapshotReq;
import model.dto.response.LocationParseResp;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.YardTopologyService;

import java.util.List;

/**
 * 堆场拓扑与箱位解析接口
 * 无状态：每次请求携带完整快照并从头计算
 */
@RestController
@RequestMapping("/yard")
@Slf4j
public class YardTopologyController {

    private final YardTopologyService yardTopologyService;

    public YardTopologyController(YardTopologyService yardTopologyService) {
        this.yardTopologyService = yardTopologyService;
    }

    /**
     * 全量解析堆场快照
     */
    @PostMapping("/resolve")
    public Result resolve(@RequestBody YardSnapshotReq request) {
        log.info("收到堆场解析请求, ID: {}", request.getReqId());
        YardResolution resolution = yardTopologyService.resolve(request);
        return Result.success("解析成功", resolution);
    }

    /**
     * 查询堆栈的40尺搭档
     */
    @GetMapping("/topology/adjacent/{stackNumber}")
    public Result adjacent(@PathVariable("stackNumber") int stackNumber) {
        return Result.success("查询成功", yardTopologyService.adjacentOf(stackNumber));
    }

    /**
     * 解析箱位编码
     */
    @GetMapping("/location/parse")
    public Result parseLocation(@RequestParam("code") String code) {
        LocationParseResp resp = yardTopologyService.parseLocation(code);
        if (!resp.isValid()) {
            return new Result(400, resp.getError(), resp);
        }
        return Result.success("解析成功", resp);
    }

    /**
     * 生成规范箱位编码
     */
    @GetMapping("/location/format")
    public Result formatLocation(@RequestParam("stack") int stack,
                                 @RequestParam("row") int row,
                                 @RequestParam("tier") int tier) {
        return Result.success("生成成功", yardTopologyService.formatLocation(stack, row, tier));
    }

    /**
     * 放箱校验
     */
    @PostMapping("/placement/validate")
    public Result validatePlacement(@RequestBody PlacementCheckReq request) {
        PlacementCheckResult result = yardTopologyService.validatePlacement(request);
        return Result.success(result.getMessage(), result);
    }

    /**
     * 枚举存储单元的所有箱位编码
     */
    @PostMapping("/units/{unitNumber}/locations")
    public Result unitLocations(@PathVariable("unitNumber") int unitNumber,
                                @RequestParam(name = "virtual", required = false) Boolean virtual,
                                @RequestBody YardSnapshotReq request) {
        List<String> codes = yardTopologyService.locationCodesOf(request, unitNumber, virtual);
        return Result.success("查询成功", codes);
    }
}
