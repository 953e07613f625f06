package service.impl;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import common.util.LocationCodeUtil;
import engine.YardResolutionEngine;
import lombok.extern.slf4j.Slf4j;
import model.bo.LocationCoordinate;
import model.bo.LocationParseResult;
import model.bo.LogicalStorageUnit;
import model.bo.PlacementCheckResult;
import model.bo.YardResolution;
import model.dto.request.PlacementCheckReq;
import model.dto.request.YardSnapshotReq;
import model.dto.response.AdjacencyResp;
import model.dto.response.LocationParseResp;
import model.entity.PhysicalStack;
import org.springframework.stereotype.Service;
import service.YardTopologyService;
import service.placement.PlacementValidator;
import service.topology.StackTopologyResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class YardTopologyServiceImpl implements YardTopologyService {

    private final YardResolutionEngine engine;
    private final DiagnosticLog diagnosticLog;
    private final PlacementValidator placementValidator;

    public YardTopologyServiceImpl(YardResolutionEngine engine, DiagnosticLog diagnosticLog) {
        this.engine = engine;
        this.diagnosticLog = diagnosticLog;
        this.placementValidator = new PlacementValidator(engine.getTopology(), engine.getCapacityCalculator());
    }

    @Override
    public YardResolution resolve(YardSnapshotReq req) {
        if (req == null) {
            throw new BusinessException(ErrorCodes.EMPTY_SNAPSHOT);
        }
        long start = System.currentTimeMillis();
        YardResolution resolution = engine.resolve(req.getStacks(), req.getContainers());
        diagnosticLog.recordResolution(req.getReqId(), resolution.getDiagnostics());

        log.info("快照 [{}] 解析耗时 {}ms, 总容量 {}, 总占用 {}", req.getReqId(),
                System.currentTimeMillis() - start,
                resolution.getSummary().getTotalCapacity(),
                resolution.getSummary().getTotalOccupancy());
        return resolution;
    }

    @Override
    public AdjacencyResp adjacentOf(int stackNumber) {
        StackTopologyResolver topology = engine.getTopology();
        AdjacencyResp resp = new AdjacencyResp();
        resp.setStackNumber(stackNumber);
        resp.setSpecial(topology.isSpecial(stackNumber));
        Integer partner = topology.adjacentOf(stackNumber);
        resp.setPartnerNumber(partner);
        if (partner != null) {
            resp.setVirtualNumber(topology.virtualNumberOf(stackNumber, partner));
        }
        return resp;
    }

    @Override
    public LocationParseResp parseLocation(String code) {
        LocationParseResult result = LocationCodeUtil.parse(code);
        LocationParseResp resp = new LocationParseResp();
        resp.setCode(code);
        resp.setValid(result.isSuccess());
        if (result.isSuccess()) {
            LocationCoordinate coordinate = result.getCoordinate();
            resp.setStackNumber(coordinate.getStackNumber());
            resp.setRow(coordinate.getRow());
            resp.setTier(coordinate.getTier());
            resp.setCanonicalCode(formatLocation(coordinate.getStackNumber(), coordinate.getRow(), coordinate.getTier()));
        } else {
            resp.setError(result.getError());
        }
        return resp;
    }

    @Override
    public String formatLocation(int stackNumber, int row, int tier) {
        return LocationCodeUtil.format(stackNumber, row, tier, engine.getTopology().getSettings().getStackPadding());
    }

    @Override
    public PlacementCheckResult validatePlacement(PlacementCheckReq req) {
        if (req == null || req.getSnapshot() == null) {
            throw new BusinessException(ErrorCodes.EMPTY_SNAPSHOT);
        }
        YardResolution resolution = resolve(req.getSnapshot());
        PlacementCheckResult result = placementValidator.validate(resolution, indexStacks(req.getSnapshot().getStacks()),
                req.getLocationCode(), req.getSizeClass());
        log.info("放箱校验 [{} / {}]: {}", req.getLocationCode(), req.getSizeClass(), result.getCode());
        return result;
    }

    @Override
    public List<String> locationCodesOf(YardSnapshotReq req, int unitNumber, Boolean virtual) {
        YardResolution resolution = resolve(req);
        LogicalStorageUnit unit;
        if (virtual == null) {
            // 编号同时属于虚拟堆栈与物理堆栈时优先虚拟堆栈
            unit = resolution.findVirtualUnit(unitNumber);
            if (unit == null) {
                unit = resolution.findPhysicalUnit(unitNumber);
            }
        } else {
            unit = virtual ? resolution.findVirtualUnit(unitNumber) : resolution.findPhysicalUnit(unitNumber);
        }
        if (unit == null) {
            throw new BusinessException("存储单元不存在: " + unitNumber);
        }
        List<PhysicalStack> stacks = req.getStacks() == null ? new ArrayList<>() : req.getStacks();
        return engine.locationCodesOf(unit, stacks);
    }

    private Map<Integer, PhysicalStack> indexStacks(List<PhysicalStack> stacks) {
        Map<Integer, PhysicalStack> result = new LinkedHashMap<>();
        if (stacks == null) {
            return result;
        }
        for (PhysicalStack stack : stacks) {
            if (stack != null && stack.getStackNumber() != null) {
                result.putIfAbsent(stack.getStackNumber(), stack);
            }
        }
        return result;
    }
}
