package service.support;

import common.consts.DiagnosticTypeEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次解析的诊断收集器
 * 所有数据问题都记录在这里，不中断整个堆场的解析
 */
@Slf4j
public class ResolutionDiagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    /**
     * 箱位编码解析失败
     */
    public void recordParseError(String containerId, String message) {
        log.debug("箱位解析失败 [{}]: {}", containerId, message);
        entries.add(new Diagnostic(DiagnosticTypeEnum.PARSE_ERROR, null, containerId, message));
    }

    /**
     * 配对记录冲突 / 配对几何不一致
     */
    public void recordInconsistency(Integer stackNumber, String message) {
        log.warn("拓扑不一致 [堆栈 {}]: {}", stackNumber, message);
        entries.add(new Diagnostic(DiagnosticTypeEnum.TOPOLOGY_INCONSISTENCY, stackNumber, null, message));
    }

    /**
     * 配置缺口 (搭档缺失、箱型不符等)
     */
    public void recordConfigurationGap(Integer stackNumber, String containerId, String message) {
        log.warn("配置缺口 [堆栈 {}, 箱 {}]: {}", stackNumber, containerId, message);
        entries.add(new Diagnostic(DiagnosticTypeEnum.CONFIGURATION_GAP, stackNumber, containerId, message));
    }

    public void recordOverCapacity(int unitNumber, String message) {
        log.warn("超容量 [单元 {}]: {}", unitNumber, message);
        entries.add(new Diagnostic(DiagnosticTypeEnum.OVER_CAPACITY, unitNumber, null, message));
    }

    public List<Diagnostic> list() {
        return Collections.unmodifiableList(entries);
    }

    public long count(DiagnosticTypeEnum type) {
        return entries.stream().filter(d -> d.getType() == type).count();
    }
}
