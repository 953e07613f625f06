package service.impl;

import common.consts.DiagnosticTypeEnum;
import lombok.Data;
import model.bo.Diagnostic;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 解析诊断日志 (最近 N 条)
 * 汇总每次解析产生的诊断以及接口异常，供外部查询数据质量问题
 */
@Component
public class DiagnosticLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<DiagnosticLogEntry> buffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录一次解析产生的全部诊断
     */
    public synchronized void recordResolution(String reqId, List<Diagnostic> diagnostics) {
        long now = System.currentTimeMillis();
        for (Diagnostic diagnostic : diagnostics) {
            DiagnosticLogEntry entry = new DiagnosticLogEntry();
            entry.setReqId(reqId);
            entry.setType(diagnostic.getType());
            entry.setStackNumber(diagnostic.getStackNumber());
            entry.setContainerId(diagnostic.getContainerId());
            entry.setMessage(diagnostic.getMessage());
            entry.setTimestamp(now);
            entry.setRecordedAt(LocalDateTime.now());
            addEntry(entry);
        }
    }

    /**
     * 记录接口异常
     */
    public synchronized void recordError(String message, Throwable cause) {
        DiagnosticLogEntry entry = new DiagnosticLogEntry();
        entry.setType(DiagnosticTypeEnum.SYSTEM_ERROR);
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setTimestamp(System.currentTimeMillis());
        entry.setRecordedAt(LocalDateTime.now());
        addEntry(entry);
    }

    private void addEntry(DiagnosticLogEntry entry) {
        if (buffer.size() >= DEFAULT_CAPACITY) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 查询指定时间戳 (毫秒) 之后的记录
     */
    public synchronized List<DiagnosticLogEntry> listSince(long sinceTimestamp) {
        List<DiagnosticLogEntry> result = new ArrayList<>();
        for (DiagnosticLogEntry entry : buffer) {
            if (entry.getTimestamp() >= sinceTimestamp) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized List<DiagnosticLogEntry> listAll() {
        return new ArrayList<>(buffer);
    }

    public synchronized void clear() {
        buffer.clear();
    }

    /**
     * 诊断日志条目
     */
    @Data
    public static class DiagnosticLogEntry {
        private String reqId;
        private DiagnosticTypeEnum type;
        private Integer stackNumber;
        private String containerId;
        private String message;
        private String cause;
        private long timestamp;
        private LocalDateTime recordedAt;
    }
}
