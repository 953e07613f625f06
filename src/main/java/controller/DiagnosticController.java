package controller;

import common.Result;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.impl.DiagnosticLog;

import java.util.List;

/**
 * 解析诊断查询接口
 */
@RestController
@RequestMapping("/yard/diagnostics")
public class DiagnosticController {

    private final DiagnosticLog diagnosticLog;

    public DiagnosticController(DiagnosticLog diagnosticLog) {
        this.diagnosticLog = diagnosticLog;
    }

    /**
     * 查询指定时间戳之后的诊断
     */
    @GetMapping
    public Result listDiagnostics(@RequestParam(name = "since", defaultValue = "0") long since) {
        List<DiagnosticLog.DiagnosticLogEntry> entries = diagnosticLog.listSince(since);
        return Result.success("查询成功", entries);
    }

    @GetMapping("/all")
    public Result listAll() {
        return Result.success("查询成功", diagnosticLog.listAll());
    }

    @DeleteMapping
    public Result clear() {
        diagnosticLog.clear();
        return Result.success();
    }
}
