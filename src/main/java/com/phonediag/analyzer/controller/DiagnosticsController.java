package com.phonediag.analyzer.controller;

import com.phonediag.analyzer.aggregate.SessionAggregator;
import com.phonediag.analyzer.model.SessionRecord;
import com.phonediag.analyzer.projection.SummaryProjector;
import com.phonediag.analyzer.projection.SummaryTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/diagnostics")
@Slf4j
public class DiagnosticsController {

    private static final String FALLBACK_LOGS_DIR = "logs";

    private final SessionAggregator aggregator;
    private final SummaryProjector projector;

    /** 所有 root 参数都必须落在这个目录之下 */
    private final Path logsDir;

    public DiagnosticsController(SessionAggregator aggregator,
                                 SummaryProjector projector,
                                 @Value("${phonediag.logs-dir:logs}") String logsDir) {
        this.aggregator = aggregator;
        this.projector = projector;
        String dir = logsDir == null || logsDir.isBlank() ? FALLBACK_LOGS_DIR : logsDir.trim();
        this.logsDir = Path.of(dir).toAbsolutePath().normalize();
    }

    /**
     * 解析 root 下所有会话，返回每个会话的完整记录。
     */
    @GetMapping("/sessions")
    public List<SessionRecord> sessions(@RequestParam(value = "root", required = false) String root) {
        Path dir = resolveRoot(root);
        log.info("解析会话目录: {}", dir);
        return aggregator.parseAll(dir);
    }

    /**
     * 解析 root 下所有会话并压平成汇总表。
     */
    @GetMapping("/summary")
    public SummaryTable summary(@RequestParam(value = "root", required = false) String root) {
        Path dir = resolveRoot(root);
        List<SessionRecord> sessions = aggregator.parseAll(dir);
        SummaryTable table = projector.project(sessions);
        log.info("汇总完成: root={}, rows={}", dir, table.size());
        return table;
    }

    /**
     * 相对路径按 logs-dir 解析；规整后跑出 logs-dir 的路径直接拒绝。
     */
    private Path resolveRoot(String root) {
        if (root == null || root.isBlank()) {
            return logsDir;
        }
        Path resolved = logsDir.resolve(root.trim()).toAbsolutePath().normalize();
        if (!resolved.startsWith(logsDir)) {
            log.warn("拒绝 logs-dir 之外的目录: {}", root);
            throw new IllegalArgumentException("root must be inside " + logsDir + ": " + root);
        }
        return resolved;
    }
}
