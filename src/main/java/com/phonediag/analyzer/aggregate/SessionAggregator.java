package com.phonediag.analyzer.aggregate;

import com.phonediag.analyzer.extractor.CategoryExtractor;
import com.phonediag.analyzer.extractor.ExtractorRegistry;
import com.phonediag.analyzer.model.ExtractionFailure;
import com.phonediag.analyzer.model.ExtractionResult;
import com.phonediag.analyzer.model.ExtractionStage;
import com.phonediag.analyzer.model.SessionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 扫描根目录：每个子目录是一次采集会话，目录里按固定文件名找到对应的抽取器逐个解析。
 * 单线程顺序执行，一个文件解析完再处理下一个。
 */
@Component
@Slf4j
public class SessionAggregator {

    private final ExtractorRegistry registry;
    private final Charset charset;

    public SessionAggregator(ExtractorRegistry registry,
                             @Value("${phonediag.file-charset:UTF-8}") Charset charset) {
        this.registry = registry;
        this.charset = charset;
    }

    /**
     * 根目录不存在或不可读时记一条警告并返回空列表，不抛异常。
     */
    public List<SessionRecord> parseAll(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            log.warn("Logs directory '{}' not found", root);
            return List.of();
        }

        List<Path> sessionDirs;
        try (Stream<Path> children = Files.list(root)) {
            sessionDirs = children
                    .filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to list logs directory '{}': {}", root, e.toString());
            return List.of();
        }
        log.info("Found {} diagnostic sessions under {}", sessionDirs.size(), root);

        List<SessionRecord> sessions = new ArrayList<>();
        for (Path dir : sessionDirs) {
            sessions.add(parseSession(dir));
        }
        log.info("Parsed {} sessions", sessions.size());
        return sessions;
    }

    public SessionRecord parseSession(Path sessionDir) {
        String sessionId = sessionDir.getFileName().toString();
        log.debug("Parsing session: {}", sessionId);

        SessionRecord.SessionRecordBuilder builder = SessionRecord.builder()
                .sessionId(sessionId)
                .timestamp(SessionTimestampParser.parse(sessionId).orElse(null));

        List<Path> files;
        try (Stream<Path> children = Files.list(sessionDir)) {
            files = children
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to list session directory '{}': {}", sessionDir, e.toString());
            return builder.failure(ExtractionFailure.builder()
                            .fileName(sessionId)
                            .stage(ExtractionStage.READ)
                            .message(e.getClass().getSimpleName() + ": " + e.getMessage())
                            .build())
                    .build();
        }

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            Optional<CategoryExtractor> extractor = registry.forFileName(fileName);
            if (extractor.isEmpty()) {
                log.debug("Ignore unrecognized file {}/{}", sessionId, fileName);
                continue;
            }

            ExtractionResult result = extractor.get().extract(file, charset);
            result.failure().ifPresent(builder::failure);

            // 读失败登记空记录，解析失败保留已经抽出来的部分；两种情况都算作处理过的文件
            builder.category(extractor.get().category(), result.getRecord());
            builder.fileParsed(fileName);
        }

        return builder.build();
    }
}
