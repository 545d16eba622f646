package com.phonediag.analyzer.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个文件解析失败的原因：哪个文件、哪个阶段、什么错误。
 */
@Getter
@Builder
@ToString
public class ExtractionFailure {
    private final String fileName;
    private final DiagCategory category;
    private final ExtractionStage stage;
    private final String message;
}
