package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.ExtractionResult;

import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * 一个诊断类别的抽取器。只依赖当前文件的文本，不看同目录下的其它文件。
 * 实现不能向外抛异常：读文件或解析失败都体现在 ExtractionResult 里。
 */
public interface CategoryExtractor {

    DiagCategory category();

    /**
     * 解析一段已经读入的文本。
     *
     * @param sourceName 用于日志和失败记录的来源名（通常是文件名）
     */
    ExtractionResult extract(String sourceName, String text);

    /** 读取并解析一个文件 */
    ExtractionResult extract(Path file, Charset charset);
}
