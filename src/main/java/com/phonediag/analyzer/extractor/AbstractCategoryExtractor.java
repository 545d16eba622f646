package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.ExtractionFailure;
import com.phonediag.analyzer.model.ExtractionResult;
import com.phonediag.analyzer.model.ExtractionStage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 抽取器公共骨架：先建一个草稿（draft），解析过程往草稿里写，最后 build 成记录。
 * 解析中途出错时，已经写进草稿的部分照样 build 出来返回，不会丢。
 *
 * @param <D> 草稿类型
 */
@Slf4j
public abstract class AbstractCategoryExtractor<D> implements CategoryExtractor {

    protected abstract D newDraft();

    protected abstract void parse(String text, D draft);

    protected abstract CategoryRecord build(D draft);

    @Override
    public ExtractionResult extract(String sourceName, String text) {
        D draft = newDraft();
        try {
            parse(text == null ? "" : text, draft);
        } catch (RuntimeException e) {
            log.warn("Error parsing {} as {}: {}", sourceName, category().getKey(), e.toString());
            log.debug("Parse failure detail for {}", sourceName, e);
            return ExtractionResult.failed(build(draft), failure(sourceName, ExtractionStage.PARSE, e));
        }
        return ExtractionResult.ok(build(draft));
    }

    @Override
    public ExtractionResult extract(Path file, Charset charset) {
        String name = String.valueOf(file.getFileName());
        String text;
        try {
            // 按字节读再解码，非法字节替换掉而不是直接失败
            text = new String(Files.readAllBytes(file), charset);
        } catch (IOException | RuntimeException e) {
            log.warn("Error reading {}: {}", file, e.toString());
            return ExtractionResult.failed(build(newDraft()), failure(name, ExtractionStage.READ, e));
        }
        return extract(name, text);
    }

    private ExtractionFailure failure(String sourceName, ExtractionStage stage, Exception e) {
        return ExtractionFailure.builder()
                .fileName(sourceName)
                .category(category())
                .stage(stage)
                .message(e.getClass().getSimpleName() + ": " + e.getMessage())
                .build();
    }
}
