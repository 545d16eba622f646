package com.phonediag.analyzer.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * 一次抽取的结果：总是带一个记录（可能是部分或空记录），失败时另外带失败原因。
 * 调用方自己决定记日志还是继续。
 */
@Getter
@ToString
public final class ExtractionResult {

    private final CategoryRecord record;
    private final ExtractionFailure failure;

    private ExtractionResult(CategoryRecord record, ExtractionFailure failure) {
        this.record = record;
        this.failure = failure;
    }

    public static ExtractionResult ok(CategoryRecord record) {
        return new ExtractionResult(record, null);
    }

    public static ExtractionResult failed(CategoryRecord partial, ExtractionFailure failure) {
        return new ExtractionResult(partial, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<ExtractionFailure> failure() {
        return Optional.ofNullable(failure);
    }
}
