package com.phonediag.analyzer.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 列表型类别中的一个实体（进程 / 应用），以包名为标识。
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public final class EntityRecord {

    /** 包名或进程名 */
    private final String key;

    /** 实体头上的附加信息，例如进程的 user / version */
    @Builder.Default
    private final FieldRecord attributes = FieldRecord.empty();

    /** 统计项 */
    @Builder.Default
    private final FieldRecord stats = FieldRecord.empty();
}
