package com.phonediag.analyzer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 只有扁平字段的类别：电池快照、设备信息、电源状态。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FlatRecord implements CategoryRecord {

    private final DiagCategory category;
    private final FieldRecord fields;

    public FlatRecord(DiagCategory category, FieldRecord fields) {
        this.category = category;
        this.fields = fields == null ? FieldRecord.empty() : fields;
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
