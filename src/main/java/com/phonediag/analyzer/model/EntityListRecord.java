package com.phonediag.analyzer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 实体列表型类别：进程统计、应用使用时长、按应用的耗电归因；内存类别也用它（应用列表始终为空）。
 * 实体按在原文中出现的顺序保存。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EntityListRecord implements CategoryRecord {

    private final DiagCategory category;
    private final FieldRecord fields;
    private final List<EntityRecord> entities;

    private EntityListRecord(DiagCategory category, FieldRecord fields, List<EntityRecord> entities) {
        this.category = category;
        this.fields = fields;
        this.entities = entities;
    }

    public static Builder builder(DiagCategory category) {
        return new Builder(category);
    }

    public Optional<EntityRecord> find(String key) {
        return entities.stream().filter(e -> e.getKey().equals(key)).findFirst();
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty() && entities.isEmpty();
    }

    /**
     * 行解析状态机的载体：同一时刻最多一个“打开”的实体。
     * 新实体打开时，上一个实体自动关闭并追加到列表；build() 时把仍然打开的实体补进去。
     */
    public static final class Builder {

        private final DiagCategory category;
        private final FieldRecord.Builder fields = FieldRecord.builder();
        private final List<EntityRecord> closed = new ArrayList<>();

        private String openKey;
        private FieldRecord.Builder openAttributes;
        private FieldRecord.Builder openStats;

        private Builder(DiagCategory category) {
            this.category = category;
        }

        public FieldRecord.Builder fields() {
            return fields;
        }

        public ParseState state() {
            return openKey == null ? ParseState.NO_ENTITY : ParseState.ENTITY_OPEN;
        }

        public FieldRecord.Builder openEntity(String key) {
            closeEntity();
            openKey = key;
            openAttributes = FieldRecord.builder();
            openStats = FieldRecord.builder();
            return openAttributes;
        }

        /** 当前打开实体的统计项；没有打开的实体时返回 null */
        public FieldRecord.Builder stats() {
            return openStats;
        }

        public void closeEntity() {
            if (openKey == null) {
                return;
            }
            closed.add(EntityRecord.builder()
                    .key(openKey)
                    .attributes(openAttributes.build())
                    .stats(openStats.build())
                    .build());
            openKey = null;
            openAttributes = null;
            openStats = null;
        }

        /** 已关闭的实体，不含当前打开的那个 */
        public List<EntityRecord> closedEntities() {
            return Collections.unmodifiableList(closed);
        }

        public EntityListRecord build() {
            closeEntity();
            return new EntityListRecord(category, fields.build(), List.copyOf(closed));
        }
    }
}
