package com.phonediag.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 单个诊断文件解析出的类别记录。
 * 所有类别都有一组扁平字段，部分类别另外带有键控集合或实体列表。
 */
public interface CategoryRecord {

    DiagCategory getCategory();

    FieldRecord getFields();

    /** 不带任何字段和子项时视为空记录 */
    @JsonIgnore
    boolean isEmpty();
}
