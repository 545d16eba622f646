package com.phonediag.analyzer.model;

/**
 * 行解析状态机的两种状态。
 */
public enum ParseState {
    NO_ENTITY,
    ENTITY_OPEN
}
