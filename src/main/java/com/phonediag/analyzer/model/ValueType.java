package com.phonediag.analyzer.model;

public enum ValueType {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TEXT,
    ABSENT
}
