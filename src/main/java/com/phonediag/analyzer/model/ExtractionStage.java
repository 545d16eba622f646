package com.phonediag.analyzer.model;

public enum ExtractionStage {
    READ,
    PARSE
}
