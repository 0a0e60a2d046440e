package com.unifiedinbox.dto;

public enum FetchMode {
    FULL,
    INCREMENTAL
}
