package com.kge.format;

public enum TimeStyle {
    RELATIVE,
    ABSOLUTE
}
