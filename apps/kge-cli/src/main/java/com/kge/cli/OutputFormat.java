package com.kge.cli;

public enum OutputFormat {
    TEXT,
    JSON
}
