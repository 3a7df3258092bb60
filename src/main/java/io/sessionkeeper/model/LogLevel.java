package io.sessionkeeper.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    SUCCESS,
    METRIC
}
