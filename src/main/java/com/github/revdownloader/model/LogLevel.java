package com.github.revdownloader.model;

public enum LogLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR,
    DOWNLOAD
}
