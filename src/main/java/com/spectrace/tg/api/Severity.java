package com.spectrace.tg.api;

public enum Severity {
    ERROR, WARNING, INFO
}
