package dev.transput.engine;

public enum TransputEvent {
    LINE_END,
    PAGE_END,
    FORMAT_END,
    FORMAT_ERROR,
    VALUE_ERROR,
    FILE_END
}
