package com.localbrowser.record;

public enum RecordType {
    FILE,
    SEQUENCE,
    FOLDER
}
