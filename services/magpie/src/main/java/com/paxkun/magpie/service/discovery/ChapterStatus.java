package com.paxkun.magpie.service.discovery;

public enum ChapterStatus {
    DISCOVERED,
    FAILED
}
