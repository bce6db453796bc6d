package com.example.menuparser.util.menu.dto;

import lombok.Value;

/**
 * 阶段边界处的进度快照，供展示层使用
 */
@Value
public class ProgressSnapshot {

    ProcessingPhase phase;

    /** 0 - 100 */
    int percent;

    String message;
}
