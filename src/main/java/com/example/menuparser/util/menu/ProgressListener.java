package com.example.menuparser.util.menu;

import com.example.menuparser.util.menu.dto.ProgressSnapshot;

/**
 * 阶段进度回调
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressSnapshot snapshot);
}
