package com.example.menuparser.util.menu;

import com.example.menuparser.util.menu.dto.BootstrapSummary;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.ParseLogEntry;
import com.example.menuparser.util.menu.dto.ProgressSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次解析的完整输出
 */
@Value
@Builder
public class MenuParseResult {

    String sessionId;

    /** 最终菜品列表：区域记录（页面/阅读顺序）在前，兜底记录（行顺序）在后 */
    List<MenuItem> items;

    BootstrapSummary bootstrap;

    List<ParseLogEntry> log;

    List<ProgressSnapshot> progress;

    int pageCount;

    int tokenCount;

    /** Phase 1 候选区域数 */
    int regionCount;

    /** Phase 2 通过的区域数 */
    int acceptedRegionCount;

    long elapsedMillis;
}
