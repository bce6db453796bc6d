package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.dto.BootstrapSummary;
import com.example.menuparser.util.menu.dto.MenuItem;

import java.util.Collections;
import java.util.List;

/**
 * Phase 3 产物
 */
public class AssemblyOutcome {

    private final List<MenuItem> items;
    private final BootstrapSummary summary;

    public AssemblyOutcome(List<MenuItem> items, BootstrapSummary summary) {
        this.items = Collections.unmodifiableList(items);
        this.summary = summary;
    }

    public List<MenuItem> getItems() {
        return items;
    }

    public BootstrapSummary getSummary() {
        return summary;
    }
}
