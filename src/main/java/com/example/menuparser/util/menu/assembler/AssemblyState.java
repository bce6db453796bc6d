package com.example.menuparser.util.menu.assembler;

/**
 * Phase 3 状态机
 *
 * ASSEMBLE → ASSESS_BOOTSTRAP →(不足) FALLBACK → REPROCESS → CONVERGE →(仍在改善且未到上限) ASSESS_BOOTSTRAP
 * 满足要求、收敛、达到迭代上限或质量回退时 → VALIDATE → DEDUP → DONE
 */
public enum AssemblyState {
    ASSEMBLE,
    ASSESS_BOOTSTRAP,
    FALLBACK,
    REPROCESS,
    CONVERGE,
    VALIDATE,
    DEDUP,
    DONE
}
