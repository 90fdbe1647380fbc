package com.salary.equity.core.model;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;

/**
 * Band that groups job levels for the uplift table.
 * Levels 1-3 are the core track and 4-6 the senior track; both repeat the same three bands.
 */
public enum LevelTier {
    COMPETENT,
    ADVANCED,
    EXPERT;

    public static LevelTier forLevel(int level) {
        if (level < 1) {
            throw new EquityException(ErrorKind.INVALID_LEVEL, "Level must be positive, got " + level);
        }
        return switch ((level - 1) % 3) {
            case 0 -> COMPETENT;
            case 1 -> ADVANCED;
            default -> EXPERT;
        };
    }
}
