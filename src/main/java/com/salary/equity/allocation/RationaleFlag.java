package com.salary.equity.allocation;

public enum RationaleFlag {
    BELOW_MEDIAN,
    HIGH_PERFORMER
}
