package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Presentation grouping of automation jobs
 */
@Getter
@RequiredArgsConstructor
public enum JobCategory {

    NOTIFICATIONS("notifications", "Notifications"),
    SHIFTS("shifts", "Shifts"),
    INVOICES("invoices", "Invoices"),
    ALERTS("alerts", "Alerts"),
    REPORTS("reports", "Reports"),
    SYSTEM("system", "System");

    private final String code;
    private final String displayName;

    public static JobCategory fromCode(String code) {
        for (var category : values()) {
            if (category.getCode().equals(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown job category code: " + code);
    }
}
