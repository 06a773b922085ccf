package com.loandesk.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.loandesk.model.SystemConfig;
import com.loandesk.repository.SystemConfigRepository;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Typed access to the JSON values of the {@code system_config} table.
 */
@Service
@AllArgsConstructor
@Slf4j
public class SystemConfigService {

    public static final String COMMISSION_SNAPSHOT_DAY = "commission_snapshot_day";
    public static final String KPI_EVALUATION_ENABLED = "kpi_evaluation_enabled";

    public static final int DEFAULT_SNAPSHOT_DAY = 1;
    public static final int MAX_SNAPSHOT_DAY = 28;

    private final SystemConfigRepository systemConfigRepository;

    /**
     * Day of month on which the monthly commission snapshot runs, stored as {@code {"day": n}}.
     * Missing or out-of-range values fall back to {@value #DEFAULT_SNAPSHOT_DAY}.
     */
    public int getCommissionSnapshotDay() {
        JsonNode value = getValue(COMMISSION_SNAPSHOT_DAY);
        if (value == null || !value.path("day").canConvertToInt()) {
            return DEFAULT_SNAPSHOT_DAY;
        }
        int day = value.path("day").asInt();
        if (day < 1 || day > MAX_SNAPSHOT_DAY) {
            log.warn("Ignoring invalid {}={}, using {}", COMMISSION_SNAPSHOT_DAY, day, DEFAULT_SNAPSHOT_DAY);
            return DEFAULT_SNAPSHOT_DAY;
        }
        return day;
    }

    public boolean isKpiEvaluationEnabled() {
        JsonNode value = getValue(KPI_EVALUATION_ENABLED);
        if (value == null || !value.isBoolean()) {
            return true;
        }
        return value.booleanValue();
    }

    private JsonNode getValue(String key) {
        return systemConfigRepository.findById(key)
                .map(SystemConfig::getValue)
                .orElse(null);
    }
}
