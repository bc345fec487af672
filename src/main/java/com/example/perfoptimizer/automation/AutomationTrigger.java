package com.example.perfoptimizer.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationTrigger {

    private TriggerType type;

    /** Metric name for threshold, anomaly type for anomaly. */
    private String metric;

    private Condition condition;

    /** Threshold number, anomaly severity, or hourly/daily/weekly for schedule triggers. */
    private String value;

    /** Minutes a threshold must hold before the rule fires. */
    private Integer duration;
}
