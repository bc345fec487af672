package com.example.perfoptimizer.health;

import lombok.Value;

@Value
public class AlertCounts {
    int critical;
    int warning;
    int info;

    public static AlertCounts none() {
        return new AlertCounts(0, 0, 0);
    }
}
