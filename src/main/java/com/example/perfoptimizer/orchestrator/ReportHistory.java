package com.example.perfoptimizer.orchestrator;

import com.example.perfoptimizer.config.OptimizerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory history of optimization reports. The oldest report is evicted once
 * the capacity is reached; reads return copies.
 */
@Component
public class ReportHistory {

    private final Deque<OptimizationReport> reports = new ArrayDeque<>();
    private int capacity;

    public ReportHistory(OptimizerProperties properties) {
        this.capacity = Math.max(1, properties.getHistorySize());
    }

    public synchronized void append(OptimizationReport report) {
        reports.addLast(report);
        trim();
    }

    /**
     * Up to {@code limit} most recent reports, oldest first.
     */
    public synchronized List<OptimizationReport> latest(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<OptimizationReport> result = new ArrayList<>(Math.min(limit, reports.size()));
        Iterator<OptimizationReport> newestFirst = reports.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(0, newestFirst.next());
        }
        return result;
    }

    public synchronized void resize(int newCapacity) {
        if (newCapacity < 1) {
            throw new IllegalArgumentException("History size must be positive: " + newCapacity);
        }
        capacity = newCapacity;
        trim();
    }

    public synchronized int size() {
        return reports.size();
    }

    public synchronized int getCapacity() {
        return capacity;
    }

    private void trim() {
        while (reports.size() > capacity) {
            reports.removeFirst();
        }
    }
}
