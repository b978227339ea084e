package com.rico.insurance.enrichment;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the first {@code limit} error messages and counts the rest.
 */
public class ErrorLog {

    private final int limit;
    private final List<String> details = new ArrayList<>();
    private int total;

    public ErrorLog(int limit) {
        this.limit = Math.max(0, limit);
    }

    public void add(String message) {
        total++;
        if (details.size() < limit) {
            details.add(message);
        }
    }

    public List<String> getDetails() {
        return List.copyOf(details);
    }

    public int getTotal() {
        return total;
    }
}
