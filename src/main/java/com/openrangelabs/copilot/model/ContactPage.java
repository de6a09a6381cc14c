package com.openrangelabs.copilot.model;

import java.util.List;
import java.util.Map;

/**
 * One page of marketing contacts plus the total the remote reports.
 */
public record ContactPage(List<Map<String, Object>> records, long total) {

    public ContactPage {
        records = List.copyOf(records);
    }
}
