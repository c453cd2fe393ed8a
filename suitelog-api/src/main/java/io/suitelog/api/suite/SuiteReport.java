package io.suitelog.api.suite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All suites found in one log, keyed by name in first-seen order.
 */
public final class SuiteReport {

    private final Map<String, SuiteOutcome> suites;

    public SuiteReport(Map<String, SuiteOutcome> suites) {
        this.suites = Collections.unmodifiableMap(new LinkedHashMap<>(suites));
    }

    public static SuiteReport empty() {
        return new SuiteReport(Map.of());
    }

    public List<SuiteOutcome> suites() {
        return new ArrayList<>(suites.values());
    }

    public Optional<SuiteOutcome> suite(String name) {
        return Optional.ofNullable(suites.get(name));
    }

    public Map<String, SuiteOutcome> asMap() {
        return suites;
    }

    public boolean isEmpty() {
        return suites.isEmpty();
    }

    public int size() {
        return suites.size();
    }

    public long count(SuiteStatus status) {
        return suites.values().stream().filter(s -> s.status() == status).count();
    }

    @Override
    public String toString() {
        return "SuiteReport" + suites.keySet();
    }
}
