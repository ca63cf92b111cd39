package com.agentsubstrate.engine.clarification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Words whose meaning depends on context, with their candidate meanings in the order offered.
 */
public class PolysemyDictionary {

    private static final PolysemyDictionary DEFAULTS;

    static {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        entries.put("run", List.of("execute", "manage", "operate"));
        entries.put("handle", List.of("process", "manage", "grip"));
        entries.put("service", List.of("API service", "customer service", "maintenance"));
        entries.put("table", List.of("database table", "UI table", "data structure"));
        entries.put("model", List.of("data model", "ML model", "business model"));
        DEFAULTS = new PolysemyDictionary(entries);
    }

    private final Map<String, List<String>> entries;

    public PolysemyDictionary(Map<String, List<String>> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static PolysemyDictionary defaults() {
        return DEFAULTS;
    }

    public Map<String, List<String>> entries() {
        return entries;
    }
}
