package com.example.support.domain.menu;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SubmenuNode(String label, String answer, boolean rowLayout, Map<String, MenuNode> children)
        implements MenuNode {

    public SubmenuNode {
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }
}
