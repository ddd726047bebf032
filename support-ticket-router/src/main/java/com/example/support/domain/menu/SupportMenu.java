package com.example.support.domain.menu;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Immutable FAQ menu. Nodes are addressed by a dot-separated path of child codes, the empty path
 * being the root.
 */
public final class SupportMenu {

    public static final String PATH_SEPARATOR = ".";

    private final SubmenuNode root;

    public SupportMenu(SubmenuNode root) {
        this.root = root;
    }

    public SubmenuNode root() {
        return root;
    }

    public Optional<MenuNode> find(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.of(root);
        }
        MenuNode current = root;
        for (String code : path.split("\\.")) {
            if (!(current instanceof SubmenuNode submenu)) {
                return Optional.empty();
            }
            current = submenu.children().get(code);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public static String parentOf(String path) {
        if (path == null || !path.contains(PATH_SEPARATOR)) {
            return "";
        }
        List<String> parts = new ArrayList<>(Arrays.asList(path.split("\\.")));
        parts.remove(parts.size() - 1);
        return String.join(PATH_SEPARATOR, parts);
    }

    public static String childOf(String path, String code) {
        return path == null || path.isEmpty() ? code : path + PATH_SEPARATOR + code;
    }
}
