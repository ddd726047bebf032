package com.example.support.service;

import com.example.support.config.SupportProperties;
import com.example.support.domain.menu.AnswerNode;
import com.example.support.domain.menu.FileNode;
import com.example.support.domain.menu.LinkNode;
import com.example.support.domain.menu.MenuNode;
import com.example.support.domain.menu.SubjectNode;
import com.example.support.domain.menu.SubmenuNode;
import com.example.support.domain.menu.SupportMenu;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads the FAQ menu once at startup.
 *
 * <p>Each JSON object with a {@code label} is a button. Its kind follows from its keys, checked in
 * this order: {@code link}, {@code file}, a nested labelled object (submenu), {@code subject},
 * {@code answer}. A submenu with {@code "menumode": "row"} lays its buttons out in one row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MenuCatalog {

    static final int TEXT_LIMIT = 4096;
    static final String EMPTY_ANSWER = "👀";

    private final SupportProperties supportProperties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private SupportMenu menu;

    @PostConstruct
    void load() {
        Resource resource = resourceLoader.getResource(supportProperties.getIntake().getMenuLocation());
        try (InputStream in = resource.getInputStream()) {
            menu = parse(objectMapper.readTree(in));
            log.info("Loaded FAQ menu with {} top-level items from {}", menu.root().children().size(),
                    supportProperties.getIntake().getMenuLocation());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read FAQ menu from " + supportProperties.getIntake().getMenuLocation(), ex);
        }
    }

    public SupportMenu menu() {
        return menu;
    }

    public static SupportMenu parse(JsonNode root) {
        return new SupportMenu(submenu("", root));
    }

    private static SubmenuNode submenu(String label, JsonNode node) {
        Map<String, MenuNode> children = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isButton(field.getValue())) {
                children.put(field.getKey(), node(field.getKey(), field.getValue()));
            }
        }
        return new SubmenuNode(label, answer(node, false), "row".equals(node.path("menumode").asText()), children);
    }

    private static MenuNode node(String code, JsonNode node) {
        String label = node.get("label").asText();
        if (node.has("link")) {
            return new LinkNode(label, node.get("link").asText());
        }
        if (node.has("file")) {
            return new FileNode(label, node.get("file").asText(), answer(node, true));
        }
        if (hasButtonChild(node)) {
            return submenu(label, node);
        }
        if (node.has("subject")) {
            return new SubjectNode(label, node.get("subject").asText(), answer(node, true));
        }
        if (node.has("answer")) {
            return new AnswerNode(label, answer(node, false));
        }
        throw new IllegalStateException("Menu item '%s' has no recognizable action".formatted(code));
    }

    private static boolean isButton(JsonNode node) {
        return node.isObject() && node.has("label");
    }

    private static boolean hasButtonChild(JsonNode node) {
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            if (isButton(values.next())) {
                return true;
            }
        }
        return false;
    }

    private static String answer(JsonNode node, boolean emptyAllowed) {
        String answer = node.path("answer").asText("");
        if (answer.length() > TEXT_LIMIT) {
            answer = answer.substring(0, TEXT_LIMIT);
        }
        return answer.isEmpty() && !emptyAllowed ? EMPTY_ANSWER : answer;
    }
}
