package com.example.support.service;

import com.example.support.domain.ConversationState;
import com.example.support.domain.ConversationStep;
import com.example.support.domain.menu.AnswerNode;
import com.example.support.domain.menu.FileNode;
import com.example.support.domain.menu.LinkNode;
import com.example.support.domain.menu.MenuNode;
import com.example.support.domain.menu.SubjectNode;
import com.example.support.domain.menu.SubmenuNode;
import com.example.support.domain.menu.SupportMenu;
import com.example.support.transport.ChoiceButton;
import com.example.support.transport.ChoiceEvent;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.SupportTransport;
import com.example.support.transport.TransportBadRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Renders the FAQ menu as inline buttons and reacts to presses. Button payloads are
 * {@code menu:<path>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaqMenuService {

    public static final String MENU_PREFIX = "menu:";

    private static final String HOME_LABEL = "🏠";
    private static final String BACK_LABEL = "←";

    private final MenuCatalog menuCatalog;
    private final SupportTransport transport;
    private final ConversationStateStore stateStore;

    public static boolean accepts(String payload) {
        return payload != null && payload.startsWith(MENU_PREFIX);
    }

    public void open(String chatId) {
        SubmenuNode root = menuCatalog.menu().root();
        transport.sendText(chatId, root.answer(), keyboard(root, ""));
    }

    public void handleChoice(ChoiceEvent event) {
        String path = event.getPayload().substring(MENU_PREFIX.length());
        Optional<MenuNode> found = menuCatalog.menu().find(path);
        if (found.isEmpty()) {
            log.warn("Unknown menu path '{}' pressed by {}", path, event.getChatId());
            showSubmenu(event, menuCatalog.menu().root(), "");
            return;
        }
        MenuNode node = found.get();
        if (node instanceof SubmenuNode submenu) {
            showSubmenu(event, submenu, path);
        } else if (node instanceof AnswerNode answer) {
            transport.sendText(event.getChatId(), answer.answer(), MessageOptions.NONE);
        } else if (node instanceof FileNode file) {
            transport.sendText(event.getChatId(), file.caption(),
                    MessageOptions.builder().attachment(file.file()).build());
        } else if (node instanceof SubjectNode subject) {
            chooseSubject(event, subject);
        } else if (node instanceof LinkNode) {
            log.debug("Link button {} opens on the client side", path);
        }
    }

    private void chooseSubject(ChoiceEvent event, SubjectNode subject) {
        ConversationState state = ConversationState.start(event.getChatId(), ConversationStep.DESCRIPTION_ENTRY);
        state.setCategory(subject.subject());
        state.setOrderNumber(SupportTexts.ORDER_NOT_SPECIFIED);
        stateStore.save(state);
        String text = StringUtils.hasText(subject.answer())
                ? subject.answer()
                : "Пожалуйста, напишите Ваш вопрос по теме «%s»".formatted(subject.label());
        transport.sendText(event.getChatId(), text, MessageOptions.removingKeyboard());
    }

    private void showSubmenu(ChoiceEvent event, SubmenuNode submenu, String path) {
        MessageOptions options = keyboard(submenu, path);
        try {
            transport.editText(event.getChatId(), event.getMessageId(), submenu.answer(), options);
        } catch (TransportBadRequestException ex) {
            transport.sendText(event.getChatId(), submenu.answer(), options);
        }
    }

    static MessageOptions keyboard(SubmenuNode submenu, String path) {
        MessageOptions.MessageOptionsBuilder builder = MessageOptions.builder();
        List<ChoiceButton> row = new ArrayList<>();
        for (Map.Entry<String, MenuNode> child : submenu.children().entrySet()) {
            MenuNode node = child.getValue();
            ChoiceButton button = node instanceof LinkNode link
                    ? ChoiceButton.link(link.label(), link.url())
                    : ChoiceButton.action(node.label(), MENU_PREFIX + SupportMenu.childOf(path, child.getKey()));
            if (submenu.rowLayout()) {
                row.add(button);
            } else {
                builder.choiceRow(List.of(button));
            }
        }
        if (!row.isEmpty()) {
            builder.choiceRow(row);
        }
        if (StringUtils.hasText(path)) {
            List<ChoiceButton> navigation = new ArrayList<>();
            navigation.add(ChoiceButton.action(HOME_LABEL, MENU_PREFIX));
            if (path.contains(SupportMenu.PATH_SEPARATOR)) {
                navigation.add(ChoiceButton.action(BACK_LABEL, MENU_PREFIX + SupportMenu.parentOf(path)));
            }
            builder.choiceRow(navigation);
        }
        return builder.build();
    }
}
