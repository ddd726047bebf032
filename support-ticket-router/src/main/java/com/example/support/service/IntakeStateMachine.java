package com.example.support.service;

import com.example.support.config.SupportProperties;
import com.example.support.domain.Account;
import com.example.support.domain.ConversationState;
import com.example.support.domain.ConversationStep;
import com.example.support.domain.IntakeCategory;
import com.example.support.domain.OrderSummary;
import com.example.support.service.exception.InvalidFormatException;
import com.example.support.transport.ContactInfo;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.SupportTransport;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks a conversation through identity, category, order and description until a ticket can be
 * created.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntakeStateMachine {

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
    private static final String LATEST_ORDER_MARKER = "Последний заказ";
    private static final String ORDER_MARKER = "Заказ №";
    private static final String NUMBER_SIGN = "№";

    private final ConversationStateStore stateStore;
    private final UserDirectoryService userDirectory;
    private final OrderRepository orderRepository;
    private final TicketRouter ticketRouter;
    private final FaqMenuService faqMenu;
    private final SupportTransport transport;
    private final SupportProperties supportProperties;

    public Optional<ConversationState> currentState(String conversationId) {
        return stateStore.find(conversationId);
    }

    public void start(InboundMessage message) {
        String chatId = message.getChatId();
        Optional<Account> account = userDirectory.findByExternalIdentity(chatId);
        if (account.filter(Account::hasPhone).isPresent()) {
            stateStore.save(ConversationState.start(chatId, ConversationStep.CATEGORY_SELECTION));
            transport.sendText(chatId, SupportTexts.GREETING, categoryKeyboard());
        } else {
            stateStore.save(ConversationState.start(chatId, ConversationStep.AWAITING_IDENTITY));
            transport.sendText(chatId, SupportTexts.SHARE_PHONE_PROMPT, contactKeyboard());
        }
    }

    public void acceptContact(InboundMessage message) {
        String chatId = message.getChatId();
        ContactInfo contact = message.getContact();
        if (contact.ownerId() == null || !contact.ownerId().equals(message.getSenderId())) {
            log.info("Conversation {} shared a contact that is not their own", chatId);
            stateStore.clear(chatId);
            transport.sendText(chatId, SupportTexts.FOREIGN_CONTACT, MessageOptions.NONE);
            return;
        }

        Optional<Account> account;
        try {
            account = userDirectory.findByPhone(contact.phone());
        } catch (InvalidFormatException ex) {
            log.info("Conversation {} shared a malformed phone {}", chatId, UserDirectoryService.redact(contact.phone()));
            stateStore.clear(chatId);
            transport.sendText(chatId, SupportTexts.INVALID_PHONE, MessageOptions.NONE);
            return;
        }

        if (account.isPresent()) {
            log.info("Contact {} of {} matches account {}", UserDirectoryService.redact(contact.phone()), chatId,
                    account.get().getId());
            userDirectory.linkExternalIdentity(account.get().getId(), chatId);
        } else {
            log.info("Contact {} of {} matches no account", UserDirectoryService.redact(contact.phone()), chatId);
        }
        stateStore.save(ConversationState.start(chatId, ConversationStep.CATEGORY_SELECTION));
        transport.sendText(chatId, SupportTexts.GREETING, categoryKeyboard());
    }

    public void remindIdentity(InboundMessage message) {
        transport.sendText(message.getChatId(), SupportTexts.SHARE_PHONE_PROMPT, contactKeyboard());
    }

    public void selectCategory(InboundMessage message, ConversationState state) {
        String chatId = message.getChatId();
        String text = message.getText();
        if (SupportTexts.FAQ_LABEL.equals(text)) {
            faqMenu.open(chatId);
            return;
        }
        if (SupportTexts.BACK_TO_CATEGORIES.equals(text)) {
            transport.sendText(chatId, SupportTexts.CHOOSE_CATEGORY, categoryKeyboard());
            return;
        }
        Optional<IntakeCategory> category = IntakeCategory.fromLabel(text);
        if (category.isEmpty()) {
            transport.sendText(chatId, SupportTexts.UNKNOWN_CHOICE, categoryKeyboard());
            return;
        }

        IntakeCategory selected = category.get();
        state.setCategory(selected.getTitle());
        if (!selected.isOrderContextRequired()) {
            moveToDescription(state, SupportTexts.DESCRIBE_PROBLEM);
            return;
        }

        Optional<Account> account = userDirectory.findByExternalIdentity(chatId);
        if (account.isEmpty()) {
            moveToDescription(state, SupportTexts.noAccountForCategory(selected.getTitle()));
            return;
        }
        List<OrderSummary> orders = orderRepository.findRecentOrders(
                account.get().getId(), supportProperties.getIntake().getRecentOrderLimit());
        Map<String, String> labels = orderLabels(orders);
        state.setOrderLabels(labels);
        state.setStep(ConversationStep.ORDER_SELECTION);
        stateStore.save(state);
        transport.sendText(chatId, SupportTexts.selectOrder(selected.getTitle(), !labels.isEmpty()),
                orderKeyboard(labels));
    }

    public void selectOrder(InboundMessage message, ConversationState state) {
        String chatId = message.getChatId();
        String text = message.getText();
        if (IntakeCategory.OTHER.getLabel().equals(text)) {
            moveToDescription(state, SupportTexts.DESCRIBE_PROBLEM);
            return;
        }
        if (SupportTexts.BACK_TO_CATEGORIES.equals(text)) {
            state.setStep(ConversationStep.CATEGORY_SELECTION);
            state.setOrderLabels(new LinkedHashMap<>());
            stateStore.save(state);
            transport.sendText(chatId, SupportTexts.CHOOSE_CATEGORY, categoryKeyboard());
            return;
        }
        if (text == null || !(text.contains(LATEST_ORDER_MARKER) || text.contains(ORDER_MARKER))) {
            transport.sendText(chatId, SupportTexts.UNKNOWN_CHOICE, orderKeyboard(state.getOrderLabels()));
            return;
        }

        Optional<String> orderNumber = Optional.ofNullable(state.getOrderLabels().get(text))
                .or(() -> parseOrderNumber(text));
        if (orderNumber.isEmpty()) {
            transport.sendText(chatId, SupportTexts.ORDER_NOT_RECOGNIZED, orderKeyboard(state.getOrderLabels()));
            return;
        }
        state.setOrderNumber(orderNumber.get());
        moveToDescription(state, SupportTexts.DESCRIBE_PROBLEM);
    }

    public void submitDescription(InboundMessage message, ConversationState state) {
        String chatId = message.getChatId();
        String description = Optional.ofNullable(message.textOrCaption()).orElse(SupportTexts.NO_TEXT);
        Account account = userDirectory.findByExternalIdentity(chatId).orElse(null);
        ticketRouter.createTicket(TicketRequest.builder()
                .message(message)
                .account(account)
                .category(state.getCategory())
                .orderNumber(state.getOrderNumber())
                .description(description)
                .build());
        stateStore.clear(chatId);
    }

    private void moveToDescription(ConversationState state, String prompt) {
        if (state.getOrderNumber() == null) {
            state.setOrderNumber(SupportTexts.ORDER_NOT_SPECIFIED);
        }
        state.setStep(ConversationStep.DESCRIPTION_ENTRY);
        stateStore.save(state);
        transport.sendText(state.getConversationId(), prompt, MessageOptions.removingKeyboard());
    }

    /**
     * Button label to order number, newest first. The first order of the list is labelled as the
     * latest one; orders without a creation time get no button.
     */
    static Map<String, String> orderLabels(List<OrderSummary> orders) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < orders.size(); i++) {
            OrderSummary order = orders.get(i);
            if (order.getCreatedAt() == null) {
                continue;
            }
            String when = ORDER_DATE.format(order.getCreatedAt());
            String label = i == 0
                    ? "Последний заказ от " + when
                    : "Заказ №%s от %s".formatted(order.getOrderNumber(), when);
            labels.put(label, order.getOrderNumber());
        }
        return labels;
    }

    /**
     * Reads the first token after the number sign.
     */
    static Optional<String> parseOrderNumber(String text) {
        int sign = text.indexOf(NUMBER_SIGN);
        if (sign < 0) {
            return Optional.empty();
        }
        String rest = text.substring(sign + NUMBER_SIGN.length()).trim();
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(rest.split("\\s+")[0]);
    }

    static MessageOptions categoryKeyboard() {
        return MessageOptions.builder()
                .keyboardRow(List.of(IntakeCategory.ORDER_PROBLEM.getLabel(), IntakeCategory.DELIVERY_PROBLEM.getLabel()))
                .keyboardRow(List.of(IntakeCategory.OTHER.getLabel()))
                .keyboardRow(List.of(SupportTexts.FAQ_LABEL))
                .build();
    }

    static MessageOptions orderKeyboard(Map<String, String> labels) {
        MessageOptions.MessageOptionsBuilder builder = MessageOptions.builder();
        labels.keySet().forEach(label -> builder.keyboardRow(List.of(label)));
        return builder
                .keyboardRow(List.of(IntakeCategory.OTHER.getLabel()))
                .keyboardRow(List.of(SupportTexts.BACK_TO_CATEGORIES))
                .build();
    }

    static MessageOptions contactKeyboard() {
        return MessageOptions.builder()
                .keyboardRow(List.of(SupportTexts.SHARE_PHONE_BUTTON))
                .requestContact(true)
                .build();
    }
}
