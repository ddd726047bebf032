package com.example.support.dispatch;

import com.example.support.domain.ConversationState;
import com.example.support.service.ClosureSurveyService;
import com.example.support.service.FaqMenuService;
import com.example.support.service.IntakeStateMachine;
import com.example.support.service.TicketRouter;
import com.example.support.transport.ChoiceEvent;
import com.example.support.transport.EventOrigin;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.SupportEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Component;

/**
 * Entry point for every inbound event. Classifies the event and hands it to the matching handler
 * through the interceptor chain.
 */
@Slf4j
@Component
public class SupportEventDispatcher {

    static final String START_COMMAND = "/start";
    static final String CLOSE_COMMAND = "/close";

    private final List<DispatchInterceptor> interceptors;
    private final IntakeStateMachine intake;
    private final TicketRouter ticketRouter;
    private final ClosureSurveyService surveyService;
    private final FaqMenuService faqMenu;

    public SupportEventDispatcher(
            List<DispatchInterceptor> interceptors,
            IntakeStateMachine intake,
            TicketRouter ticketRouter,
            ClosureSurveyService surveyService,
            FaqMenuService faqMenu) {
        List<DispatchInterceptor> ordered = new ArrayList<>(interceptors);
        AnnotationAwareOrderComparator.sort(ordered);
        this.interceptors = List.copyOf(ordered);
        this.intake = intake;
        this.ticketRouter = ticketRouter;
        this.surveyService = surveyService;
        this.faqMenu = faqMenu;
    }

    public void dispatch(SupportEvent event) {
        chainFrom(0).proceed(event);
    }

    private DispatchChain chainFrom(int index) {
        if (index >= interceptors.size()) {
            return this::route;
        }
        DispatchInterceptor interceptor = interceptors.get(index);
        DispatchChain next = chainFrom(index + 1);
        return event -> interceptor.intercept(event, next);
    }

    void route(SupportEvent event) {
        if (event instanceof ChoiceEvent choice) {
            routeChoice(choice);
        } else if (event instanceof InboundMessage message) {
            if (message.getOrigin() == EventOrigin.STAFF) {
                routeStaffMessage(message);
            } else {
                routeUserMessage(message);
            }
        } else {
            log.warn("Unsupported event type {}", event.getClass().getName());
        }
    }

    private void routeUserMessage(InboundMessage message) {
        if (message.isCommand(START_COMMAND)) {
            intake.start(message);
            return;
        }
        if (message.hasContact()) {
            intake.acceptContact(message);
            return;
        }
        Optional<ConversationState> state = intake.currentState(message.getChatId());
        if (state.isEmpty()) {
            ticketRouter.forwardFromUser(message);
            return;
        }
        switch (state.get().getStep()) {
            case CATEGORY_SELECTION -> intake.selectCategory(message, state.get());
            case ORDER_SELECTION -> intake.selectOrder(message, state.get());
            case DESCRIPTION_ENTRY -> intake.submitDescription(message, state.get());
            case AWAITING_IDENTITY -> intake.remindIdentity(message);
        }
    }

    private void routeStaffMessage(InboundMessage message) {
        if (message.isCommand(CLOSE_COMMAND)) {
            ticketRouter.closeFromThread(message);
        } else if (message.getThreadId() != null) {
            ticketRouter.forwardFromStaff(message);
        }
    }

    private void routeChoice(ChoiceEvent choice) {
        if (ClosureSurveyService.accepts(choice.getPayload())) {
            surveyService.handleChoice(choice);
        } else if (FaqMenuService.accepts(choice.getPayload())) {
            faqMenu.handleChoice(choice);
        } else {
            log.warn("Unrecognized choice payload {} from {}", choice.getPayload(), choice.getChatId());
        }
    }
}
