package com.example.support.service;

/**
 * Copy shown to users and staff.
 */
public final class SupportTexts {

    public static final String GREETING =
            "Здравствуйте, это служба заботы о клиентах Boon Market. Чтобы мы быстрее помогли, выберите тему обращения.";
    public static final String SHARE_PHONE_PROMPT =
            "Поделитесь номером телефона, чтобы начать работу со службой заботы.";
    public static final String SHARE_PHONE_BUTTON = "Поделиться номером телефона 📲";
    public static final String FOREIGN_CONTACT =
            "Пожалуйста, поделитесь своим номером (нажмите кнопку и выберите 'Поделиться номером телефона').";
    public static final String INVALID_PHONE = "Неверный формат номера телефона. Попробуйте снова.";
    public static final String TEMPORARY_ERROR = "Временная ошибка в системе. Попробуйте позже.";

    public static final String FAQ_LABEL = "Вопросы и ответы";
    public static final String BACK_TO_CATEGORIES = "Назад к категориям";
    public static final String CHOOSE_CATEGORY = "Выберите категорию обращения или FAQ:";
    public static final String UNKNOWN_CHOICE = "Неизвестная команда. Выберите из меню.";
    public static final String FAQ_TITLE = "Часто задаваемые вопросы:";
    public static final String DESCRIBE_PROBLEM =
            "Опишите подробно проблему - мы разберемся и поможем как можно скорее";
    public static final String ORDER_NOT_RECOGNIZED = "Не удалось определить номер заказа. Попробуйте еще раз.";
    public static final String NO_RECENT_ORDERS = "Нет недавних заказов";
    public static final String ORDER_NOT_SPECIFIED = "не указан";
    public static final String NOT_SPECIFIED = "Не указан";
    public static final String NO_TEXT = "Без текста";

    public static final String START_NEW_TICKET =
            "Чтобы создать новое обращение, пожалуйста, нажмите /start и следуйте инструкциям.";
    public static final String THREAD_CREATION_FAILED =
            "Не удалось создать обращение. Пожалуйста, попробуйте еще раз через /start.";
    public static final String TICKET_WITHOUT_THREAD =
            "Ваше обращение найдено, но оно не связано с темой чата. Пожалуйста, создайте новое обращение через /start.";
    public static final String FORWARD_BAD_REQUEST =
            "Не удалось отправить сообщение в тему поддержки. Пожалуйста, создайте новое обращение через /start.";
    public static final String FORWARD_FORBIDDEN = "Бот не может переслать ваше сообщение. Попробуйте позже.";
    public static final String FORWARD_FAILED = "Произошла ошибка при пересылке сообщения. Попробуйте позже.";

    public static final String CLOSE_OUTSIDE_THREAD = "Команда /close должна использоваться внутри темы тикета.";
    public static final String THREAD_WITHOUT_TICKET = "Тикет не найден для этой темы";

    public static final String SURVEY_QUESTION = "Подскажите, пожалуйста, удалось ли решить Ваш вопрос?";
    public static final String SURVEY_RESOLVED = "Да, закрыт";
    public static final String SURVEY_UNRESOLVED = "Нет, не закрыт";
    public static final String ALREADY_HANDLED = "Это обращение уже обработано.";
    public static final String ALREADY_RATED = "Вы уже оценили это обращение.";
    public static final String CONFIRM_BEFORE_RATING = "Сначала ответьте, решён ли ваш вопрос.";
    public static final String TICKET_UNKNOWN = "Тикет не найден";

    private SupportTexts() {}

    public static String selectOrder(String categoryTitle, boolean hasOrders) {
        String text = "Выберите номер заказа, по которому нужна помощь\nВыбрана категория: " + categoryTitle;
        return hasOrders ? text : text + "\n" + NO_RECENT_ORDERS;
    }

    public static String noAccountForCategory(String categoryTitle) {
        return "Вы выбрали %s, но поскольку вы не связаны с аккаунтом Boon Market, у нас нет ваших заказов. "
                .formatted(categoryTitle)
                + DESCRIBE_PROBLEM;
    }

    public static String acknowledgement(long ticketId, boolean staffed) {
        String head = staffed
                ? "Мы получили Ваше обращение №%d, спасибо! Наш оператор уже видит запрос и скоро с Вами свяжется. "
                        + "Пожалуйста, ожидайте ответа - обычно это займет немного времени."
                : "Мы получили Ваше обращение №%d, спасибо! График работы техподдержки: с 08:00 до 23:00. "
                        + "Пожалуйста, ожидайте ответа - мы ответим в рабочее время.";
        return head.formatted(ticketId)
                + "\n\nВы можете продолжить писать сообщения - они будут переданы оператору. "
                + "Когда обращение будет закрыто, вас попросят оценить качество обслуживания.";
    }

    public static String staffDeliveryToBot(String targetId) {
        return "Невозможно отправить сообщение боту %s. Боты не могут общаться друг с другом.".formatted(targetId);
    }

    public static String staffDeliveryBlocked(String targetId) {
        return ("Ответ не удалось отправить пользователю %s (вероятно, заблокировал бота).\n"
                + "Попросите пользователя разблокировать бота.").formatted(targetId);
    }

    public static String staffDeliveryFailed(String targetId) {
        return "Не удалось доставить ответ пользователю %s.".formatted(targetId);
    }

    public static String alreadyClosed(long ticketId) {
        return "Тикет №%d уже закрыт".formatted(ticketId);
    }

    public static String closedWithSurvey(long ticketId) {
        return "Тикет №%d закрыт. Запрос решен ли вопрос отправлен пользователю.".formatted(ticketId);
    }

    public static String surveyDeliveryFailed(String targetId) {
        return "Не удалось отправить запрос оценки пользователю %s".formatted(targetId);
    }

    public static String reopenedByUserMessage(long ticketId) {
        return "🔄 Тикет №%d ПЕРЕОТКРЫТ: пользователь написал новое сообщение.".formatted(ticketId);
    }

    public static String resolvedForUser(long ticketId) {
        return ("Мы рады, что вопрос решен. Обращение №%d закрыто. Спасибо, что обратились!\n"
                + "Пожалуйста, оцените работу службы заботы:").formatted(ticketId);
    }

    public static String anotherTicketActive(long ticketId) {
        return "У вас уже есть открытое обращение №%d. Напишите в него, и мы ответим.".formatted(ticketId);
    }

    public static String resolvedForStaff(long ticketId) {
        return "✅ Тикет №%d закрыт с подтверждением пользователя. Тема форума закрыта.".formatted(ticketId);
    }

    public static String unresolvedForUser(long ticketId, boolean staffed) {
        return staffed
                ? ("Мы оставим обращение №%d открытым. Пожалуйста, уточните, что именно осталось не решенным - "
                        + "оператор скоро с Вами свяжется.").formatted(ticketId)
                : ("Мы оставим обращение №%d открытым. График работы техподдержки: с 08:00 до 23:00. "
                        + "Пожалуйста, уточните, что именно осталось не решенным - мы ответим в рабочее время.")
                        .formatted(ticketId);
    }

    public static String unresolvedForStaff(long ticketId) {
        return "🔄 Тикет №%d ПЕРЕОТКРЫТ: пользователь указал, что вопрос не решен. Ожидается уточнение."
                .formatted(ticketId);
    }

    public static String ratedForUser(int rating) {
        return "Спасибо за оценку %s!\n%s".formatted("⭐".repeat(rating), START_NEW_TICKET);
    }

    public static String ratedForStaff(long ticketId, int rating) {
        return "⭐ Пользователь оценил тикет №%d: %d/5".formatted(ticketId, rating);
    }
}
