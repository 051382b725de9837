package kz.qazmarka.mbus.kafka.topic;

import java.util.Collection;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Проверка имён типов сообщений (Kafka-тем) до обращения к брокеру.
 */
public final class TopicNameValidator {

    /** Предел длины имени темы в Kafka. */
    public static final int MAX_LENGTH = 249;

    private TopicNameValidator() {
    }

    /**
     * Допускаются латиница, цифры и {@code ._-}; имена "." и ".." запрещены.
     */
    public static boolean isValid(String topic) {
        if (topic == null) {
            return false;
        }
        int len = topic.length();
        if (len == 0 || len > MAX_LENGTH) {
            return false;
        }
        if (".".equals(topic) || "..".equals(topic)) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            if (!isAllowedTopicChar(topic.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT} для первого недопустимого имени
     */
    public static void requireValid(Collection<String> topics) {
        if (topics == null || topics.isEmpty()) {
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Не задан ни один тип сообщений");
        }
        for (String topic : topics) {
            requireValid(topic);
        }
    }

    public static void requireValid(String topic) {
        if (!isValid(topic)) {
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                    "Недопустимое имя типа сообщений '{}': разрешены [a-zA-Z0-9._-], длина 1..{}", topic, MAX_LENGTH);
        }
    }

    private static boolean isAllowedTopicChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || (ch >= '0' && ch <= '9')
                || ch == '.'
                || ch == '-'
                || ch == '_';
    }
}
