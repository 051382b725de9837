package kz.qazmarka.mbus;

import java.util.Locale;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Режим отправки пачки сообщений.
 */
public enum SendMode {
    /** Каждое сообщение подтверждается брокером до отправки следующего. */
    SYNC("sync"),
    /** Сообщения уходят без ожидания очереди; подтверждения собираются в {@link DeliveryReport}. */
    ASYNC("async");

    private final String label;

    SendMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * {@code null} или пустая строка означают {@link #ASYNC}.
     *
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT} для неизвестного режима
     */
    public static SendMode parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return ASYNC;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (SendMode mode : values()) {
            if (mode.label.equals(v)) {
                return mode;
            }
        }
        throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Неизвестный режим отправки '{}'", value);
    }
}
