package kz.qazmarka.mbus;

import java.util.Locale;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Вид клиента message bus: control-plane (admin) или data-plane (producer/consumer).
 */
public enum ClientKind {
    ADMIN("admin"),
    PRODUCER("producer"),
    CONSUMER("consumer");

    private final String label;

    ClientKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Разбирает строковое имя вида клиента.
     *
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT} для неизвестного вида
     */
    public static ClientKind parse(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ClientKind kind : values()) {
                if (kind.label.equals(v)) {
                    return kind;
                }
            }
        }
        throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Неизвестный вид клиента '{}'", value);
    }

    @Override
    public String toString() {
        return label;
    }
}
