package kz.qazmarka.mbus.error;

import java.util.Objects;

import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

/**
 * Структурированная ошибка message bus: вид ошибки из {@link ErrorKind} и сообщение,
 * отформатированное по шаблону SLF4J ({@code {}}-плейсхолдеры).
 *
 * Если последним аргументом передан {@link Throwable} без соответствующего плейсхолдера,
 * он становится причиной исключения (та же семантика, что у SLF4J-логгеров).
 */
public class MessageBusException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public MessageBusException(ErrorKind kind, String template, Object... args) {
        this(kind, MessageFormatter.arrayFormat(template, args));
    }

    private MessageBusException(ErrorKind kind, FormattingTuple formatted) {
        super(prefix(kind) + formatted.getMessage(), formatted.getThrowable());
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Код errno-класса; удобен для логов и внешних интеграций. */
    public String code() {
        return kind.code();
    }

    public boolean is(ErrorKind expected) {
        return kind == expected;
    }

    private static String prefix(ErrorKind kind) {
        Objects.requireNonNull(kind, "kind");
        return "[" + kind.name() + '/' + kind.code() + "] ";
    }
}
