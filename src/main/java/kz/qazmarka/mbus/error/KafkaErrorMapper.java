package kz.qazmarka.mbus.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.errors.WakeupException;

/**
 * Переводит ошибки клиентов Kafka в таксономию {@link ErrorKind}.
 *
 * Обёртки {@link ExecutionException}/{@link CompletionException} разворачиваются до исходной причины;
 * всё, что не распознано явно, получает вид, переданный вызывающим кодом.
 */
public final class KafkaErrorMapper {

    static final String UNKNOWN = "-";

    private KafkaErrorMapper() {
    }

    /**
     * Определяет вид ошибки по исключению клиента Kafka.
     *
     * @param error    исключение (может быть обёрткой future)
     * @param fallback вид для нераспознанных ошибок
     */
    public static ErrorKind kindOf(Throwable error, ErrorKind fallback) {
        Throwable cause = unwrap(error);
        if (cause instanceof MessageBusException) {
            return ((MessageBusException) cause).kind();
        }
        if (cause instanceof UnknownTopicOrPartitionException) {
            return ErrorKind.NOT_FOUND;
        }
        if (cause instanceof org.apache.kafka.common.errors.TimeoutException
                || cause instanceof java.util.concurrent.TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof InterruptedException
                || cause instanceof InterruptException
                || cause instanceof WakeupException) {
            return ErrorKind.INTERRUPTED;
        }
        // прочие KafkaException (InvalidPartitions, TopicExists, PolicyViolation и т.п.) и всё остальное
        return fallback;
    }

    /**
     * Заворачивает ошибку клиента в {@link MessageBusException} с контекстом операции и ресурса.
     * Для прерываний восстанавливает флаг interrupt текущего потока.
     */
    public static MessageBusException wrap(String operation,
                                           String resource,
                                           Throwable error,
                                           ErrorKind fallback) {
        Throwable cause = unwrap(error);
        if (cause instanceof MessageBusException) {
            return (MessageBusException) cause;
        }
        ErrorKind kind = kindOf(cause, fallback);
        if (kind == ErrorKind.INTERRUPTED && cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return new MessageBusException(kind, "{} для '{}' завершилась ошибкой: {}",
                safe(operation), safe(resource), describe(cause), cause);
    }

    /** Снимает обёртки future'ов и возвращает исходную причину. */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** Короткое описание причины вида {@code Type: message}. */
    public static String describe(Throwable error) {
        if (error == null) {
            return "неизвестная причина";
        }
        String type = error.getClass().getSimpleName();
        String msg = error.getMessage();
        if (msg == null || msg.isEmpty()) {
            return type;
        }
        return type + ": " + msg;
    }

    private static String safe(String value) {
        return (value == null || value.isEmpty()) ? UNKNOWN : value;
    }
}
