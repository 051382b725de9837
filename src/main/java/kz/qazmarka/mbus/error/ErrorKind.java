package kz.qazmarka.mbus.error;

/**
 * Фиксированная таксономия ошибок message bus.
 *
 * Каждый вид несёт стабильный код в стиле errno, чтобы вызывающий код мог логировать/сравнивать
 * числовые классы ошибок без разбора текста.
 */
public enum ErrorKind {
    /** Неизвестный вид клиента, недопустимый ключ конфигурации, неполный набор параметров. */
    INVALID_ARGUMENT("EINVAL"),
    /** Отсутствует тема или обязательная запись конфигурации клиента. */
    NOT_FOUND("ENOENT"),
    /** Ошибка задачи AdminClient, alter/describe конфигов или чтения метаданных. */
    OPERATION_FAILED("ERR_OP_FAILED"),
    /** Исчерпан бюджет подтверждения либо не доставлено сообщение. */
    TIMEOUT("ETIMEDOUT"),
    /** Исчерпан бюджет подтверждения числа партиций. */
    LIMIT_EXCEEDED("E2BIG"),
    /** Клиент с указанным id не инициализирован. */
    SERVICE_NOT_INITIALIZED("ERR_SERVICE_NOT_INITIALIZED"),
    /** Кластер Kafka недоступен целиком. */
    SERVICE_UNAVAILABLE("ERR_SERVICE_UNAVAILABLE"),
    /** У темы нет обязательного конфига (retention.ms) при инициализации продьюсера. */
    CONFIG_MISSING("ENOKEY"),
    /** Не удалось вернуть конфигурацию темы (вторая фаза purge). */
    CONFIG_ERROR("ENOKEY"),
    /** Ожидание прервано извне. */
    INTERRUPTED("EINTR");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
