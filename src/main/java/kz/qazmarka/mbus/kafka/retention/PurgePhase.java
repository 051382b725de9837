package kz.qazmarka.mbus.kafka.retention;

import kz.qazmarka.mbus.error.ErrorKind;

/**
 * Фазы очистки темы через переключение retention.
 *
 * Фазы различаются видом ошибки при исчерпании повторов: вызывающий код может отличить
 * «очистка не применилась» от «очистка применилась, но retention не восстановлен».
 */
public enum PurgePhase {
    /** retention.ms = 1: брокер удаляет сегменты при ближайшем проходе. */
    MINIMAL_RETENTION("установка минимального retention", ErrorKind.OPERATION_FAILED),
    /** retention.ms = baseline. */
    RESTORE_RETENTION("восстановление retention", ErrorKind.CONFIG_ERROR);

    private final String description;
    private final ErrorKind failureKind;

    PurgePhase(String description, ErrorKind failureKind) {
        this.description = description;
        this.failureKind = failureKind;
    }

    public String description() {
        return description;
    }

    public ErrorKind failureKind() {
        return failureKind;
    }
}
