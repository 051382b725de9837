package kz.qazmarka.mbus.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MessageBusExceptionTest {

    @Test
    @DisplayName("Сообщение форматируется по плейсхолдерам SLF4J и несёт префикс вида")
    void formatsMessage() {
        MessageBusException ex = new MessageBusException(ErrorKind.TIMEOUT,
                "Превышено {} попыток для '{}'", 16, "orders");

        assertEquals("[TIMEOUT/ETIMEDOUT] Превышено 16 попыток для 'orders'", ex.getMessage());
        assertEquals("ETIMEDOUT", ex.code());
        assertTrue(ex.is(ErrorKind.TIMEOUT));
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Лишний последний аргумент-исключение становится причиной")
    void trailingThrowableIsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        MessageBusException ex = new MessageBusException(ErrorKind.OPERATION_FAILED, "Сбой '{}'", "orders", cause);

        assertSame(cause, ex.getCause());
        assertEquals("[OPERATION_FAILED/ERR_OP_FAILED] Сбой 'orders'", ex.getMessage());
    }

    @Test
    @DisplayName("Ошибки конфигурации используют errno ENOKEY")
    void configKindsShareCode() {
        assertEquals("ENOKEY", ErrorKind.CONFIG_MISSING.code());
        assertEquals("ENOKEY", ErrorKind.CONFIG_ERROR.code());
        assertEquals("E2BIG", ErrorKind.LIMIT_EXCEEDED.code());
    }
}
