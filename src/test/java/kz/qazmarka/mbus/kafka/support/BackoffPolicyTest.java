package kz.qazmarka.mbus.kafka.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    @Test
    @DisplayName("Задержка растёт линейно: 1, 2, 3 шага")
    void linear() {
        BackoffPolicy policy = new BackoffPolicy(1000L);
        assertEquals(1000L, policy.delayMillis(1));
        assertEquals(2000L, policy.delayMillis(2));
        assertEquals(3000L, policy.delayMillis(3));
        assertEquals(1000L, policy.delayMillis(0), "номер попытки меньше 1 трактуется как первая попытка");
    }

    @Test
    @DisplayName("Нулевой шаг даёт нулевую задержку")
    void zeroStep() {
        assertEquals(0L, new BackoffPolicy(0L).delayMillis(7));
    }

    @Test
    @DisplayName("Отрицательный шаг отклоняется")
    void rejectsNegativeStep() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(-1L));
    }
}
