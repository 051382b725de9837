package kz.qazmarka.mbus.kafka.support;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Общий примитив подтверждения для всех мутаций: опрашивает состояние брокера, пока предикат не выполнится
 * или не исчерпается бюджет повторов.
 *
 * Первая проверка выполняется сразу; после неудачной проверки номер {@code n} поток спит
 * {@link BackoffPolicy#delayMillis(int) delayMillis(n)} и проверяет снова. Всего выполняется не более
 * {@code maxRetries + 1} проверок, после чего бросается {@link MessageBusException} указанного вида
 * с последним наблюдённым состоянием.
 *
 * Перед каждой проверкой вызывается {@code beforeAttempt}: через него прокидывается асинхронный сигнал
 * о недоступности кластера, который прерывает цикл независимо от оставшегося бюджета.
 */
public final class RetryPoller {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPoller.class);

    private final BackoffPolicy policy;
    private final Sleeper sleeper;
    private final Runnable beforeAttempt;

    public RetryPoller(BackoffPolicy policy, Sleeper sleeper) {
        this(policy, sleeper, () -> { });
    }

    public RetryPoller(BackoffPolicy policy, Sleeper sleeper, Runnable beforeAttempt) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.beforeAttempt = Objects.requireNonNull(beforeAttempt, "beforeAttempt");
    }

    /**
     * Ждёт, пока {@code done} не признает очередное наблюдение {@code probe} успешным.
     *
     * @param what        описание ожидания для логов и текста ошибки
     * @param probe       чтение текущего состояния; ошибки чтения пробрасываются без повторов
     * @param done        условие сходимости
     * @param maxRetries  число повторов после первой проверки
     * @param failureKind вид ошибки при исчерпании бюджета
     * @return наблюдение, удовлетворившее условию
     */
    public <T> T await(String what,
                       Supplier<T> probe,
                       Predicate<? super T> done,
                       int maxRetries,
                       ErrorKind failureKind) {
        T last = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            beforeAttempt.run();
            last = probe.get();
            if (done.test(last)) {
                if (attempt > 1 && LOG.isDebugEnabled()) {
                    LOG.debug("{}: подтверждено с попытки {}", what, attempt);
                }
                return last;
            }
            if (attempt > maxRetries) {
                break;
            }
            long delayMs = policy.delayMillis(attempt);
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: не подтверждено (попытка {}/{}, состояние={}); повтор через {} мс",
                        what, attempt, maxRetries + 1, describe(last), delayMs);
            }
            pause(what, delayMs);
        }
        LOG.error("{}: бюджет повторов исчерпан после {} попыток; последнее состояние={}",
                what, maxRetries + 1, describe(last));
        if (last instanceof Throwable) {
            throw new MessageBusException(failureKind, "{}: не подтверждено после {} попыток; последнее состояние={}",
                    what, maxRetries + 1, describe(last), last);
        }
        throw new MessageBusException(failureKind, "{}: не подтверждено после {} попыток; последнее состояние={}",
                what, maxRetries + 1, describe(last));
    }

    /** Условие без наблюдаемого значения. */
    public void await(String what, Supplier<Boolean> condition, int maxRetries, ErrorKind failureKind) {
        await(what, condition, Boolean.TRUE::equals, maxRetries, failureKind);
    }

    private void pause(String what, long delayMs) {
        if (delayMs <= 0L) {
            return;
        }
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("{}: ожидание прервано", what);
            throw new MessageBusException(ErrorKind.INTERRUPTED, "{}: ожидание подтверждения прервано", what, ie);
        }
    }

    private static String describe(Object state) {
        if (state instanceof Throwable) {
            Throwable t = (Throwable) state;
            String msg = t.getMessage();
            return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
        }
        return String.valueOf(state);
    }
}
