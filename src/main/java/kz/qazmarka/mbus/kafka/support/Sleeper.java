package kz.qazmarka.mbus.kafka.support;

/**
 * Точка ожидания между попытками; в тестах подменяется, чтобы не спать реально.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
