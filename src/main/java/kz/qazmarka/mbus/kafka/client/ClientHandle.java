package kz.qazmarka.mbus.kafka.client;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import kz.qazmarka.mbus.ClientKind;

/**
 * Открытое соединение клиента Kafka, идентифицируемое парой (вид, id).
 *
 * Экземпляр не потокобезопасен в части использования соединения: один id не должен обслуживаться
 * из двух потоков одновременно.
 */
public abstract class ClientHandle {

    private final ClientKind kind;
    private final String id;
    private final AtomicBoolean open = new AtomicBoolean(true);

    ClientHandle(ClientKind kind, String id) {
        this.kind = kind;
        this.id = id;
    }

    public final ClientKind kind() {
        return kind;
    }

    public final String id() {
        return id;
    }

    /** {@code false} после {@link #close(Duration)}; закрытый дескриптор пересоздаётся при повторном init. */
    public final boolean isOpen() {
        return open.get();
    }

    /** Закрывает соединение; безопасен к повторным вызовам. */
    final void close(Duration timeout) {
        if (open.compareAndSet(true, false)) {
            closeConnection(timeout);
        }
    }

    abstract void closeConnection(Duration timeout);

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{' + kind + ':' + id + (isOpen() ? "" : ", closed") + '}';
    }
}
