package kz.qazmarka.mbus;

/**
 * Результат receive: либо одно сообщение, либо «данных нет» за отведённое время.
 * Ошибки получения в результат не попадают и бросаются исключением.
 */
public final class ReceiveResult {

    private static final ReceiveResult EMPTY = new ReceiveResult(null, null, -1, -1L);

    private final byte[] payload;
    private final String messageType;
    private final int partition;
    private final long offset;

    private ReceiveResult(byte[] payload, String messageType, int partition, long offset) {
        this.payload = payload;
        this.messageType = messageType;
        this.partition = partition;
        this.offset = offset;
    }

    public static ReceiveResult empty() {
        return EMPTY;
    }

    public static ReceiveResult data(byte[] payload, String messageType, int partition, long offset) {
        return new ReceiveResult(payload == null ? new byte[0] : payload, messageType, partition, offset);
    }

    public boolean isEmpty() {
        return payload == null;
    }

    public boolean hasData() {
        return payload != null;
    }

    /**
     * Сырые байты сообщения.
     *
     * @throws IllegalStateException для пустого результата
     */
    public byte[] payload() {
        if (payload == null) {
            throw new IllegalStateException("Пустой результат receive не содержит сообщения");
        }
        return payload;
    }

    /** Тип сообщений (тема) полученной записи; {@code null} для пустого результата. */
    public String messageType() {
        return messageType;
    }

    public int partition() {
        return partition;
    }

    public long offset() {
        return offset;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "ReceiveResult{empty}";
        }
        return "ReceiveResult{" + messageType + '-' + partition + '@' + offset + ", bytes=" + payload.length + '}';
    }
}
