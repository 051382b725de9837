package kz.qazmarka.mbus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Описание клиента для {@link MessageBroker#initClient(ClientSpec)}.
 *
 * Поля, специфичные для вида клиента, необязательны на уровне типа: их наличие проверяет реестр клиентов,
 * чтобы сообщить вызывающему коду, какой именно записи не хватает.
 *
 * <ul>
 *   <li>admin: {@code client_id};</li>
 *   <li>producer: {@code client_id}, {@code message_type};</li>
 *   <li>consumer: {@code client_id}, {@code offset}, {@code consumer_group}, {@code message_types}, {@code auto_ack}.</li>
 * </ul>
 */
public final class ClientSpec {

    public static final String CLIENT_ID = "client_id";
    public static final String MESSAGE_TYPE = "message_type";
    public static final String MESSAGE_TYPES = "message_types";
    public static final String CONSUMER_GROUP = "consumer_group";
    public static final String OFFSET = "offset";
    public static final String AUTO_ACK = "auto_ack";

    private final ClientKind kind;
    private final String clientId;
    private final String messageType;
    private final List<String> messageTypes;
    private final String consumerGroup;
    private final String offset;
    private final Boolean autoAck;

    private ClientSpec(Builder b) {
        this.kind = b.kind;
        this.clientId = b.clientId;
        this.messageType = b.messageType;
        this.messageTypes = (b.messageTypes == null)
                ? null
                : Collections.unmodifiableList(new ArrayList<>(b.messageTypes));
        this.consumerGroup = b.consumerGroup;
        this.offset = b.offset;
        this.autoAck = b.autoAck;
    }

    public static Builder builder(ClientKind kind) {
        return new Builder(kind);
    }

    public static ClientSpec admin(String clientId) {
        return builder(ClientKind.ADMIN).clientId(clientId).build();
    }

    public static ClientSpec producer(String clientId, String messageType) {
        return builder(ClientKind.PRODUCER).clientId(clientId).messageType(messageType).build();
    }

    public static ClientSpec consumer(String clientId,
                                      String consumerGroup,
                                      Collection<String> messageTypes,
                                      boolean autoAck,
                                      String offset) {
        return builder(ClientKind.CONSUMER)
                .clientId(clientId)
                .consumerGroup(consumerGroup)
                .messageTypes(messageTypes)
                .autoAck(autoAck)
                .offset(offset)
                .build();
    }

    /**
     * Собирает описание из строкового вида клиента и плоской карты параметров
     * ({@code client_id}, {@code message_type}, {@code message_types}, {@code consumer_group}, {@code offset},
     * {@code auto_ack}).
     *
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT} для неизвестного вида клиента
     */
    public static ClientSpec fromMap(String kind, Map<String, ?> conf) {
        ClientKind k = ClientKind.parse(kind);
        Map<String, ?> c = (conf == null) ? Collections.<String, Object>emptyMap() : conf;
        Builder b = builder(k)
                .clientId(asString(c.get(CLIENT_ID)))
                .messageType(asString(c.get(MESSAGE_TYPE)))
                .consumerGroup(asString(c.get(CONSUMER_GROUP)))
                .offset(asString(c.get(OFFSET)));
        Object types = c.get(MESSAGE_TYPES);
        if (types instanceof Collection) {
            List<String> list = new ArrayList<>();
            for (Object t : (Collection<?>) types) {
                list.add(String.valueOf(t));
            }
            b.messageTypes(list);
        } else if (types != null) {
            b.messageTypes(Collections.singletonList(String.valueOf(types)));
        }
        Object ack = c.get(AUTO_ACK);
        if (ack != null) {
            b.autoAck(Boolean.parseBoolean(String.valueOf(ack).trim()));
        }
        return b.build();
    }

    public ClientKind kind() { return kind; }

    public String clientId() { return clientId; }

    public String messageType() { return messageType; }

    public List<String> messageTypes() { return messageTypes; }

    public String consumerGroup() { return consumerGroup; }

    public String offset() { return offset; }

    public Boolean autoAck() { return autoAck; }

    @Override
    public String toString() {
        return "ClientSpec{kind=" + kind
                + ", clientId=" + clientId
                + (messageType == null ? "" : ", messageType=" + messageType)
                + (messageTypes == null ? "" : ", messageTypes=" + messageTypes)
                + (consumerGroup == null ? "" : ", consumerGroup=" + consumerGroup)
                + (offset == null ? "" : ", offset=" + offset)
                + (autoAck == null ? "" : ", autoAck=" + autoAck)
                + '}';
    }

    private static String asString(Object v) {
        return (v == null) ? null : String.valueOf(v);
    }

    public static final class Builder {
        private final ClientKind kind;
        private String clientId;
        private String messageType;
        private Collection<String> messageTypes;
        private String consumerGroup;
        private String offset;
        private Boolean autoAck;

        private Builder(ClientKind kind) {
            if (kind == null) {
                throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Вид клиента не задан");
            }
            this.kind = kind;
        }

        public Builder clientId(String v) { this.clientId = v; return this; }
        public Builder messageType(String v) { this.messageType = v; return this; }
        public Builder messageTypes(Collection<String> v) { this.messageTypes = v; return this; }
        public Builder consumerGroup(String v) { this.consumerGroup = v; return this; }
        public Builder offset(String v) { this.offset = v; return this; }
        public Builder autoAck(Boolean v) { this.autoAck = v; return this; }

        public ClientSpec build() {
            Objects.requireNonNull(kind, "kind");
            return new ClientSpec(this);
        }
    }
}
