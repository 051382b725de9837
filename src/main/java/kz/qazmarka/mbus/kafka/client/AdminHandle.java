package kz.qazmarka.mbus.kafka.client;

import java.time.Duration;

import kz.qazmarka.mbus.ClientKind;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;

/**
 * Дескриптор control-plane клиента.
 */
public final class AdminHandle extends ClientHandle {

    private final KafkaTopicAdmin admin;

    AdminHandle(String id, KafkaTopicAdmin admin) {
        super(ClientKind.ADMIN, id);
        this.admin = admin;
    }

    public KafkaTopicAdmin admin() {
        return admin;
    }

    @Override
    void closeConnection(Duration timeout) {
        admin.close(timeout);
    }
}
