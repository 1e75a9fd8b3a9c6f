package com.baykanat.iot.ingestion.infrastructure.mqtt;

import com.baykanat.iot.ingestion.config.AppProperties;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MqttTelemetrySubscriber against a mocked Paho client.
 */
@ExtendWith(MockitoExtension.class)
class MqttTelemetrySubscriberTest {

    @Mock
    private MqttClient client;

    @Mock
    private DeviceMessageHandler messageHandler;

    private final MqttConnectOptions options = new MqttConnectOptions();
    private MqttTelemetrySubscriber subscriber;

    @BeforeEach
    void setUp() {
        subscriber = new MqttTelemetrySubscriber(client, options, messageHandler, new AppProperties());
    }

    @Test
    @DisplayName("connectComplete - subscribes to the telemetry topic on every (re)connect")
    void subscribesOnConnect() throws Exception {
        subscriber.connectComplete(false, "tcp://broker:1883");
        subscriber.connectComplete(true, "tcp://broker:1883");

        verify(client, times(2)).subscribe("devices/+/telemetry", 0);
    }

    @Test
    @DisplayName("messageArrived - raw payload is handed to the device message handler")
    void delegatesMessages() {
        byte[] body = "{\"ts\":1}".getBytes();

        subscriber.messageArrived("devices/dev-1/telemetry", new MqttMessage(body));

        verify(messageHandler).handle("devices/dev-1/telemetry", body);
    }

    @Test
    @DisplayName("tryConnect - broker unreachable is logged and retried later, not thrown")
    void connectFailureIsNotThrown() throws Exception {
        doThrow(new MqttException(MqttException.REASON_CODE_SERVER_CONNECT_ERROR))
                .when(client).connect(any(MqttConnectOptions.class));
        subscriber.start();

        assertThatCode(subscriber::tryConnect).doesNotThrowAnyException();

        subscriber.stop();
    }

    @Test
    @DisplayName("stop - disconnects and closes a connected client")
    void stopDisconnects() throws Exception {
        when(client.isConnected()).thenReturn(true);
        subscriber.start();

        subscriber.stop();

        verify(client).disconnect();
        verify(client).close();
    }
}
