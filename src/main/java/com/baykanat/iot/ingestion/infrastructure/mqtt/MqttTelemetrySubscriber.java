package com.baykanat.iot.ingestion.infrastructure.mqtt;

import com.baykanat.iot.ingestion.config.AppProperties;
import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Broker'a bağlanır, {@code devices/+/telemetry} topic'ine abone olur ve mesajları
 * {@link DeviceMessageHandler}'a verir.
 *
 * <p>İlk bağlantı başarısızsa initial-connect-retry aralığıyla tekrar denenir; bağlandıktan sonraki
 * kopmalarda Paho automatic reconnect devreye girer. Her (yeniden) bağlantıda subscribe tekrarlanır.
 * Pipeline'lardan sonra başlar, önce durur.
 */
@Slf4j
public class MqttTelemetrySubscriber implements SmartLifecycle, MqttCallbackExtended {

    static final int PHASE = IngestionPipeline.PHASE + 100;

    private final MqttClient client;
    private final MqttConnectOptions connectOptions;
    private final DeviceMessageHandler messageHandler;
    private final AppProperties.MqttProperties mqtt;

    private ScheduledExecutorService connectExecutor;
    private volatile ScheduledFuture<?> connectTask;
    private volatile boolean running;

    public MqttTelemetrySubscriber(MqttClient client, MqttConnectOptions connectOptions,
                                   DeviceMessageHandler messageHandler, AppProperties appProperties) {
        this.client = client;
        this.connectOptions = connectOptions;
        this.messageHandler = messageHandler;
        this.mqtt = appProperties.getMqtt();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        client.setCallback(this);

        connectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "mqtt-connect");
            thread.setDaemon(true);
            return thread;
        });
        long retryMs = Math.max(1, mqtt.getInitialConnectRetry().toMillis());
        connectTask = connectExecutor.scheduleWithFixedDelay(this::tryConnect, 0, retryMs, TimeUnit.MILLISECONDS);
    }

    /** Bağlanana kadar periyodik çağrılır; bağlanınca kendi görevini iptal eder. */
    void tryConnect() {
        if (!running || client.isConnected()) {
            cancelConnectTask();
            return;
        }
        try {
            log.info("Connecting to MQTT broker {} as {}", mqtt.getBrokerUrl(), mqtt.getClientId());
            client.connect(connectOptions);
            cancelConnectTask();
        } catch (MqttException e) {
            log.warn("MQTT connection to {} failed (reason={}): {}, retrying in {}",
                    mqtt.getBrokerUrl(), e.getReasonCode(), e.getMessage(), mqtt.getInitialConnectRetry());
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        log.info("{} MQTT broker {}", reconnect ? "Reconnected to" : "Connected to", serverURI);
        try {
            client.subscribe(mqtt.getTopic(), mqtt.getQos());
            log.info("Subscribed to topic: {} (qos={})", mqtt.getTopic(), mqtt.getQos());
        } catch (MqttException e) {
            log.error("Failed to subscribe to {}: {}", mqtt.getTopic(), e.getMessage(), e);
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("Lost connection to MQTT broker: {}", cause != null ? cause.getMessage() : "unknown cause");
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        messageHandler.handle(topic, message.getPayload());
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // sadece subscriber, publish yok
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        cancelConnectTask();
        if (connectExecutor != null) {
            connectExecutor.shutdownNow();
        }

        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
            log.info("MQTT subscriber stopped ({} messages accepted)", messageHandler.getAcceptedCount());
        } catch (MqttException e) {
            log.warn("Error while disconnecting from MQTT broker: {}", e.getMessage());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    private void cancelConnectTask() {
        ScheduledFuture<?> task = connectTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
