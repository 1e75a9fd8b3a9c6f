package com.baykanat.iot.ingestion.config;

import com.baykanat.iot.ingestion.infrastructure.mqtt.DeviceMessageHandler;
import com.baykanat.iot.ingestion.infrastructure.mqtt.MqttTelemetrySubscriber;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Paho client ve bağlantı ayarları. app.mqtt.enabled=false ise MQTT adapter hiç kurulmaz. */
@Configuration
@ConditionalOnProperty(prefix = "app.mqtt", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MqttConfig {

    @Bean(destroyMethod = "")
    public MqttClient mqttClient(AppProperties appProperties) throws MqttException {
        AppProperties.MqttProperties mqtt = appProperties.getMqtt();
        return new MqttClient(mqtt.getBrokerUrl(), mqtt.getClientId(), new MemoryPersistence());
    }

    @Bean
    public MqttConnectOptions mqttConnectOptions(AppProperties appProperties) {
        AppProperties.MqttProperties mqtt = appProperties.getMqtt();

        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(mqtt.isCleanSession());
        options.setKeepAliveInterval((int) mqtt.getKeepAlive().toSeconds());
        options.setConnectionTimeout((int) mqtt.getConnectionTimeout().toSeconds());

        if (mqtt.getUsername() != null && !mqtt.getUsername().isBlank()) {
            options.setUserName(mqtt.getUsername());
            if (mqtt.getPassword() != null) {
                options.setPassword(mqtt.getPassword().toCharArray());
            }
        }
        return options;
    }

    @Bean
    public MqttTelemetrySubscriber mqttTelemetrySubscriber(MqttClient mqttClient, MqttConnectOptions mqttConnectOptions,
                                                           DeviceMessageHandler deviceMessageHandler,
                                                           AppProperties appProperties) {
        return new MqttTelemetrySubscriber(mqttClient, mqttConnectOptions, deviceMessageHandler, appProperties);
    }
}
