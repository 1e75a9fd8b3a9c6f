package com.baykanat.iot.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** app.* için tip güvenli configuration (pipeline ayarları, MQTT bağlantısı, retention). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private String name = "IoT Telemetry Ingestion";
    private String version = "1.0.0";

    private PipelineProperties pipeline = new PipelineProperties();
    private MqttProperties mqtt = new MqttProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class PipelineProperties {
        /** MQTT cihaz mesajları; dedup yok. */
        private PipelineSettings device = new PipelineSettings();
        /** HTTP /ingest; (app_id, msg_id) üzerinden ON CONFLICT DO NOTHING. */
        private PipelineSettings ingest = PipelineSettings.withConflictKey("app_id", "msg_id");
    }

    @Getter
    @Setter
    public static class PipelineSettings {
        private int queueCapacity = 10000;
        private int batchSize = 100;
        private Duration batchTimeout = Duration.ofSeconds(1);
        /** Boş kuyrukta iki poll arası bekleme. */
        private Duration pollInterval = Duration.ofMillis(10);
        /** Boş batch sonrası bekleme. */
        private Duration idleSleep = Duration.ofMillis(100);
        private Duration errorBackoff = Duration.ofSeconds(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /** Her N başarılı batch'te bir istatistik logu. */
        private int statsLogInterval = 10;
        /** 503 yanıtındaki Retry-After. */
        private Duration retryAfter = Duration.ofSeconds(1);
        /** Boşsa dedup yok; doluysa ON CONFLICT (kolonlar) DO NOTHING. */
        private List<String> conflictKey = new ArrayList<>();

        static PipelineSettings withConflictKey(String... columns) {
            PipelineSettings settings = new PipelineSettings();
            settings.setConflictKey(new ArrayList<>(List.of(columns)));
            return settings;
        }
    }

    @Getter
    @Setter
    public static class MqttProperties {
        private boolean enabled = true;
        private String brokerUrl = "tcp://mosquitto:1883";
        private String clientId = "iot-consumer";
        private String username = "";
        private String password = "";
        private String topic = "devices/+/telemetry";
        private int qos = 0;
        private boolean cleanSession = true;
        private Duration keepAlive = Duration.ofSeconds(60);
        private Duration connectionTimeout = Duration.ofSeconds(10);
        /** İlk bağlantı başarısızsa tekrar deneme aralığı; sonrası Paho automatic reconnect. */
        private Duration initialConnectRetry = Duration.ofSeconds(5);
        private int progressLogInterval = 100;
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private long retentionCleanupRate = 3600000;
        private long retentionInitialDelay = 60000;
        /** Bu günden eski telemetry otomatik silinir; varsayılan 0, yani otomatik silme kapalı. */
        private int retentionDays = 0;
    }
}
