package com.baykanat.iot.ingestion.domain.mapper;

import com.baykanat.iot.ingestion.api.dto.IngestRequest;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;

/** IngestRequest → TelemetryRecord. device_id ve topic yoksa app_id kullanılır. MapStruct. */
@Mapper(componentModel = "spring")
public interface TelemetryMapper {

    String UNKNOWN = "unknown";

    @Mapping(target = "deviceId", source = "request", qualifiedByName = "resolveDeviceId")
    @Mapping(target = "deviceType", source = "request.deviceType", defaultValue = UNKNOWN)
    @Mapping(target = "topic", source = "request", qualifiedByName = "resolveTopic")
    @Mapping(target = "appId", source = "request.appId")
    @Mapping(target = "messageId", source = "request.msgId")
    @Mapping(target = "timestamp", source = "request.ts")
    @Mapping(target = "payload", source = "request.payload")
    @Mapping(target = "receivedAt", source = "receivedAt")
    TelemetryRecord toRecord(IngestRequest request, Instant receivedAt);

    @Named("resolveDeviceId")
    default String resolveDeviceId(IngestRequest request) {
        String deviceId = request.getDeviceId();
        return deviceId != null && !deviceId.isBlank() ? deviceId : request.getAppId();
    }

    @Named("resolveTopic")
    default String resolveTopic(IngestRequest request) {
        String topic = request.getTopic();
        return topic != null && !topic.isBlank() ? topic : request.getAppId();
    }
}
