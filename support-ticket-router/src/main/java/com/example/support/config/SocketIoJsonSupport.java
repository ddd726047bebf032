package com.example.support.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

/**
 * Socket.IO codec following the application mapper for dates and unknown properties. Null fields
 * are left out of outbound payloads.
 */
public class SocketIoJsonSupport extends JacksonJsonSupport {

    private static final List<SerializationFeature> MIRRORED_SERIALIZATION = List.of(
            SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
            SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private static final List<DeserializationFeature> MIRRORED_DESERIALIZATION = List.of(
            DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
            DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);

    public SocketIoJsonSupport(ObjectMapper applicationMapper) {
        super(new JavaTimeModule());
        MIRRORED_SERIALIZATION.forEach(feature -> objectMapper.configure(feature, applicationMapper.isEnabled(feature)));
        MIRRORED_DESERIALIZATION.forEach(feature -> objectMapper.configure(feature, applicationMapper.isEnabled(feature)));
        objectMapper.setTimeZone(applicationMapper.getSerializationConfig().getTimeZone());
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
