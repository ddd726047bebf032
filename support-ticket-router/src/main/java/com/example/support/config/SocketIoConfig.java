package com.example.support.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

/**
 * Embedded Socket.IO server carrying user, bot and staff connections. Started with the context and
 * stopped on shutdown.
 */
@Slf4j
@org.springframework.context.annotation.Configuration
public class SocketIoConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SocketIOServer socketIOServer(SupportProperties supportProperties, ObjectMapper objectMapper) {
        SupportProperties.SocketIo socketIo = supportProperties.getSocketIo();
        Configuration configuration = new Configuration();
        configuration.setHostname(socketIo.getHost());
        configuration.setPort(socketIo.getPort());
        configuration.setOrigin(socketIo.getOrigin());
        configuration.setPingInterval((int) socketIo.getPingInterval().toMillis());
        configuration.setPingTimeout((int) socketIo.getPingTimeout().toMillis());
        configuration.setMaxFramePayloadLength(socketIo.getMaxFramePayloadLength());
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SocketIoJsonSupport(objectMapper));
        log.info("Socket.IO transport listening on {}:{}", socketIo.getHost(), socketIo.getPort());
        return new SocketIOServer(configuration);
    }
}
