package com.odin.share_relay_service.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.utility.JwtUtil;
import com.odin.share_relay_service.utility.RelayWebSocketHandler;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RelayWebSocketHandler relayWebSocketHandler;
    private final JwtUtil jwtUtil;

    // items arrive base64-encoded inside one text frame
    @Value("${websocket.max-text-message-size:71303168}")
    private int maxTextMessageSize;

    public WebSocketConfig(RelayWebSocketHandler relayWebSocketHandler, JwtUtil jwtUtil) {
        this.relayWebSocketHandler = relayWebSocketHandler;
        this.jwtUtil = jwtUtil;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(relayWebSocketHandler, ApplicationConstants.WEBSOCKET_PATH)
                .addInterceptors(new PrincipalHandshakeInterceptor(jwtUtil))
                .setAllowedOrigins("*");

        log.info("WebSocket handlers registered - Path: {}, Handler: RelayWebSocketHandler",
                ApplicationConstants.WEBSOCKET_PATH);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        container.setMaxBinaryMessageBufferSize(maxTextMessageSize);
        log.info("WebSocket container max text message size: {} bytes", maxTextMessageSize);
        return container;
    }

}
