package com.scicalc.mathfrontend.api;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final LiveValidationHandler liveValidationHandler;

    public WebSocketConfig(LiveValidationHandler liveValidationHandler) {
        this.liveValidationHandler = liveValidationHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(liveValidationHandler, "/validate-ws")
                .setAllowedOrigins("*");
    }
}
