package com.anemone.config;

import com.anemone.stream.PlanStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PlanStreamWebSocketHandler planStreamWebSocketHandler;

    public WebSocketConfig(PlanStreamWebSocketHandler planStreamWebSocketHandler) {
        this.planStreamWebSocketHandler = planStreamWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(planStreamWebSocketHandler, "/ws/plans")
                .setAllowedOrigins("*");
    }
}
