package me.golemcore.fleet.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the OkHttp client carrying the broker WebSocket.
 *
 * <p>
 * Creates a shared {@link OkHttpClient} bean configured from
 * {@link AgentProperties}:
 * <ul>
 * <li>Connect timeout - time to establish the connection</li>
 * <li>Ping interval - WebSocket keepalive, a missed pong fails the
 * connection</li>
 * <li>No read timeout - the broker link is idle between requests</li>
 * </ul>
 *
 * <p>
 * TLS material is applied per connection by {@link BrokerTlsFactory}.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final AgentProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        AgentProperties.ConnectionProperties connection = properties.getConnection();

        return new OkHttpClient.Builder()
                .connectTimeout(connection.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .writeTimeout(connection.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .pingInterval(connection.getPingInterval(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }
}
