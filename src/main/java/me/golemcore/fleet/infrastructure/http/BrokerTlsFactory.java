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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.exception.ConnectionConfigException;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Applies the agent's client certificate and CA stores to the broker client.
 * With neither store configured the platform defaults are used.
 */
@Component
@Slf4j
public class BrokerTlsFactory {

    private final AgentProperties properties;

    public BrokerTlsFactory(AgentProperties properties) {
        this.properties = properties;
    }

    /**
     * Derives a client with the configured TLS material.
     *
     * @throws ConnectionConfigException
     *             if a store cannot be read or the TLS context cannot be built
     */
    public OkHttpClient configure(OkHttpClient baseClient) {
        AgentProperties.SslProperties ssl = properties.getSsl();
        if (isBlank(ssl.getKeyStore()) && isBlank(ssl.getTrustStore())) {
            return baseClient;
        }

        try {
            KeyManager[] keyManagers = null;
            if (!isBlank(ssl.getKeyStore())) {
                KeyStore keyStore = load(ssl.getKeyStore(), ssl.getKeyStoreType(), ssl.getKeyStorePassword());
                KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                kmf.init(keyStore, ssl.getKeyStorePassword().toCharArray());
                keyManagers = kmf.getKeyManagers();
            }

            KeyStore trustStore = isBlank(ssl.getTrustStore())
                    ? null
                    : load(ssl.getTrustStore(), ssl.getTrustStoreType(), ssl.getTrustStorePassword());
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            X509TrustManager trustManager = findX509TrustManager(tmf.getTrustManagers());

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(keyManagers, new TrustManager[] { trustManager }, null);
            log.info("[Broker] TLS configured (client certificate: {}, custom CA: {})",
                    keyManagers != null, trustStore != null);
            return baseClient.newBuilder()
                    .sslSocketFactory(sslContext.getSocketFactory(), trustManager)
                    .build();
        } catch (GeneralSecurityException e) {
            throw new ConnectionConfigException("invalid TLS configuration: " + e.getMessage(), e);
        }
    }

    private KeyStore load(String location, String type, String password) throws GeneralSecurityException {
        Path path = AgentProperties.resolvePath(location);
        if (!Files.isRegularFile(path)) {
            throw new ConnectionConfigException("key store " + path + " does not exist");
        }
        KeyStore keyStore = KeyStore.getInstance(type);
        try (InputStream in = Files.newInputStream(path)) {
            keyStore.load(in, password != null ? password.toCharArray() : null);
        } catch (IOException e) {
            throw new ConnectionConfigException("failed to read key store " + path + ": " + e.getMessage(), e);
        }
        return keyStore;
    }

    private static X509TrustManager findX509TrustManager(TrustManager[] trustManagers) {
        for (TrustManager trustManager : trustManagers) {
            if (trustManager instanceof X509TrustManager x509) {
                return x509;
            }
        }
        throw new ConnectionConfigException("no X509 trust manager available");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
