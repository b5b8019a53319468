package me.golemcore.fleet.infrastructure.config;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.dispatch.AgentDispatcher;
import me.golemcore.fleet.domain.exception.FatalAgentException;
import me.golemcore.fleet.domain.service.JvmExitService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the dispatcher on the main thread once the context is ready. A fatal
 * agent error terminates the process with status 1.
 */
@Component
@ConditionalOnProperty(prefix = "agent", name = "auto-start", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AgentStartupRunner implements ApplicationRunner {

    private final AgentDispatcher dispatcher;
    private final JvmExitService jvmExitService;

    @Override
    public void run(ApplicationArguments args) {
        try {
            dispatcher.start();
            log.info("Agent connection closed, shutting down");
        } catch (FatalAgentException e) {
            log.error("Fatal error: {}", e.getMessage(), e);
            jvmExitService.exit(1);
        }
    }
}
