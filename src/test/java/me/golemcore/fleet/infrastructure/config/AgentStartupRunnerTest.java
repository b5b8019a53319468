package me.golemcore.fleet.infrastructure.config;

import me.golemcore.fleet.domain.dispatch.AgentDispatcher;
import me.golemcore.fleet.domain.exception.FatalAgentException;
import me.golemcore.fleet.domain.service.JvmExitService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class AgentStartupRunnerTest {

    private final AgentDispatcher dispatcher = mock(AgentDispatcher.class);
    private final JvmExitService jvmExitService = mock(JvmExitService.class);
    private final AgentStartupRunner runner = new AgentStartupRunner(dispatcher, jvmExitService);

    @Test
    void shouldExitWithStatusOneOnFatalError() {
        doThrow(new FatalAgentException("failed to connect: broker unreachable")).when(dispatcher).start();

        runner.run(new DefaultApplicationArguments());

        verify(jvmExitService).exit(1);
    }

    @Test
    void shouldNotExitAfterOrderlyShutdown() {
        runner.run(new DefaultApplicationArguments());

        verify(dispatcher).start();
        verify(jvmExitService, never()).exit(anyInt());
    }
}
