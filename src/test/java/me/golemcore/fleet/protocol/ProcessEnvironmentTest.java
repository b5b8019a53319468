package me.golemcore.fleet.protocol;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessEnvironmentTest {

    @Test
    void shouldForceUserVariablesForNonRootUser() {
        ProcessEnvironment environment = new ProcessEnvironment("deploy", "/home/deploy", false);
        Map<String, String> env = new HashMap<>(Map.of("USER", "root", "HOME", "/root", "FACTER_role", "web"));

        environment.apply(env);

        assertEquals("deploy", env.get("USER"));
        assertEquals("deploy", env.get("LOGNAME"));
        assertEquals("/home/deploy", env.get("HOME"));
        assertEquals("web", env.get("FACTER_role"));
    }

    @Test
    void shouldLeaveEnvironmentAloneForRoot() {
        ProcessEnvironment environment = new ProcessEnvironment("root", "/root", false);
        Map<String, String> env = new HashMap<>(Map.of("HOME", "/somewhere"));

        environment.apply(env);

        assertEquals(Map.of("HOME", "/somewhere"), env);
        assertTrue(environment.getOverrides().isEmpty());
    }

    @Test
    void shouldLeaveEnvironmentAloneOnWindows() {
        ProcessEnvironment environment = new ProcessEnvironment("deploy", "C:\\Users\\deploy", true);

        assertTrue(environment.getOverrides().isEmpty());
    }
}
