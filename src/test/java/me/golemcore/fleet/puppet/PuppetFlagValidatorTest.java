package me.golemcore.fleet.puppet;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PuppetFlagValidatorTest {

    private static Optional<String> check(String... flags) {
        return PuppetFlagValidator.findInvalidFlag(List.of(flags));
    }

    @Test
    void shouldAcceptNoFlags() {
        assertTrue(check().isEmpty());
    }

    @Test
    void shouldAcceptAllowedFlags() {
        assertTrue(check("--noop", "--debug", "--no-use_cached_catalog", "--show_diff").isEmpty());
    }

    @Test
    void shouldAcceptDefaultsRepeatedVerbatim() {
        assertTrue(check("--onetime", "--no-daemonize", "--verbose").isEmpty());
    }

    @Test
    void shouldRejectOverridingDefaults() {
        assertTrue(check("--daemonize").orElseThrow().contains("overrides the default flag '--no-daemonize'"));
        assertTrue(check("--no-onetime").isPresent());
        assertTrue(check("--no-verbose").isPresent());
        assertTrue(check("--onetime=false").isPresent());
    }

    @Test
    void shouldRejectFlagsOutsideAllowList() {
        assertEquals(Optional.of("'--server' is not an allowed flag"), check("--server", "evil.example.com"));
        assertTrue(check("--logdest").isPresent());
    }

    @Test
    void shouldAcceptValueAfterValueTakingFlag() {
        assertTrue(check("--environment", "production", "--tags", "ntp,ssh::server", "--noop").isEmpty());
        assertTrue(check("--environment=production").isEmpty());
    }

    @Test
    void shouldRejectValueWithoutValueTakingFlag() {
        assertEquals(Optional.of("unexpected argument 'production'"), check("--noop", "production"));
        assertTrue(check("production").isPresent());
        assertTrue(check("--environment", "production", "again").isPresent());
        assertTrue(check("--noop=true").orElseThrow().contains("does not take a value"));
    }

    @Test
    void shouldRejectUnsafeValues() {
        assertTrue(check("--environment", "production; rm -rf /").isPresent());
        assertTrue(check("--environment", "$(id)").isPresent());
        assertTrue(check("--tags=a|b").isPresent());
        assertTrue(check("--environment=").isPresent());
    }

    @Test
    void shouldRejectEmptyAndSingleDashTokens() {
        assertTrue(check("").isPresent());
        assertTrue(check("-t").isPresent());
    }

    @Test
    void shouldValidateEnvironmentEntries() {
        assertTrue(PuppetFlagValidator.findInvalidEnvEntry(List.of("FACTER_role=web", "EMPTY=", "A_1=x=y"))
                .isEmpty());
        assertTrue(PuppetFlagValidator.findInvalidEnvEntry(List.of("=value")).isPresent());
        assertTrue(PuppetFlagValidator.findInvalidEnvEntry(List.of("NOEQUALS")).isPresent());
        assertTrue(PuppetFlagValidator.findInvalidEnvEntry(List.of("1BAD=x")).isPresent());
    }

    @Test
    void shouldDropVerbatimDefaultsWhenBuildingCommandLine() {
        assertEquals(List.of("--noop"), PuppetFlagValidator.withoutDefaults(List.of("--onetime", "--noop")));
    }

    @Test
    void shouldComputeBaseName() {
        assertEquals("daemonize", PuppetFlagValidator.baseName("--no-daemonize"));
        assertEquals("noop", PuppetFlagValidator.baseName("--noop"));
    }
}
