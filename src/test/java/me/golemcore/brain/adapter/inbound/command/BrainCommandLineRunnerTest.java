package me.golemcore.brain.adapter.inbound.command;

import me.golemcore.brain.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrainCommandLineRunnerTest {

    private CommandPort commandPort;
    private ByteArrayOutputStream output;
    private BrainCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        commandPort = mock(CommandPort.class);
        output = new ByteArrayOutputStream();
        runner = new BrainCommandLineRunner(commandPort);
        runner.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldPrintHelpWithoutArguments() {
        when(commandPort.execute("help", List.of())).thenReturn(CommandPort.CommandResult.success("usage"));

        runner.run(new DefaultApplicationArguments());

        assertEquals("usage", output.toString(StandardCharsets.UTF_8).trim());
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void shouldPassRemainingArgumentsToCommand() {
        when(commandPort.execute("validate", List.of("Acme Corp", "mem_business")))
                .thenReturn(CommandPort.CommandResult.success("Validated Acme Corp into mem_business"));

        runner.run(new DefaultApplicationArguments("validate", "Acme Corp", "mem_business"));

        verify(commandPort).execute("validate", List.of("Acme Corp", "mem_business"));
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void shouldExitNonZeroOnFailure() {
        when(commandPort.execute("reject", List.of("Ghost")))
                .thenReturn(CommandPort.CommandResult.failure("Entity not in quarantine: Ghost"));

        runner.run(new DefaultApplicationArguments("reject", "Ghost"));

        assertTrue(output.toString(StandardCharsets.UTF_8).contains("Error: Entity not in quarantine: Ghost"));
        assertEquals(1, runner.getExitCode());
    }
}
