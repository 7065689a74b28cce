package me.golemcore.brain.adapter.inbound.command;

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
import me.golemcore.brain.port.inbound.CommandPort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point: {@code brain <command> [args...]}. Runs exactly
 * one command per process and exits non-zero when it fails, so that an
 * external scheduler can see failed runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrainCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CommandPort commandPort;

    private PrintStream out = System.out;
    private int exitCode;

    @Override
    public void run(ApplicationArguments applicationArguments) {
        String[] args = applicationArguments.getSourceArgs();
        if (args.length == 0) {
            out.println(commandPort.execute(CommandRouter.CMD_HELP, List.of()).output());
            return;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        CommandPort.CommandResult result = commandPort.execute(command, rest);
        if (result.success()) {
            out.println(result.output());
        } else {
            log.warn("[CLI] {} failed: {}", command, result.output());
            out.println("Error: " + result.output());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
