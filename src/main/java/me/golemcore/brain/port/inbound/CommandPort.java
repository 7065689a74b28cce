package me.golemcore.brain.port.inbound;

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

import java.util.List;

/**
 * Inbound port for the memory commands ({@code save}, {@code consolidate},
 * {@code validate}, {@code query} and the rest). One call is one operation
 * against the tracking ledger, which is loaded and persisted around it.
 */
public interface CommandPort {

    /**
     * Run a command.
     *
     * @param command
     *            command name, e.g. {@code consolidate}
     * @param args
     *            positional arguments and {@code --option value} pairs, in
     *            the order the user typed them
     * @return outcome with the text to print and, for most commands, the
     *         domain object the command produced
     */
    CommandResult execute(String command, List<String> args);

    boolean hasCommand(String command);

    /**
     * Command table in help order.
     */
    List<CommandDefinition> listCommands();

    /**
     * Outcome of one command. {@code data} is the domain result (a
     * {@code WeeklySummary}, {@code RetrievalResult}, ...) or null.
     */
    record CommandResult(boolean success, String output, Object data) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }
    }

    record CommandDefinition(String name, String description, String usage) {
    }
}
