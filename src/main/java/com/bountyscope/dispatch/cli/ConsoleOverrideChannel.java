package com.bountyscope.dispatch.cli;

import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.policy.OverrideChannel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Asks the operator on the terminal to type the override token.
 */
public class ConsoleOverrideChannel implements OverrideChannel {

    private final BufferedReader in;
    private final String token;

    public ConsoleOverrideChannel(String token) {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), token);
    }

    ConsoleOverrideChannel(BufferedReader in, String token) {
        this.in = in;
        this.token = token;
    }

    @Override
    public synchronized String requestConfirmation(String target, PolicyDecision decision) {
        ConsoleOutput.overrideWarning(target, decision.reason());
        System.out.print("Type " + token + " to test " + target + " anyway: ");
        System.out.flush();
        try {
            String line = in.readLine();
            return line != null ? line.trim() : null;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read override confirmation", e);
        }
    }
}
