package com.ilmarlopez.plausible.bootstrap;

import java.util.List;

public class ShellRaw implements BootStep {

    private final BootPhase phase;
    private final List<String> commands;

    private ShellRaw(BootPhase phase, List<String> commands) {
        this.phase = phase;
        this.commands = commands;
    }

    public static ShellRaw of(BootPhase phase, String... commands) {
        return new ShellRaw(phase, List.of(commands));
    }

    @Override
    public BootPhase getPhase() {
        return phase;
    }

    @Override
    public List<String> render() {
        return commands;
    }

    @Override
    public String toString() {
        return "ShellRaw{phase=" + phase + ", commands=" + commands + "}";
    }
}
