package com.ilmarlopez.plausible.bootstrap;

import java.util.List;
import java.util.stream.Collectors;

public class ServiceControl implements BootStep {

    private final BootPhase phase;
    private final String service;
    private final List<String> actions;

    private ServiceControl(BootPhase phase, String service, List<String> actions) {
        this.phase = phase;
        this.service = service;
        this.actions = actions;
    }

    public static ServiceControl of(BootPhase phase, String service, String... actions) {
        return new ServiceControl(phase, service, List.of(actions));
    }

    public static ServiceControl enableAndStart(BootPhase phase, String service) {
        return of(phase, service, "enable", "start");
    }

    @Override
    public BootPhase getPhase() {
        return phase;
    }

    @Override
    public List<String> render() {
        return actions.stream()
                .map(action -> "sudo systemctl " + action + " " + service)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ServiceControl{phase=" + phase + ", service='" + service + "', actions=" + actions + "}";
    }
}
