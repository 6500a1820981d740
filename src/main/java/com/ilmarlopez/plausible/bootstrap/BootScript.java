package com.ilmarlopez.plausible.bootstrap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered boot steps run once when the instance first starts.
 * <p>
 * Steps must be added in phase order. A step from an earlier phase than the last one added is rejected,
 * so for example secrets cannot be fetched after the workload has been started.
 */
public class BootScript {

    private final List<BootStep> steps = new ArrayList<>();

    public BootScript add(BootStep step) {
        if (!steps.isEmpty()) {
            BootPhase last = steps.get(steps.size() - 1).getPhase();
            if (step.getPhase().compareTo(last) < 0) {
                throw new IllegalStateException("Cannot add " + step.getPhase() + " step after " + last + " step");
            }
        }
        steps.add(step);
        return this;
    }

    public List<BootStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public List<String> commands() {
        return steps.stream()
                .flatMap(step -> step.render().stream())
                .collect(Collectors.toList());
    }

    public List<String> commands(BootPhase phase) {
        return steps.stream()
                .filter(step -> step.getPhase() == phase)
                .flatMap(step -> step.render().stream())
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
