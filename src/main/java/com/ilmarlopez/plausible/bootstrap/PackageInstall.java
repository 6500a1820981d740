package com.ilmarlopez.plausible.bootstrap;

import java.util.ArrayList;
import java.util.List;

public class PackageInstall implements BootStep {

    private final BootPhase phase;
    private final boolean updateIndex;
    private final List<String> packages;

    private PackageInstall(BootPhase phase, boolean updateIndex, List<String> packages) {
        if (packages.isEmpty()) {
            throw new IllegalArgumentException("No packages to install");
        }
        this.phase = phase;
        this.updateIndex = updateIndex;
        this.packages = packages;
    }

    public static PackageInstall withIndexUpdate(BootPhase phase, String... packages) {
        return new PackageInstall(phase, true, List.of(packages));
    }

    public static PackageInstall of(BootPhase phase, String... packages) {
        return new PackageInstall(phase, false, List.of(packages));
    }

    @Override
    public BootPhase getPhase() {
        return phase;
    }

    @Override
    public List<String> render() {
        var commands = new ArrayList<String>();
        if (updateIndex) {
            commands.add("sudo apt-get update -y");
        }
        commands.add("sudo apt-get install -y " + String.join(" ", packages));
        return commands;
    }

    @Override
    public String toString() {
        return "PackageInstall{phase=" + phase + ", packages=" + packages + "}";
    }
}
