package com.ilmarlopez.plausible.bootstrap;

import java.util.List;

public interface BootStep {

    BootPhase getPhase();

    List<String> render();
}
