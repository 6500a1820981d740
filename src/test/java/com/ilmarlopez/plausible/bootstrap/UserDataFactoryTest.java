package com.ilmarlopez.plausible.bootstrap;

import com.ilmarlopez.plausible.config.PlausibleConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserDataFactoryTest {

    private final BootScript script = new BootScriptComposer(PlausibleConfig.defaults()).compose();

    @Test
    void renderPlainBashScript() {
        assertThat(UserDataFactory.create(script, false).render())
                .isEqualTo("#!/bin/bash\n" + String.join("\n", script.commands()));
    }

    @Test
    void wrapScriptInOneMultipartPart() {
        assertThat(UserDataFactory.create(script, true).render())
                .startsWith("Content-Type: multipart/mixed;")
                .contains("Content-Type: text/x-shellscript; charset=\"utf-8\"");
    }

    @Test
    void refuseEmptyScript() {
        assertThatThrownBy(() -> UserDataFactory.create(new BootScript(), false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
