package com.ilmarlopez.plausible;

import com.ilmarlopez.plausible.config.AppContext;
import com.ilmarlopez.plausible.config.DeploymentContext;
import com.ilmarlopez.plausible.config.PlausibleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awscdk.core.App;

public class PlausibleApp {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlausibleApp.class);

    public static final String STACK_ID = "plausible-stack";

    public static void main(final String[] args) {
        // Fails before any construct is created if the target account or region is missing
        var deployment = DeploymentContext.fromEnvironment(System::getenv);

        App app = new App();
        var config = PlausibleConfig.from(AppContext.of(app));
        LOGGER.info("Deploying {} to account {} in {}", STACK_ID, deployment.getAccountId(), deployment.getRegion());
        LOGGER.info("Using {}", config);

        new PlausibleStack(app, STACK_ID, deployment, config);

        app.synth();
    }
}
