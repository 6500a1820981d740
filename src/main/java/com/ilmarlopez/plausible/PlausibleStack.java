package com.ilmarlopez.plausible;

import com.ilmarlopez.plausible.bootstrap.BootScriptComposer;
import com.ilmarlopez.plausible.bootstrap.UserDataFactory;
import com.ilmarlopez.plausible.config.DeploymentContext;
import com.ilmarlopez.plausible.config.PlausibleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awscdk.core.CfnOutput;
import software.amazon.awscdk.core.Construct;
import software.amazon.awscdk.core.Stack;
import software.amazon.awscdk.core.StackProps;
import software.amazon.awscdk.services.ec2.Vpc;
import software.amazon.awscdk.services.ec2.VpcLookupOptions;

public class PlausibleStack extends Stack {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlausibleStack.class);

    public static final String PUBLIC_IP_OUTPUT = "InstancePublicIP";

    public PlausibleStack(final Construct scope, final String id, final DeploymentContext deployment,
                          final PlausibleConfig config) {
        super(scope, id, StackProps.builder()
                .env(deployment.toEnvironment())
                .build());

        // Not created here, the lookup fails if the account has no default VPC
        var vpc = Vpc.fromLookup(this, "DefaultVPC", VpcLookupOptions.builder()
                .isDefault(true)
                .build());

        var access = new PlausibleAccess(this, "access", vpc, deployment, config.getSecretNamespace());

        var script = new BootScriptComposer(config).compose();
        var userData = UserDataFactory.create(script, config.isMultipartUserData());
        LOGGER.info("Boot script has {} commands", script.commands().size());

        var host = new PlausibleInstance(this, "host", vpc, access, config, userData);

        CfnOutput.Builder.create(this, PUBLIC_IP_OUTPUT)
                .value(host.getAddress().getRef())
                .description("The public IP address of the EC2 instance")
                .build();
    }
}
