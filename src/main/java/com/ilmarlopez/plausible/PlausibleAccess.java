package com.ilmarlopez.plausible;

import com.ilmarlopez.plausible.config.DeploymentContext;
import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.core.Construct;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.ec2.SecurityGroup;
import software.amazon.awscdk.services.iam.Effect;
import software.amazon.awscdk.services.iam.ManagedPolicy;
import software.amazon.awscdk.services.iam.PolicyStatement;
import software.amazon.awscdk.services.iam.Role;
import software.amazon.awscdk.services.iam.ServicePrincipal;

import java.util.List;

/**
 * Network and IAM access for the Plausible host: a security group open for SSH, HTTP and HTTPS,
 * and an instance role that can read the secrets under one SSM parameter namespace.
 */
public class PlausibleAccess extends Construct {
    final SecurityGroup securityGroup;
    final Role role;

    public PlausibleAccess(@NotNull Construct scope, @NotNull String id,
                           IVpc vpc, DeploymentContext deployment, String secretNamespace) {
        super(scope, id);

        this.securityGroup = SecurityGroup.Builder.create(this, "PlausibleSG")
                .vpc(vpc)
                .allowAllOutbound(true)
                .securityGroupName("PlausibleSG")
                .build();
        IngressRule.PUBLIC_RULES.forEach(rule -> rule.applyTo(securityGroup));

        this.role = Role.Builder.create(this, "InstanceSSMRole")
                .assumedBy(new ServicePrincipal("ec2.amazonaws.com"))
                .managedPolicies(List.of(
                        ManagedPolicy.fromAwsManagedPolicyName("AmazonSSMManagedInstanceCore")
                ))
                .build();

        role.addToPrincipalPolicy(PolicyStatement.Builder.create()
                .effect(Effect.ALLOW)
                .actions(List.of("ssm:GetParameter", "ssm:GetParameters"))
                .resources(List.of(deployment.secretParameterArn(secretNamespace)))
                .build());
    }

    public SecurityGroup getSecurityGroup() {
        return securityGroup;
    }

    public Role getRole() {
        return role;
    }
}
