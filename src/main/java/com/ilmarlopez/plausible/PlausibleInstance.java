package com.ilmarlopez.plausible;

import com.ilmarlopez.plausible.config.PlausibleConfig;
import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.core.Construct;
import software.amazon.awscdk.services.ec2.CfnEIP;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.ec2.Instance;
import software.amazon.awscdk.services.ec2.InstanceClass;
import software.amazon.awscdk.services.ec2.InstanceSize;
import software.amazon.awscdk.services.ec2.InstanceType;
import software.amazon.awscdk.services.ec2.LookupMachineImageProps;
import software.amazon.awscdk.services.ec2.MachineImage;
import software.amazon.awscdk.services.ec2.SubnetSelection;
import software.amazon.awscdk.services.ec2.SubnetType;
import software.amazon.awscdk.services.ec2.UserData;

import java.util.List;

public class PlausibleInstance extends Construct {
    final Instance instance;
    final CfnEIP address;

    public PlausibleInstance(@NotNull Construct scope, @NotNull String id,
                             IVpc vpc, PlausibleAccess access, PlausibleConfig config, UserData userData) {
        super(scope, id);

        var image = MachineImage.lookup(LookupMachineImageProps.builder()
                .name(config.getImageName())
                .owners(List.of(config.getImageOwner()))
                .build());

        // The key pair must already exist in the account
        this.instance = Instance.Builder.create(this, "PlausibleInstance")
                .instanceType(InstanceType.of(InstanceClass.BURSTABLE3, InstanceSize.MICRO))
                .machineImage(image)
                .vpc(vpc)
                .vpcSubnets(SubnetSelection.builder().subnetType(SubnetType.PUBLIC).build())
                .securityGroup(access.getSecurityGroup())
                .keyName(config.getKeyPairName())
                .role(access.getRole())
                .userData(userData)
                .build();

        this.address = CfnEIP.Builder.create(this, "InstanceEIP")
                .domain("vpc")
                .instanceId(instance.getInstanceId())
                .build();
    }

    public CfnEIP getAddress() {
        return address;
    }
}
