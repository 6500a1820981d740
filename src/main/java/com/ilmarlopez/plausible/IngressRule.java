package com.ilmarlopez.plausible;

import software.amazon.awscdk.services.ec2.ISecurityGroup;
import software.amazon.awscdk.services.ec2.Peer;
import software.amazon.awscdk.services.ec2.Port;

import java.util.List;

public final class IngressRule {

    public static final String ANY_IPV4 = "0.0.0.0/0";

    public static final List<IngressRule> PUBLIC_RULES = List.of(
            new IngressRule(22, "Allow SSH"),
            new IngressRule(80, "Allow HTTP"),
            new IngressRule(443, "Allow HTTPS"));

    private final int port;
    private final String description;

    private IngressRule(int port, String description) {
        this.port = port;
        this.description = description;
    }

    public int getPort() {
        return port;
    }

    public String getProtocol() {
        return "tcp";
    }

    public String getSource() {
        return ANY_IPV4;
    }

    void applyTo(ISecurityGroup securityGroup) {
        securityGroup.addIngressRule(Peer.anyIpv4(), Port.tcp(port), description);
    }

    @Override
    public String toString() {
        return port + "/" + getProtocol() + " from " + getSource();
    }
}
