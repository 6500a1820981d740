package com.ilmarlopez.plausible;

import com.ilmarlopez.plausible.config.DeploymentContext;
import com.ilmarlopez.plausible.config.PlausibleConfig;
import org.junit.jupiter.api.Test;
import software.amazon.awscdk.assertions.Capture;
import software.amazon.awscdk.assertions.Match;
import software.amazon.awscdk.assertions.Template;
import software.amazon.awscdk.core.App;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlausibleStackTest {

    private static final DeploymentContext DEPLOYMENT = DeploymentContext.of("111122223333", "us-east-1");

    private Template synth(PlausibleConfig config) {
        App app = new App();
        return Template.fromStack(new PlausibleStack(app, "plausible-stack", DEPLOYMENT, config));
    }

    @Test
    void openOnlySshHttpAndHttps() {
        Template template = synth(PlausibleConfig.defaults());

        template.resourceCountIs("AWS::EC2::SecurityGroup", 1);
        template.resourceCountIs("AWS::EC2::SecurityGroupIngress", 0);
        template.hasResourceProperties("AWS::EC2::SecurityGroup", Map.of(
                "GroupName", "PlausibleSG",
                "SecurityGroupIngress", List.of(
                        ingressFromAnywhere(22),
                        ingressFromAnywhere(80),
                        ingressFromAnywhere(443))));
    }

    @Test
    void allowReadingSecretsUnderPlausibleNamespace() {
        Template template = synth(PlausibleConfig.defaults());

        template.hasResourceProperties("AWS::IAM::Policy", Map.of(
                "PolicyDocument", Map.of(
                        "Statement", Match.arrayWith(List.of(Map.of(
                                "Action", List.of("ssm:GetParameter", "ssm:GetParameters"),
                                "Effect", "Allow",
                                "Resource", "arn:aws:ssm:us-east-1:111122223333:parameter/plausible/*"))))));
        template.hasResourceProperties("AWS::IAM::Role", Map.of(
                "AssumeRolePolicyDocument", Map.of(
                        "Statement", Match.arrayWith(List.of(Match.objectLike(Map.of(
                                "Action", "sts:AssumeRole",
                                "Effect", "Allow")))))));
        template.resourceCountIs("AWS::IAM::InstanceProfile", 1);
    }

    @Test
    void createInstanceWithKeyPairAndBootScript() {
        Template template = synth(PlausibleConfig.defaults());
        Capture userData = new Capture();

        template.resourceCountIs("AWS::EC2::Instance", 1);
        template.hasResourceProperties("AWS::EC2::Instance", Map.of(
                "InstanceType", "t3.micro",
                "KeyName", "plausible-keypair",
                "UserData", Map.of("Fn::Base64", userData)));
        assertThat(userData.asString())
                .startsWith("#!/bin/bash\n")
                .contains("sudo docker-compose up -d")
                .contains("server_name analytics.ilmarlopez.com;")
                .endsWith("echo '0 0 * * * root /usr/bin/certbot renew --quiet' | sudo tee /etc/cron.d/certbot-renew");
    }

    @Test
    void bindElasticIpToInstanceAndOutputIt() {
        Template template = synth(PlausibleConfig.defaults());

        template.resourceCountIs("AWS::EC2::EIP", 1);
        template.hasResourceProperties("AWS::EC2::EIP", Map.of(
                "Domain", "vpc",
                "InstanceId", Map.of("Ref", Match.stringLikeRegexp("hostPlausibleInstance.*"))));
        template.hasOutput(PlausibleStack.PUBLIC_IP_OUTPUT, Map.of(
                "Description", "The public IP address of the EC2 instance",
                "Value", Map.of("Ref", Match.stringLikeRegexp("hostInstanceEIP.*"))));
    }

    @Test
    void renderSameTemplateForSameInputs() {
        PlausibleConfig config = PlausibleConfig.defaults();

        assertThat(synth(config).toJSON()).isEqualTo(synth(config).toJSON());
    }

    @Test
    void useMultipartUserDataWhenConfigured() {
        Template template = synth(PlausibleConfig.builder().multipartUserData(true).build());
        Capture userData = new Capture();

        template.hasResourceProperties("AWS::EC2::Instance", Map.of(
                "UserData", Map.of("Fn::Base64", userData)));
        assertThat(userData.asObject())
                .asString()
                .contains("multipart/mixed")
                .contains("text/x-shellscript");
    }

    private static Object ingressFromAnywhere(int port) {
        return Match.objectLike(Map.of(
                "CidrIp", "0.0.0.0/0",
                "IpProtocol", "tcp",
                "FromPort", port,
                "ToPort", port));
    }
}
