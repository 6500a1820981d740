package com.ilmarlopez.plausible.bootstrap;

import java.util.List;
import java.util.Locale;

/**
 * Exports a decrypted SSM parameter as an environment variable named after the parameter in upper case.
 * Expects $REGION to have been set by an earlier step.
 */
public class SecretExport implements BootStep {

    private final String namespace;
    private final String name;

    private SecretExport(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public static SecretExport of(String namespace, String name) {
        return new SecretExport(namespace, name);
    }

    @Override
    public BootPhase getPhase() {
        return BootPhase.SECRETS;
    }

    public String getVariableName() {
        return name.toUpperCase(Locale.ROOT);
    }

    public String getParameterName() {
        return "/" + namespace + "/" + name;
    }

    @Override
    public List<String> render() {
        return List.of("export " + getVariableName() + "=$(aws ssm get-parameter" +
                " --name '" + getParameterName() + "'" +
                " --with-decryption --query Parameter.Value --output text --region $REGION)");
    }

    @Override
    public String toString() {
        return "SecretExport{parameter='" + getParameterName() + "'}";
    }
}
