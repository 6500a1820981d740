package com.ilmarlopez.plausible.config;

import software.amazon.awscdk.core.Environment;

import java.util.Objects;
import java.util.function.Function;

public class DeploymentContext {

    public static final String ACCOUNT_VARIABLE = "CDK_DEFAULT_ACCOUNT";
    public static final String REGION_VARIABLE = "CDK_DEFAULT_REGION";

    private final String accountId;
    private final String region;

    private DeploymentContext(String accountId, String region) {
        this.accountId = accountId;
        this.region = region;
    }

    public static DeploymentContext of(String accountId, String region) {
        return new DeploymentContext(
                requireNonBlank(accountId, ACCOUNT_VARIABLE),
                requireNonBlank(region, REGION_VARIABLE));
    }

    public static DeploymentContext fromEnvironment(Function<String, String> getenv) {
        return of(getenv.apply(ACCOUNT_VARIABLE), getenv.apply(REGION_VARIABLE));
    }

    public Environment toEnvironment() {
        return Environment.builder()
                .account(accountId)
                .region(region)
                .build();
    }

    /**
     * ARN pattern matching every SSM parameter under the given namespace in this account and region.
     */
    public String secretParameterArn(String namespace) {
        return "arn:aws:ssm:" + region + ":" + accountId + ":parameter/" + namespace + "/*";
    }

    public String getAccountId() {
        return accountId;
    }

    public String getRegion() {
        return region;
    }

    private static String requireNonBlank(String value, String variable) {
        if (value == null || value.trim().isEmpty()) {
            throw new MissingConfigurationException(variable, "environment");
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DeploymentContext that = (DeploymentContext) o;
        return accountId.equals(that.accountId) && region.equals(that.region);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, region);
    }

    @Override
    public String toString() {
        return "DeploymentContext{accountId='" + accountId + "', region='" + region + "'}";
    }
}
