package com.ilmarlopez.plausible.bootstrap;

/**
 * Phases of instance initialisation, in the order they must run.
 */
public enum BootPhase {
    PACKAGES,
    SERVICES,
    REGION_DISCOVERY,
    // Needs $REGION from the metadata endpoint
    SECRETS,
    ENVIRONMENT,
    // docker-compose reads the exported secrets and environment
    WORKLOAD,
    // Proxies to the port the workload listens on
    REVERSE_PROXY,
    // ACME HTTP validation goes through the proxy's virtual host
    CERTIFICATE,
    RENEWAL
}
