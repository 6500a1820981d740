package com.ilmarlopez.plausible.bootstrap;

import com.ilmarlopez.plausible.config.PlausibleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.ilmarlopez.plausible.bootstrap.BootPhase.CERTIFICATE;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.ENVIRONMENT;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.PACKAGES;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.REGION_DISCOVERY;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.RENEWAL;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.REVERSE_PROXY;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.SECRETS;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.SERVICES;
import static com.ilmarlopez.plausible.bootstrap.BootPhase.WORKLOAD;

/**
 * Builds the boot script that installs Plausible with docker-compose behind nginx and a Let's Encrypt certificate.
 * Safe to run again on the same host: the clone is skipped if the checkout exists, the site link is replaced
 * and the cron file is overwritten rather than appended to.
 */
public class BootScriptComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(BootScriptComposer.class);

    public static final String SECRET_KEY_BASE = "secret_key_base";
    public static final String POSTGRES_PASSWORD = "postgres_password";
    public static final String METADATA_REGION_URL = "http://169.254.169.254/latest/meta-data/placement/region";
    public static final String CERTBOT_CRON_FILE = "/etc/cron.d/certbot-renew";
    public static final String CERTBOT_CRON_LINE = "0 0 * * * root /usr/bin/certbot renew --quiet";

    private final PlausibleConfig config;

    public BootScriptComposer(PlausibleConfig config) {
        this.config = config;
    }

    public BootScript compose() {
        var site = new NginxSite("plausible", config.getDomainName(), config.getProxyPort());
        var checkout = config.getCheckoutDirectory();

        var script = new BootScript()
                .add(PackageInstall.withIndexUpdate(PACKAGES, "docker.io", "docker-compose", "git", "awscli"))
                .add(ServiceControl.enableAndStart(SERVICES, "docker"))
                .add(ShellRaw.of(REGION_DISCOVERY, "REGION=$(curl -s " + METADATA_REGION_URL + ")"))
                .add(SecretExport.of(config.getSecretNamespace(), SECRET_KEY_BASE))
                .add(SecretExport.of(config.getSecretNamespace(), POSTGRES_PASSWORD))
                .add(ShellRaw.of(ENVIRONMENT, "export BASE_URL='" + config.getBaseUrl() + "'"))
                .add(ShellRaw.of(WORKLOAD,
                        "cd " + config.getCheckoutParent(),
                        "[ -d " + checkout + " ] || git clone " + config.getRepositoryUrl(),
                        "cd " + checkout,
                        "sudo docker-compose up -d"))
                .add(PackageInstall.of(REVERSE_PROXY, "nginx", "python3-certbot-nginx"))
                .add(ServiceControl.enableAndStart(REVERSE_PROXY, "nginx"))
                .add(FileWrite.of(REVERSE_PROXY, site.getAvailablePath(), site.render()))
                .add(ShellRaw.of(REVERSE_PROXY,
                        "sudo ln -sfn " + site.getAvailablePath() + " " + site.getEnabledPath(),
                        "sudo rm -f " + NginxSite.SITES_ENABLED + "default",
                        "sudo nginx -t"))
                .add(ServiceControl.of(REVERSE_PROXY, "nginx", "restart"))
                .add(ShellRaw.of(CERTIFICATE, "sudo certbot --nginx -n --agree-tos" +
                        " --email " + config.getAcmeEmail() +
                        " -d " + config.getDomainName() +
                        " --redirect"))
                .add(FileWrite.of(RENEWAL, CERTBOT_CRON_FILE, CERTBOT_CRON_LINE));

        LOGGER.debug("Composed boot script with {} steps for {}", script.getSteps().size(), config.getDomainName());
        return script;
    }
}
