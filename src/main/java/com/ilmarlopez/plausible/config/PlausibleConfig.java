package com.ilmarlopez.plausible.config;

/**
 * Deployment parameters of the Plausible host. Defaults match the analytics.ilmarlopez.com deployment.
 */
public class PlausibleConfig {

    public static final String DOMAIN_NAME = "domainName";
    public static final String ACME_EMAIL = "acmeEmail";
    public static final String REPOSITORY_URL = "repositoryUrl";
    public static final String KEY_PAIR_NAME = "keyPairName";
    public static final String IMAGE_NAME = "imageName";
    public static final String IMAGE_OWNER = "imageOwner";
    public static final String MULTIPART_USER_DATA = "multipartUserData";

    public static final String DEFAULT_DOMAIN_NAME = "analytics.ilmarlopez.com";
    public static final String DEFAULT_ACME_EMAIL = "me@ilmarlopez.com";
    public static final String DEFAULT_REPOSITORY_URL = "https://github.com/IlmarLopez/plausible-hosting.git";
    public static final String DEFAULT_KEY_PAIR_NAME = "plausible-keypair";
    public static final String DEFAULT_IMAGE_NAME = "ubuntu/images/hvm-ssd/ubuntu-focal-20.04-amd64-server-*";
    // Canonical
    public static final String DEFAULT_IMAGE_OWNER = "099720109477";

    private final String domainName;
    private final String acmeEmail;
    private final String repositoryUrl;
    private final String checkoutParent;
    private final String checkoutDirectory;
    private final String keyPairName;
    private final String imageName;
    private final String imageOwner;
    private final String secretNamespace;
    private final int proxyPort;
    private final boolean multipartUserData;

    private PlausibleConfig(Builder builder) {
        domainName = requireNonEmpty(builder.domainName, DOMAIN_NAME);
        acmeEmail = requireNonEmpty(builder.acmeEmail, ACME_EMAIL);
        repositoryUrl = requireNonEmpty(builder.repositoryUrl, REPOSITORY_URL);
        checkoutParent = requireNonEmpty(builder.checkoutParent, "checkoutParent");
        checkoutDirectory = checkoutDirectory(repositoryUrl);
        keyPairName = requireNonEmpty(builder.keyPairName, KEY_PAIR_NAME);
        imageName = requireNonEmpty(builder.imageName, IMAGE_NAME);
        imageOwner = requireNonEmpty(builder.imageOwner, IMAGE_OWNER);
        secretNamespace = requireNonEmpty(builder.secretNamespace, "secretNamespace");
        if (builder.proxyPort < 1 || builder.proxyPort > 65535) {
            throw new IllegalArgumentException("proxyPort out of range: " + builder.proxyPort);
        }
        proxyPort = builder.proxyPort;
        multipartUserData = builder.multipartUserData;
    }

    public static PlausibleConfig from(AppContext context) {
        return builder()
                .domainName(context.getStringOrDefault(DOMAIN_NAME, DEFAULT_DOMAIN_NAME))
                .acmeEmail(context.getStringOrDefault(ACME_EMAIL, DEFAULT_ACME_EMAIL))
                .repositoryUrl(context.getStringOrDefault(REPOSITORY_URL, DEFAULT_REPOSITORY_URL))
                .keyPairName(context.getStringOrDefault(KEY_PAIR_NAME, DEFAULT_KEY_PAIR_NAME))
                .imageName(context.getStringOrDefault(IMAGE_NAME, DEFAULT_IMAGE_NAME))
                .imageOwner(context.getStringOrDefault(IMAGE_OWNER, DEFAULT_IMAGE_OWNER))
                .multipartUserData(context.getBooleanOrDefault(MULTIPART_USER_DATA, false))
                .build();
    }

    public static PlausibleConfig defaults() {
        return from(AppContext.empty());
    }

    public String getDomainName() {
        return domainName;
    }

    public String getBaseUrl() {
        return "https://" + domainName;
    }

    public String getAcmeEmail() {
        return acmeEmail;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public String getCheckoutParent() {
        return checkoutParent;
    }

    public String getCheckoutDirectory() {
        return checkoutDirectory;
    }

    /**
     * Directory git creates when cloning, ie. the last path segment without ".git".
     * Handles scp-style URLs such as git@github.com:owner/repo.git.
     */
    private static String checkoutDirectory(String repositoryUrl) {
        String path = repositoryUrl;
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String name = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf(':')) + 1);
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - ".git".length());
        }
        if (name.isEmpty()) {
            throw new InvalidConfigurationException(REPOSITORY_URL, repositoryUrl, "a URL ending in a repository name");
        }
        return name;
    }

    public String getKeyPairName() {
        return keyPairName;
    }

    public String getImageName() {
        return imageName;
    }

    public String getImageOwner() {
        return imageOwner;
    }

    public String getSecretNamespace() {
        return secretNamespace;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    public boolean isMultipartUserData() {
        return multipartUserData;
    }

    private static String requireNonEmpty(String value, String key) {
        if (value == null || value.trim().isEmpty()) {
            throw new MissingConfigurationException(key, "context");
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "PlausibleConfig{" +
                "domainName='" + domainName + '\'' +
                ", acmeEmail='" + acmeEmail + '\'' +
                ", repositoryUrl='" + repositoryUrl + '\'' +
                ", keyPairName='" + keyPairName + '\'' +
                ", imageName='" + imageName + '\'' +
                ", imageOwner='" + imageOwner + '\'' +
                ", proxyPort=" + proxyPort +
                ", multipartUserData=" + multipartUserData +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String domainName = DEFAULT_DOMAIN_NAME;
        private String acmeEmail = DEFAULT_ACME_EMAIL;
        private String repositoryUrl = DEFAULT_REPOSITORY_URL;
        private String checkoutParent = "/home/ubuntu";
        private String keyPairName = DEFAULT_KEY_PAIR_NAME;
        private String imageName = DEFAULT_IMAGE_NAME;
        private String imageOwner = DEFAULT_IMAGE_OWNER;
        private String secretNamespace = "plausible";
        private int proxyPort = 8000;
        private boolean multipartUserData;

        private Builder() {
        }

        public Builder domainName(String domainName) {
            this.domainName = domainName;
            return this;
        }

        public Builder acmeEmail(String acmeEmail) {
            this.acmeEmail = acmeEmail;
            return this;
        }

        public Builder repositoryUrl(String repositoryUrl) {
            this.repositoryUrl = repositoryUrl;
            return this;
        }

        public Builder checkoutParent(String checkoutParent) {
            this.checkoutParent = checkoutParent;
            return this;
        }

        public Builder keyPairName(String keyPairName) {
            this.keyPairName = keyPairName;
            return this;
        }

        public Builder imageName(String imageName) {
            this.imageName = imageName;
            return this;
        }

        public Builder imageOwner(String imageOwner) {
            this.imageOwner = imageOwner;
            return this;
        }

        public Builder secretNamespace(String secretNamespace) {
            this.secretNamespace = secretNamespace;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder multipartUserData(boolean multipartUserData) {
            this.multipartUserData = multipartUserData;
            return this;
        }

        public PlausibleConfig build() {
            return new PlausibleConfig(this);
        }
    }
}
