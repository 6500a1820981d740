package com.ilmarlopez.plausible.bootstrap;

public class NginxSite {

    public static final String SITES_AVAILABLE = "/etc/nginx/sites-available/";
    public static final String SITES_ENABLED = "/etc/nginx/sites-enabled/";

    private final String name;
    private final String serverName;
    private final int upstreamPort;

    public NginxSite(String name, String serverName, int upstreamPort) {
        this.name = name;
        this.serverName = serverName;
        this.upstreamPort = upstreamPort;
    }

    public String getAvailablePath() {
        return SITES_AVAILABLE + name;
    }

    public String getEnabledPath() {
        return SITES_ENABLED + name;
    }

    public String render() {
        return "server {\n" +
                "    listen 80;\n" +
                "    server_name " + serverName + ";\n" +
                "\n" +
                "    location / {\n" +
                "        proxy_pass http://localhost:" + upstreamPort + ";\n" +
                "        proxy_set_header Host $host;\n" +
                "        proxy_set_header X-Real-IP $remote_addr;\n" +
                "        proxy_set_header X-Forwarded-For $proxy_add_x_forwarded_for;\n" +
                "        proxy_set_header X-Forwarded-Proto $scheme;\n" +
                "    }\n" +
                "}\n";
    }
}
