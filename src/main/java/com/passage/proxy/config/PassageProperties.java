package com.passage.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the Passage proxy.
 * Maps to the top-level structure of application.yml.
 */
public class PassageProperties {
    /**
     * Listener settings.
     */
    private ServerConfig server = new ServerConfig();

    /**
     * How upstream sites are fetched.
     */
    private UpstreamConfig upstream = new UpstreamConfig();

    /**
     * Link rewriting options.
     */
    private RewriteConfig rewrite = new RewriteConfig();

    /**
     * Access log configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public UpstreamConfig getUpstream() {
        return upstream;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setUpstream(UpstreamConfig upstream) {
        this.upstream = upstream;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RewriteConfig getRewrite() {
        return rewrite;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRewrite(RewriteConfig rewrite) {
        this.rewrite = rewrite;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }
}
