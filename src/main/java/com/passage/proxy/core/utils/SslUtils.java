package com.passage.proxy.core.utils;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import com.passage.proxy.core.exceptions.ConfigException;

/**
 * Provides utility methods for creating SSL contexts for upstream connections.
 */
public class SslUtils {

    /** System property read by the JDK HTTP client when it is first loaded. */
    public static final String DISABLE_HOSTNAME_VERIFICATION = "jdk.internal.httpclient.disableHostnameVerification";

    private SslUtils() {
        // Utility class
    }

    /**
     * Creates an {@link SSLContext} that accepts any server certificate.
     * Used only when {@code upstream.insecureSkipVerify} is enabled.
     * 
     * @return An initialized SSL context with a trust-all manager.
     * @throws ConfigException If the JVM cannot provide a TLS context.
     */
    public static SSLContext createTrustAllContext() {
        TrustManager[] trustAll = { new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
                // accept everything
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
                // accept everything
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        } };

        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustAll, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new ConfigException("Unable to create insecure TLS context: " + e.getMessage(), e);
        }
    }

    /**
     * Turns off hostname verification in the JDK HTTP client. The flag is read
     * once per JVM, so this only takes effect before the first client is built.
     */
    public static void disableHostnameVerification() {
        System.setProperty(DISABLE_HOSTNAME_VERIFICATION, "true");
    }
}
