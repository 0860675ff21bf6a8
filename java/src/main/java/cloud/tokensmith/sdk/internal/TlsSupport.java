package cloud.tokensmith.sdk.internal;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.logging.Logger;

/**
 * Builds {@link SSLContext}s for the {@code verify} option: a PEM CA bundle, or no verification at all.
 */
public final class TlsSupport {

    private static final Logger LOGGER = Logger.getLogger(TlsSupport.class.getName());

    private TlsSupport() {
    }

    /**
     * Trusts exactly the certificates found in the given PEM bundle.
     */
    public static SSLContext fromCaBundle(Path caBundle) {
        try (InputStream in = Files.newInputStream(caBundle)) {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            Collection<? extends Certificate> certificates = factory.generateCertificates(in);
            if (certificates.isEmpty()) {
                throw new IllegalArgumentException("CA bundle contains no certificates: " + caBundle);
            }

            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            int index = 0;
            for (Certificate certificate : certificates) {
                trustStore.setCertificateEntry("ca-" + index++, certificate);
            }

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), new SecureRandom());
            return context;
        } catch (IOException | GeneralSecurityException ex) {
            throw new IllegalArgumentException("Invalid CA bundle " + caBundle + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Accepts any server certificate. Host names are still checked by the JDK client unless
     * {@code jdk.internal.httpclient.disableHostnameVerification} is set.
     */
    public static SSLContext trustAll() {
        LOGGER.warning(() -> "[tokensmith] TLS certificate verification is disabled");
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("cannot initialise TLS context: " + ex.getMessage(), ex);
        }
    }

    private static final class TrustAllManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // accept
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // accept
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
