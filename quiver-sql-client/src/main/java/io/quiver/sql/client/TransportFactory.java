package io.quiver.sql.client;

import io.quiver.sql.common.errors.ConfigurationException;
import org.apache.arrow.flight.FlightClient;
import org.apache.arrow.flight.Location;
import org.apache.arrow.memory.BufferAllocator;

import javax.net.ssl.TrustManagerFactory;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Picks the transport for a {@link HostUrl} and builds Flight clients on it.
 * Secure hosts get TLS verified against the system trust store, {@code http://} hosts get plaintext.
 */
final class TransportFactory {

    @FunctionalInterface
    interface TrustStoreLoader {
        void load() throws GeneralSecurityException;
    }

    /**
     * Only checks that the system trust store can be loaded; the Flight client builds its own trust chain.
     */
    static final TrustStoreLoader SYSTEM_TRUST_STORE = () ->
            TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm()).init((KeyStore) null);

    private final Location location;
    private final boolean tls;
    private final boolean verifyServer;

    private TransportFactory(Location location, boolean tls, boolean verifyServer) {
        this.location = location;
        this.tls = tls;
        this.verifyServer = verifyServer;
    }

    static TransportFactory create(HostUrl url, boolean disableServerCertificateVerification) {
        return create(url, disableServerCertificateVerification, SYSTEM_TRUST_STORE);
    }

    static TransportFactory create(HostUrl url, boolean disableServerCertificateVerification,
                                   TrustStoreLoader trustStoreLoader) {
        if (!url.isSecure()) {
            return new TransportFactory(Location.forGrpcInsecure(url.host(), url.port()), false, false);
        }
        if (!disableServerCertificateVerification) {
            try {
                trustStoreLoader.load();
            } catch (GeneralSecurityException e) {
                throw new ConfigurationException("x509: " + e.getMessage(), e);
            }
        }
        return new TransportFactory(Location.forGrpcTls(url.host(), url.port()), true,
                !disableServerCertificateVerification);
    }

    FlightClient newClient(BufferAllocator allocator) {
        var builder = FlightClient.builder(allocator, location);
        if (tls && !verifyServer) {
            builder.verifyServer(false);
        }
        return builder.build();
    }

    Location getLocation() {
        return location;
    }

    boolean isTls() {
        return tls;
    }

    boolean verifiesServer() {
        return verifyServer;
    }
}
