package dev.pekelund.pricing.gcp;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.IdTokenCredentials;
import com.google.auth.oauth2.IdTokenProvider;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import org.springframework.util.StringUtils;

/**
 * Mints Google ID tokens for service-to-service calls to Cloud Run services. Credentials are
 * created once per audience holder and refreshed when they expire.
 */
public class ServiceIdTokenProvider {

    private final String audience;
    private final BiFunction<String, Throwable, ? extends RuntimeException> errorFactory;
    private final AtomicReference<IdTokenCredentials> cachedCredentials = new AtomicReference<>();

    public ServiceIdTokenProvider(String audience, BiFunction<String, Throwable, ? extends RuntimeException> errorFactory) {
        this.audience = audience;
        this.errorFactory = errorFactory;
    }

    public String fetchIdToken() {
        try {
            IdTokenCredentials credentials = cachedCredentials.updateAndGet(existing -> {
                if (existing != null) {
                    return existing;
                }
                return buildCredentials();
            });
            credentials.refreshIfExpired();
            AccessToken token = credentials.getAccessToken();
            if (token == null || !StringUtils.hasText(token.getTokenValue())) {
                throw errorFactory.apply("Failed to obtain ID token for " + audience, null);
            }
            return token.getTokenValue();
        } catch (IOException ex) {
            throw errorFactory.apply("Unable to obtain ID token for " + audience, ex);
        }
    }

    private IdTokenCredentials buildCredentials() {
        try {
            GoogleCredentials googleCredentials = GoogleCredentials.getApplicationDefault();
            if (!(googleCredentials instanceof IdTokenProvider idTokenProvider)) {
                throw errorFactory.apply(
                    "Default Google credentials do not support ID tokens. Disable use-id-token for " + audience + ".",
                    null);
            }
            return IdTokenCredentials.newBuilder()
                .setIdTokenProvider(idTokenProvider)
                .setTargetAudience(audience)
                .build();
        } catch (IOException ex) {
            throw errorFactory.apply("Unable to initialize Google credentials for " + audience, ex);
        }
    }
}
