package dev.pekelund.pricing.firestore;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.pekelund.pricing.settings.PricingSettings;
import dev.pekelund.pricing.settings.PricingSettingsProvider;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Reads billing settings from key/value documents. Keys missing from the collection keep the
 * configured defaults.
 */
@Service
@ConditionalOnProperty(value = "firestore.enabled", havingValue = "true")
public class FirestorePricingSettingsProvider implements PricingSettingsProvider {

    private static final Logger log = LoggerFactory.getLogger(FirestorePricingSettingsProvider.class);

    private final Firestore firestore;
    private final FirestoreProperties properties;
    private final PricingSettings fallback;

    public FirestorePricingSettingsProvider(Firestore firestore, FirestoreProperties properties,
        PricingSettings fallback) {
        this.firestore = firestore;
        this.properties = properties;
        this.fallback = fallback;
    }

    @Override
    public PricingSettings loadSettings() {
        try {
            QuerySnapshot snapshot = firestore.collection(properties.getSettingsCollection()).get().get();
            return PricingSettings.fromValues(toValues(snapshot), fallback);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading pricing settings from Firestore.", ex);
        } catch (ExecutionException ex) {
            log.error("Failed to load pricing settings from Firestore", ex);
            throw new IllegalStateException("Failed to load pricing settings from Firestore.", ex);
        }
    }

    private Map<String, String> toValues(QuerySnapshot snapshot) {
        Map<String, String> values = new HashMap<>();
        if (snapshot == null) {
            return values;
        }
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            Map<String, Object> data = document.getData();
            String key = AnalysisResultDocumentMapper.asString(AnalysisResultDocumentMapper.field(data, "setting_key"));
            if (!StringUtils.hasText(key)) {
                key = document.getId();
            }
            Object value = AnalysisResultDocumentMapper.field(data, "setting_value");
            if (value == null) {
                value = data.get("value");
            }
            String text = AnalysisResultDocumentMapper.asString(value);
            if (text != null) {
                values.put(key.trim(), text);
            }
        }
        return values;
    }
}
