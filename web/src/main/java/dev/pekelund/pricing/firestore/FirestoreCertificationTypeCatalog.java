package dev.pekelund.pricing.firestore;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.certification.CertificationTypeCatalog;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(value = "firestore.enabled", havingValue = "true")
public class FirestoreCertificationTypeCatalog implements CertificationTypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(FirestoreCertificationTypeCatalog.class);

    private final Firestore firestore;
    private final FirestoreProperties properties;

    public FirestoreCertificationTypeCatalog(Firestore firestore, FirestoreProperties properties) {
        this.firestore = firestore;
        this.properties = properties;
    }

    @Override
    public List<CertificationType> listActiveTypes() {
        try {
            QuerySnapshot snapshot = firestore.collection(properties.getCertificationTypesCollection()).get().get();
            List<CertificationType> types = new ArrayList<>();
            if (snapshot != null) {
                for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
                    CertificationType type = toCertificationType(document.getId(), document.getData());
                    if (type.active()) {
                        types.add(type);
                    }
                }
            }
            types.sort(Comparator.comparingInt(CertificationType::sortOrder).thenComparing(CertificationType::id));
            return List.copyOf(types);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading certification types from Firestore.", ex);
        } catch (ExecutionException ex) {
            log.error("Failed to load certification types from Firestore", ex);
            throw new IllegalStateException("Failed to load certification types from Firestore.", ex);
        }
    }

    static CertificationType toCertificationType(String documentId, Map<String, Object> data) {
        BigDecimal price = AnalysisResultDocumentMapper.toDecimal(data.get("price"));
        if (price == null) {
            price = AnalysisResultDocumentMapper.toDecimal(AnalysisResultDocumentMapper.field(data, "unit_price"));
        }
        Object active = AnalysisResultDocumentMapper.field(data, "is_active");
        if (active == null) {
            active = data.get("active");
        }
        return new CertificationType(
            documentId,
            AnalysisResultDocumentMapper.asString(data.get("name")),
            AnalysisResultDocumentMapper.asString(data.get("code")),
            price,
            active == null || AnalysisResultDocumentMapper.toBoolean(active),
            AnalysisResultDocumentMapper.toInt(AnalysisResultDocumentMapper.field(data, "sort_order")));
    }
}
