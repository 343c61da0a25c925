package dev.pekelund.pricing.firestore;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.AnalysisResultStore;
import dev.pekelund.pricing.analysis.AnalysisResultStoreException;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Analysis records kept in a single Firestore collection keyed by analysis id. Records are
 * matched to their batch through the {@code batch_id} field, or {@code batchId} on records
 * written by older clients.
 */
@Service
@ConditionalOnProperty(value = "firestore.enabled", havingValue = "true")
public class FirestoreAnalysisResultStore implements AnalysisResultStore {

    private static final Logger log = LoggerFactory.getLogger(FirestoreAnalysisResultStore.class);

    private static final Comparator<Entry> DISPLAY_ORDER = Comparator
        .comparing(Entry::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(entry -> entry.result().id());

    private final Firestore firestore;
    private final FirestoreProperties properties;
    private final Clock clock;

    public FirestoreAnalysisResultStore(Firestore firestore, FirestoreProperties properties, Clock clock) {
        this.firestore = firestore;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<AnalysisResult> findByBatch(String batchId) {
        if (!StringUtils.hasText(batchId)) {
            return List.of();
        }
        try {
            Map<String, Entry> entries = new LinkedHashMap<>();
            collectBatch(entries, AnalysisResultDocumentMapper.BATCH_ID, batchId);
            collectBatch(entries, AnalysisResultDocumentMapper.BATCH_ID_LEGACY, batchId);

            List<Entry> ordered = new ArrayList<>(entries.values());
            ordered.sort(DISPLAY_ORDER);
            List<AnalysisResult> results = new ArrayList<>(ordered.size());
            for (Entry entry : ordered) {
                results.add(entry.result());
            }
            log.debug("Loaded {} analysis record(s) of batch {}", results.size(), batchId);
            return List.copyOf(results);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while loading analysis records of batch {} from Firestore", batchId, ex);
            throw new AnalysisResultStoreException("Interrupted while loading analysis records from Firestore.", ex);
        } catch (ExecutionException ex) {
            log.error("Failed to load analysis records of batch {} from Firestore", batchId, ex);
            throw new AnalysisResultStoreException("Failed to load analysis records from Firestore.", ex);
        }
    }

    @Override
    public Optional<AnalysisResult> findById(String batchId, String analysisId) {
        if (!StringUtils.hasText(analysisId)) {
            return Optional.empty();
        }
        try {
            DocumentSnapshot snapshot = document(analysisId).get().get();
            if (snapshot == null || !snapshot.exists()) {
                return Optional.empty();
            }
            AnalysisResult result = AnalysisResultDocumentMapper.fromDocument(snapshot.getId(), snapshot.getData());
            if (batchId != null && !Objects.equals(batchId, result.batchId())) {
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnalysisResultStoreException("Interrupted while loading analysis record from Firestore.", ex);
        } catch (ExecutionException ex) {
            log.error("Failed to load analysis record {} from Firestore", analysisId, ex);
            throw new AnalysisResultStoreException("Failed to load analysis record from Firestore.", ex);
        }
    }

    @Override
    public void insert(AnalysisResult result) {
        Objects.requireNonNull(result, "result");
        try {
            document(result.id()).set(AnalysisResultDocumentMapper.toDocument(result, clock.instant())).get();
            log.info("Stored analysis record {} of batch {}", result.id(), result.batchId());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnalysisResultStoreException("Interrupted while storing analysis record in Firestore.", ex);
        } catch (ExecutionException ex) {
            log.error("Failed to store analysis record {} in Firestore", result.id(), ex);
            throw new AnalysisResultStoreException("Failed to store analysis record in Firestore.", ex);
        }
    }

    @Override
    public void updatePricing(String batchId, String analysisId, PricingSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        try {
            // update() fails for missing documents, so a deleted record is reported instead of recreated.
            document(analysisId).update(AnalysisResultDocumentMapper.toPricingFields(snapshot)).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnalysisResultStoreException("Interrupted while saving pricing to Firestore.", ex);
        } catch (ExecutionException ex) {
            throw new AnalysisResultStoreException("Failed to save pricing of analysis " + analysisId + " to Firestore.", ex);
        }
    }

    @Override
    public void delete(String batchId, String analysisId) {
        try {
            document(analysisId).delete().get();
            log.info("Deleted analysis record {} of batch {}", analysisId, batchId);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnalysisResultStoreException("Interrupted while deleting analysis record from Firestore.", ex);
        } catch (ExecutionException ex) {
            log.error("Failed to delete analysis record {} from Firestore", analysisId, ex);
            throw new AnalysisResultStoreException("Failed to delete analysis record from Firestore.", ex);
        }
    }

    private void collectBatch(Map<String, Entry> entries, String field, String batchId)
        throws InterruptedException, ExecutionException {
        QuerySnapshot snapshot = collection().whereEqualTo(field, batchId).get().get();
        if (snapshot == null) {
            return;
        }
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            if (entries.containsKey(document.getId())) {
                continue;
            }
            Map<String, Object> data = document.getData();
            entries.put(document.getId(), new Entry(
                AnalysisResultDocumentMapper.fromDocument(document.getId(), data),
                AnalysisResultDocumentMapper.createdAt(data)));
        }
    }

    private CollectionReference collection() {
        return firestore.collection(properties.getAnalysisResultsCollection());
    }

    private DocumentReference document(String analysisId) {
        return collection().document(analysisId);
    }

    private record Entry(AnalysisResult result, Instant createdAt) {
    }
}
