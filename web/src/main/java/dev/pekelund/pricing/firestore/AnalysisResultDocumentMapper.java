package dev.pekelund.pricing.firestore;

import com.google.cloud.Timestamp;
import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.EntryMethod;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.analysis.ProcessingStatus;
import dev.pekelund.pricing.analysis.SnapshotCertification;
import dev.pekelund.pricing.analysis.SubDocument;
import dev.pekelund.pricing.settings.Complexity;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Converts analysis record documents to and from {@link AnalysisResult}. Documents written by
 * older clients use camelCase field names; both spellings are read and snake_case is written.
 */
final class AnalysisResultDocumentMapper {

    static final String BATCH_ID = "batch_id";
    static final String BATCH_ID_LEGACY = "batchId";
    static final String CREATED_AT = "created_at";

    static final String PRICING_BILLABLE_PAGES = "pricing_billable_pages";
    static final String PRICING_COMPLEXITY = "pricing_complexity";
    static final String PRICING_COMPLEXITY_MULTIPLIER = "pricing_complexity_multiplier";
    static final String PRICING_BASE_RATE = "pricing_base_rate";
    static final String PRICING_CERTIFICATION_TYPE_ID = "pricing_certification_type_id";
    static final String PRICING_IS_EXCLUDED = "pricing_is_excluded";
    static final String PRICING_IS_BILLABLE_OVERRIDDEN = "pricing_is_billable_overridden";
    static final String PRICING_DOCUMENT_CERTIFICATIONS = "pricing_document_certifications";
    static final String PRICING_SAVED_AT = "pricing_saved_at";

    private AnalysisResultDocumentMapper() {
    }

    static AnalysisResult fromDocument(String documentId, Map<String, Object> data) {
        Map<String, Object> fields = data != null ? data : Map.of();
        return new AnalysisResult(
            documentId,
            asString(field(fields, BATCH_ID)),
            asString(field(fields, "file_id")),
            asString(field(fields, "original_filename")),
            toInt(field(fields, "word_count")),
            toInt(field(fields, "page_count")),
            asString(field(fields, "document_type")),
            Complexity.fromValue(asString(field(fields, "complexity"))),
            toInt(field(fields, "document_count")),
            toSubDocuments(field(fields, "sub_documents")),
            asString(field(fields, "detected_language")),
            asString(field(fields, "issuing_country")),
            ProcessingStatus.fromValue(asString(field(fields, "processing_status"))),
            EntryMethod.fromValue(asString(field(fields, "entry_method"))),
            asString(field(fields, "error_message")),
            toSnapshot(fields));
    }

    static Map<String, Object> toDocument(AnalysisResult result, Instant createdAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(BATCH_ID, result.batchId());
        data.put("file_id", result.fileId());
        data.put("original_filename", result.originalFilename());
        data.put("word_count", result.wordCount());
        data.put("page_count", result.pageCount());
        data.put("document_type", result.documentType());
        data.put("complexity", result.complexity().value());
        data.put("document_count", result.documentCount());
        data.put("sub_documents", fromSubDocuments(result.subDocuments()));
        data.put("detected_language", result.detectedLanguage());
        data.put("issuing_country", result.issuingCountry());
        data.put("processing_status", result.processingStatus().value());
        data.put("entry_method", result.entryMethod().value());
        data.put("error_message", result.errorMessage());
        data.put(CREATED_AT, toTimestamp(createdAt));
        if (result.pricingSnapshot() != null) {
            data.putAll(toPricingFields(result.pricingSnapshot()));
        }
        return data;
    }

    /**
     * Pricing snapshot fields to merge into an existing record. Sub-document certifications are
     * cleared when the row used its default certification throughout.
     */
    static Map<String, Object> toPricingFields(PricingSnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PRICING_BILLABLE_PAGES, toDouble(snapshot.billablePages()));
        data.put(PRICING_COMPLEXITY, snapshot.complexity() != null ? snapshot.complexity().value() : null);
        data.put(PRICING_COMPLEXITY_MULTIPLIER, toDouble(snapshot.complexityMultiplier()));
        data.put(PRICING_BASE_RATE, toDouble(snapshot.baseRate()));
        data.put(PRICING_CERTIFICATION_TYPE_ID, snapshot.certificationTypeId());
        data.put(PRICING_IS_EXCLUDED, snapshot.excluded());
        data.put(PRICING_IS_BILLABLE_OVERRIDDEN, snapshot.billableOverridden());
        if (snapshot.hasDocumentCertifications()) {
            List<Map<String, Object>> certifications = new ArrayList<>();
            for (SnapshotCertification certification : snapshot.documentCertifications()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("index", certification.index());
                entry.put("certification_type_id", certification.certificationTypeId());
                entry.put("price", toDouble(certification.price()));
                certifications.add(entry);
            }
            data.put(PRICING_DOCUMENT_CERTIFICATIONS, certifications);
        } else {
            data.put(PRICING_DOCUMENT_CERTIFICATIONS, null);
        }
        data.put(PRICING_SAVED_AT, toTimestamp(snapshot.savedAt()));
        return data;
    }

    static Instant createdAt(Map<String, Object> data) {
        return data != null ? toInstant(field(data, CREATED_AT)) : null;
    }

    private static PricingSnapshot toSnapshot(Map<String, Object> fields) {
        Instant savedAt = toInstant(field(fields, PRICING_SAVED_AT));
        if (savedAt == null) {
            return null;
        }
        String complexity = asString(field(fields, PRICING_COMPLEXITY));
        return new PricingSnapshot(
            toDecimal(field(fields, PRICING_BILLABLE_PAGES)),
            StringUtils.hasText(complexity) ? Complexity.fromValue(complexity) : null,
            toDecimal(field(fields, PRICING_COMPLEXITY_MULTIPLIER)),
            toDecimal(field(fields, PRICING_BASE_RATE)),
            asString(field(fields, PRICING_CERTIFICATION_TYPE_ID)),
            toBoolean(field(fields, PRICING_IS_EXCLUDED)),
            toBoolean(field(fields, PRICING_IS_BILLABLE_OVERRIDDEN)),
            toSnapshotCertifications(field(fields, PRICING_DOCUMENT_CERTIFICATIONS)),
            savedAt);
    }

    private static List<SnapshotCertification> toSnapshotCertifications(Object value) {
        if (!(value instanceof List<?> list)) {
            return null;
        }
        List<SnapshotCertification> certifications = new ArrayList<>();
        for (Object element : list) {
            Map<String, Object> entry = toStringObjectMap(element);
            if (entry.isEmpty()) {
                continue;
            }
            certifications.add(new SnapshotCertification(
                toInt(field(entry, "index")),
                asString(field(entry, "certification_type_id")),
                toDecimal(field(entry, "price"))));
        }
        return certifications;
    }

    private static List<SubDocument> toSubDocuments(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<SubDocument> subDocuments = new ArrayList<>();
        for (Object element : list) {
            Map<String, Object> entry = toStringObjectMap(element);
            if (entry.isEmpty()) {
                continue;
            }
            Object type = entry.containsKey("type") ? entry.get("type") : field(entry, "document_type");
            subDocuments.add(new SubDocument(
                asString(type),
                asString(field(entry, "holder_name")),
                asString(field(entry, "page_range")),
                asString(field(entry, "language"))));
        }
        return subDocuments;
    }

    private static List<Map<String, Object>> fromSubDocuments(List<SubDocument> subDocuments) {
        List<Map<String, Object>> values = new ArrayList<>();
        for (SubDocument subDocument : subDocuments) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", subDocument.type());
            entry.put("holder_name", subDocument.holderName());
            entry.put("page_range", subDocument.pageRange());
            entry.put("language", subDocument.language());
            values.add(entry);
        }
        return values;
    }

    /**
     * Look up a snake_case field, falling back to its camelCase spelling.
     */
    static Object field(Map<String, Object> data, String snakeCaseName) {
        if (data.containsKey(snakeCaseName)) {
            return data.get(snakeCaseName);
        }
        return data.get(toCamelCase(snakeCaseName));
    }

    static String toCamelCase(String snakeCaseName) {
        StringBuilder builder = new StringBuilder(snakeCaseName.length());
        boolean upperNext = false;
        for (char c : snakeCaseName.toCharArray()) {
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                builder.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    static String asString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return StringUtils.hasText(text) ? text : null;
    }

    static int toInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return new BigDecimal(text.trim()).intValue();
            } catch (NumberFormatException ex) {
                return 0;
            }
        }
        return 0;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value instanceof String text && Boolean.parseBoolean(text.trim());
    }

    static Instant toInstant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return Instant.parse(text.trim());
            } catch (DateTimeParseException ex) {
                return null;
            }
        }
        return null;
    }

    static Map<String, Object> toStringObjectMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object key = entry.getKey();
            if (key == null) {
                continue;
            }
            result.put(key.toString(), entry.getValue());
        }
        return result;
    }

    private static Double toDouble(BigDecimal value) {
        return value != null ? value.doubleValue() : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        if (instant == null) {
            return null;
        }
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }
}
