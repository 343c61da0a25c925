package dev.pekelund.pricing.sheet;

import dev.pekelund.pricing.analysis.AnalysisResult;
import java.util.Objects;

/**
 * Side effect a sheet transition asks its session to carry out against the record store.
 */
public interface SheetEffect {

    String analysisId();

    record InsertAnalysisResult(AnalysisResult result) implements SheetEffect {

        public InsertAnalysisResult {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public String analysisId() {
            return result.id();
        }
    }

    record DeleteAnalysisResult(String batchId, String analysisId) implements SheetEffect {
    }
}
