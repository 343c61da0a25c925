package dev.pekelund.pricing.web;

import dev.pekelund.pricing.analysis.AnalysisResultStoreException;
import dev.pekelund.pricing.analysis.PageDetail;
import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.jobs.AnalysisServiceException;
import dev.pekelund.pricing.quote.QuoteEmissionException;
import dev.pekelund.pricing.quote.QuoteReference;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.sheet.PricingSheetException;
import dev.pekelund.pricing.sheet.PricingSheetSession;
import dev.pekelund.pricing.sheet.SaveResult;
import dev.pekelund.pricing.sheet.UnsavedChangesException;
import dev.pekelund.pricing.web.SheetRequests.ApiError;
import dev.pekelund.pricing.web.SheetRequests.BaseRateEdit;
import dev.pekelund.pricing.web.SheetRequests.BillablePagesEdit;
import dev.pekelund.pricing.web.SheetRequests.CertificationChange;
import dev.pekelund.pricing.web.SheetRequests.ComplexityEdit;
import dev.pekelund.pricing.web.SheetRequests.ExclusionChange;
import dev.pekelund.pricing.web.SheetRequests.LanguageMultiplierChange;
import dev.pekelund.pricing.web.SheetRequests.ManualDocument;
import dev.pekelund.pricing.web.SheetRequests.ManualDocumentCreated;
import dev.pekelund.pricing.web.SheetRequests.OpenSheet;
import dev.pekelund.pricing.web.SheetRequests.QuoteRequest;
import dev.pekelund.pricing.web.SheetRequests.StartAnalysis;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/batches/{batchId}/sheet")
public class PricingSheetController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PricingSheetController.class);

    private final PricingSheetService sheetService;

    public PricingSheetController(PricingSheetService sheetService) {
        this.sheetService = sheetService;
    }

    @PostMapping
    public SheetView open(@PathVariable String batchId, @RequestBody(required = false) OpenSheet request) {
        PricingSheetSession session = sheetService.open(batchId, request != null ? request.languageMultiplier() : null);
        return SheetView.of(session);
    }

    @GetMapping
    public SheetView get(@PathVariable String batchId) {
        return SheetView.of(sheetService.session(batchId));
    }

    @DeleteMapping
    public ResponseEntity<Void> close(@PathVariable String batchId,
        @RequestParam(name = "discardUnsaved", defaultValue = "false") boolean discardUnsaved) {
        sheetService.close(batchId, discardUnsaved);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/rows/{analysisId}/complexity")
    public SheetView editComplexity(@PathVariable String batchId, @PathVariable String analysisId,
        @RequestBody ComplexityEdit request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.editComplexity(analysisId, Complexity.fromValue(request.complexity()));
        return SheetView.of(session);
    }

    @PutMapping("/rows/{analysisId}/billable-pages")
    public SheetView editBillablePages(@PathVariable String batchId, @PathVariable String analysisId,
        @RequestBody BillablePagesEdit request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.editBillablePages(analysisId, request.billablePages());
        return SheetView.of(session);
    }

    @PutMapping("/rows/{analysisId}/base-rate")
    public SheetView editBaseRate(@PathVariable String batchId, @PathVariable String analysisId,
        @RequestBody BaseRateEdit request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.editBaseRate(analysisId, request.baseRate());
        return SheetView.of(session);
    }

    @PutMapping("/rows/{analysisId}/certification")
    public SheetView changeRowCertification(@PathVariable String batchId, @PathVariable String analysisId,
        @RequestBody CertificationChange request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.changeRowCertification(analysisId, request.certificationTypeId());
        return SheetView.of(session);
    }

    @PutMapping("/rows/{analysisId}/documents/{index}/certification")
    public SheetView changeDocumentCertification(@PathVariable String batchId, @PathVariable String analysisId,
        @PathVariable int index, @RequestBody CertificationChange request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.changeDocumentCertification(analysisId, index, request.certificationTypeId());
        return SheetView.of(session);
    }

    @PutMapping("/rows/{analysisId}/excluded")
    public SheetView setExcluded(@PathVariable String batchId, @PathVariable String analysisId,
        @RequestBody ExclusionChange request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.setExcluded(analysisId, request.excluded());
        return SheetView.of(session);
    }

    @PostMapping("/rows/{analysisId}/toggle-excluded")
    public SheetView toggleExcluded(@PathVariable String batchId, @PathVariable String analysisId) {
        PricingSheetSession session = sheetService.session(batchId);
        session.toggleExcluded(analysisId);
        return SheetView.of(session);
    }

    @GetMapping("/rows/{analysisId}/pages")
    public List<PageDetail> pageDetails(@PathVariable String batchId, @PathVariable String analysisId) {
        return sheetService.session(batchId).pageDetails(analysisId);
    }

    @PutMapping("/language-multiplier")
    public SheetView setLanguageMultiplier(@PathVariable String batchId,
        @RequestBody LanguageMultiplierChange request) {
        PricingSheetSession session = sheetService.session(batchId);
        session.setLanguageMultiplier(request.languageMultiplier());
        return SheetView.of(session);
    }

    @PostMapping("/manual-documents")
    public ResponseEntity<ManualDocumentCreated> addManualDocument(@PathVariable String batchId,
        @RequestBody(required = false) ManualDocument request) {
        PricingSheetSession session = sheetService.session(batchId);
        String analysisId = session.addManualDocument(request != null ? request.filename() : null);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new ManualDocumentCreated(analysisId, SheetView.of(session)));
    }

    @DeleteMapping("/manual-documents/{analysisId}")
    public SheetView deleteManualDocument(@PathVariable String batchId, @PathVariable String analysisId) {
        PricingSheetSession session = sheetService.session(batchId);
        session.deleteManualDocument(analysisId);
        return SheetView.of(session);
    }

    @PostMapping("/save")
    public SaveResult save(@PathVariable String batchId) {
        return sheetService.session(batchId).save();
    }

    @PostMapping("/reload")
    public SheetView reload(@PathVariable String batchId) {
        PricingSheetSession session = sheetService.session(batchId);
        session.reload();
        return SheetView.of(session);
    }

    @GetMapping("/analysis")
    public ResponseEntity<AnalysisJob> currentJob(@PathVariable String batchId) {
        return sheetService.session(batchId).currentJob()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/analysis")
    public ResponseEntity<AnalysisJob> startAnalysis(@PathVariable String batchId,
        @RequestBody StartAnalysis request) {
        AnalysisJob job = sheetService.session(batchId).startAnalysis(request.fileIds());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @PostMapping("/analysis/reanalyse")
    public ResponseEntity<AnalysisJob> reanalyse(@PathVariable String batchId) {
        AnalysisJob job = sheetService.session(batchId).reanalyse();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @PostMapping("/analysis/refresh")
    public AnalysisJob refreshJob(@PathVariable String batchId) {
        return sheetService.session(batchId).refreshJob();
    }

    @PostMapping("/quote")
    public ResponseEntity<QuoteReference> createQuote(@PathVariable String batchId,
        @RequestBody(required = false) QuoteRequest request) {
        QuoteReference reference = sheetService.createQuote(batchId, request != null ? request.jobId() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(reference);
    }

    @PutMapping("/quote/{quoteId}")
    public QuoteReference updateQuote(@PathVariable String batchId, @PathVariable String quoteId,
        @RequestBody(required = false) QuoteRequest request) {
        return sheetService.updateQuote(batchId, quoteId, request != null ? request.jobId() : null);
    }

    @ExceptionHandler(SheetNotOpenException.class)
    public ResponseEntity<ApiError> handleSheetNotOpen(SheetNotOpenException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError(ex.getMessage()));
    }

    @ExceptionHandler(PricingSheetException.class)
    public ResponseEntity<ApiError> handleSheetError(PricingSheetException ex) {
        HttpStatus status = ex.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(new ApiError(ex.getMessage()));
    }

    @ExceptionHandler(UnsavedChangesException.class)
    public ResponseEntity<ApiError> handleUnsavedChanges(UnsavedChangesException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ApiError(ex.getMessage()));
    }

    @ExceptionHandler({AnalysisResultStoreException.class, AnalysisServiceException.class,
        QuoteEmissionException.class})
    public ResponseEntity<ApiError> handleUpstreamFailure(RuntimeException ex) {
        LOGGER.error("Pricing sheet request failed on an upstream service", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ApiError(ex.getMessage()));
    }
}
