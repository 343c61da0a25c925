package dev.pekelund.pricing.web;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.pricing.analysis.AnalysisResultStoreException;
import dev.pekelund.pricing.analysis.PageDetail;
import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.jobs.AnalysisJobStatus;
import dev.pekelund.pricing.quote.QuoteEmissionAdapter;
import dev.pekelund.pricing.quote.QuoteEmissionException;
import dev.pekelund.pricing.quote.QuoteEmitter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PricingSheetControllerTests {

    private static final String SHEET = "/api/batches/batch-1/sheet";

    private SheetFixtures fixtures;
    private QuoteEmitter quoteEmitter;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fixtures = new SheetFixtures();
        quoteEmitter = mock(QuoteEmitter.class);
        PricingSheetService service = new PricingSheetService(fixtures.factory, new QuoteEmissionAdapter(quoteEmitter));
        mockMvc = MockMvcBuilders.standaloneSetup(new PricingSheetController(service)).build();
    }

    @Test
    void openReturnsRowsAndTotals() throws Exception {
        mockMvc.perform(post(SHEET))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.batchId").value("batch-1"))
            .andExpect(jsonPath("$.hasUnsavedChanges").value(false))
            .andExpect(jsonPath("$.rows", hasSize(1)))
            .andExpect(jsonPath("$.rows[0].analysisId").value("a-1"))
            .andExpect(jsonPath("$.rows[0].billablePages").value(2.3))
            .andExpect(jsonPath("$.rows[0].defaultCertTypeId").value("notary"))
            .andExpect(jsonPath("$.totals.grandTotal").value(209.5))
            .andExpect(jsonPath("$.certificationTypes", hasSize(2)));
    }

    @Test
    void sheetMustBeOpenedBeforeUse() throws Exception {
        mockMvc.perform(get(SHEET))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error", notNullValue()));
    }

    @Test
    void editRecalculatesTotals() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(put(SHEET + "/rows/a-1/documents/1/certification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"certificationTypeId\":\"express\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hasUnsavedChanges").value(true))
            .andExpect(jsonPath("$.rows[0].hasPerDocCertOverrides").value(true))
            .andExpect(jsonPath("$.rows[0].certificationCost").value(80.0))
            .andExpect(jsonPath("$.totals.grandTotal").value(229.5));
    }

    @Test
    void editOfUnknownRowIsNotFound() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(put(SHEET + "/rows/missing/billable-pages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"billablePages\":3}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void unknownCertificationIsBadRequest() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(put(SHEET + "/rows/a-1/certification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"certificationTypeId\":\"apostille\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown certification type apostille"));
    }

    @Test
    void closingWithUnsavedChangesNeedsConfirmation() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());
        mockMvc.perform(post(SHEET + "/rows/a-1/toggle-excluded"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totals.grandTotal").value(0.0));

        mockMvc.perform(delete(SHEET)).andExpect(status().isConflict());
        mockMvc.perform(delete(SHEET).param("discardUnsaved", "true")).andExpect(status().isNoContent());
        mockMvc.perform(get(SHEET)).andExpect(status().isNotFound());
    }

    @Test
    void saveReportsSavedRows() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());
        mockMvc.perform(put(SHEET + "/rows/a-1/complexity")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"complexity\":\"hard\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows[0].billablePages").value(2.5));

        mockMvc.perform(post(SHEET + "/save"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requestedCount").value(1))
            .andExpect(jsonPath("$.savedIds[0]").value("a-1"))
            .andExpect(jsonPath("$.failures", hasSize(0)));

        mockMvc.perform(delete(SHEET)).andExpect(status().isNoContent());
    }

    @Test
    void manualDocumentsCanBeAddedAndRemoved() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(post(SHEET + "/manual-documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\":\"birth-certificate.jpg\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.analysisId", notNullValue()))
            .andExpect(jsonPath("$.sheet.rows", hasSize(2)));

        String manualId = fixtures.store.findByBatch("batch-1").get(1).id();
        mockMvc.perform(delete(SHEET + "/manual-documents/" + manualId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows", hasSize(1)))
            .andExpect(jsonPath("$.totals.grandTotal").value(209.5));
    }

    @Test
    void analysedDocumentsCannotBeDeleted() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(delete(SHEET + "/manual-documents/a-1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void startsAnalysisJob() throws Exception {
        when(fixtures.analysisService.submit(eq("batch-1"), anyList())).thenReturn(new AnalysisJob("job-1", "batch-1",
            AnalysisJobStatus.QUEUED, 1, 0, 0, 0, SheetFixtures.NOW, null));
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());
        mockMvc.perform(get(SHEET + "/analysis")).andExpect(status().isNoContent());

        mockMvc.perform(post(SHEET + "/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileIds\":[\"file-1\"]}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.id").value("job-1"))
            .andExpect(jsonPath("$.status").value("QUEUED"));

        mockMvc.perform(get(SHEET + "/analysis"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("job-1"));
    }

    @Test
    void refreshWithoutJobIsBadRequest() throws Exception {
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(post(SHEET + "/analysis/refresh")).andExpect(status().isBadRequest());
    }

    @Test
    void returnsPageDetailOfRow() throws Exception {
        when(fixtures.pageDetailSource.fetchPages("file-1")).thenReturn(List.of(new PageDetail("file-1", 1, 450, "medium")));
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(get(SHEET + "/rows/a-1/pages"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].wordCount").value(450));
    }

    @Test
    void quoteServiceFailureIsBadGateway() throws Exception {
        when(quoteEmitter.createQuote(any())).thenThrow(new QuoteEmissionException("Quote service integration is disabled"));
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(post(SHEET + "/quote"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("Quote service integration is disabled"));
    }

    @Test
    void storeFailureIsBadGateway() throws Exception {
        doThrow(new AnalysisResultStoreException("Firestore unavailable")).when(fixtures.store).insert(any());
        mockMvc.perform(post(SHEET)).andExpect(status().isOk());

        mockMvc.perform(post(SHEET + "/manual-documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\":\"scan.pdf\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("Firestore unavailable"));

        mockMvc.perform(get(SHEET))
            .andExpect(jsonPath("$.rows", hasSize(1)))
            .andExpect(jsonPath("$.hasUnsavedChanges").value(false));
    }
}
