package dev.pekelund.pricing.firestore;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "firestore")
public class FirestoreProperties {

    /**
     * Flag indicating whether Firestore integration is enabled.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the service account credentials file.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier.
     */
    private String projectId;

    /**
     * Optional Firestore database id; the default database is used when empty.
     */
    private String databaseId;

    /**
     * Optional host:port of the Firestore emulator.
     */
    private String emulatorHost;

    /**
     * Firestore collection holding one analysis record per logical document.
     */
    private String analysisResultsCollection = "ai_analysis_results";

    /**
     * Firestore collection holding global billing settings as key/value documents.
     */
    private String settingsCollection = "app_settings";

    /**
     * Firestore collection holding certification reference data.
     */
    private String certificationTypesCollection = "certification_types";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getDatabaseId() {
        return databaseId;
    }

    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }

    public String getEmulatorHost() {
        return emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public String getAnalysisResultsCollection() {
        return analysisResultsCollection;
    }

    public void setAnalysisResultsCollection(String analysisResultsCollection) {
        this.analysisResultsCollection = analysisResultsCollection;
    }

    public String getSettingsCollection() {
        return settingsCollection;
    }

    public void setSettingsCollection(String settingsCollection) {
        this.settingsCollection = settingsCollection;
    }

    public String getCertificationTypesCollection() {
        return certificationTypesCollection;
    }

    public void setCertificationTypesCollection(String certificationTypesCollection) {
        this.certificationTypesCollection = certificationTypesCollection;
    }
}
