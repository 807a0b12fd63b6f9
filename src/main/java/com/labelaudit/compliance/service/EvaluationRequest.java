package com.labelaudit.compliance.service;

import com.labelaudit.compliance.model.CandidateField;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Input of one evaluation: the candidates collected for a product, plus what the
 * caller knows about it.
 */
public class EvaluationRequest {
    /** URL or upload id; required */
    private String productIdentifier;
    private List<CandidateField> candidates = new ArrayList<>();
    /** Overrides the manufacturer read from the label when set */
    private String manufacturerName;
    /** Listing title, used to categorize the product */
    private String productTitle;
    /** Evaluation time; the service clock when null */
    private Instant timestamp;

    public EvaluationRequest() {}

    public EvaluationRequest(String productIdentifier, List<CandidateField> candidates) {
        this.productIdentifier = productIdentifier;
        this.candidates = candidates;
    }

    public String getProductIdentifier() { return productIdentifier; }
    public void setProductIdentifier(String productIdentifier) { this.productIdentifier = productIdentifier; }
    public List<CandidateField> getCandidates() { return candidates; }
    public void setCandidates(List<CandidateField> candidates) { this.candidates = candidates; }
    public String getManufacturerName() { return manufacturerName; }
    public void setManufacturerName(String manufacturerName) { this.manufacturerName = manufacturerName; }
    public String getProductTitle() { return productTitle; }
    public void setProductTitle(String productTitle) { this.productTitle = productTitle; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public EvaluationRequest manufacturer(String manufacturerName) {
        this.manufacturerName = manufacturerName;
        return this;
    }

    public EvaluationRequest title(String productTitle) {
        this.productTitle = productTitle;
        return this;
    }

    public EvaluationRequest at(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }
}
