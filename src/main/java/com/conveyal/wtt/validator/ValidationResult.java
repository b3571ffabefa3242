package com.conveyal.wtt.validator;

import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.model.LinkConflict;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An instance of this class is produced at the end of a reconciliation run.
 * It groups together summary information about what was extracted and what did not reconcile. The individual errors
 * are kept in the run's error storage; this class only carries counts and the conflicts to report.
 *
 * Ignore unknown properties on deserialization to avoid conflicts with past versions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationResult implements Serializable {

    private static final long serialVersionUID = 1L;
    public String fatalException = null;

    public int errorCount;
    public Map<NewWTTErrorType, Integer> errorCountsByType = new EnumMap<>(NewWTTErrorType.class);

    public int serviceCount;
    public int upServiceCount;
    public int downServiceCount;
    public int sequencedServiceCount;
    /** Chains of services linked by reversals, whether or not a declared link uses them. */
    public int chainCount;

    public int linkCount;
    public int validLinkCount;
    public int invalidLinkCount;
    public int conflictingLinkCount;
    public double totalValidLinkLengthKm;

    /** calculated in {@link EventTimesValidator#complete} */
    public int servicesWithDecreasingTimes;

    public List<LinkConflict> conflicts = new ArrayList<>();
    /** Link name to the identifiers it declares that the grid does not have. */
    public Map<String, List<String>> undefinedIds = new LinkedHashMap<>();

    public long validationTime;

}
