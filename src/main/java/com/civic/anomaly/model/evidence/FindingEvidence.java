package com.civic.anomaly.model.evidence;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Method-specific explanation attached to a finding. Serialized with a {@code kind}
 * discriminator so stored anomalies can be read back into the right variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OutlierEvidence.class, name = "outlier"),
        @JsonSubTypes.Type(value = BehavioralEvidence.class, name = "behavioral"),
        @JsonSubTypes.Type(value = HourlyDeviationEvidence.class, name = "hourly_deviation"),
        @JsonSubTypes.Type(value = RapidSequenceEvidence.class, name = "rapid_sequence"),
        @JsonSubTypes.Type(value = ClusterEvidence.class, name = "cluster"),
        @JsonSubTypes.Type(value = RelationshipEvidence.class, name = "relationship")
})
public interface FindingEvidence {
}
