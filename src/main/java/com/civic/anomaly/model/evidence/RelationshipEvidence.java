package com.civic.anomaly.model.evidence;

public record RelationshipEvidence(String relationship,
                                   String actorType,
                                   String actorId,
                                   String targetType,
                                   String targetId,
                                   long eventCount,
                                   double totalValue,
                                   double threshold) implements FindingEvidence {

    public static final String SELF_DEALING = "self_dealing";
    public static final String BILATERAL_VOLUME = "bilateral_volume";
}
