package com.civic.anomaly.model.evidence;

import java.util.List;

/**
 * Shared by every member of a flagged group.
 */
public record ClusterEvidence(String attribute,
                              String value,
                              int memberCount,
                              long distinctContacts,
                              boolean sharedContact,
                              List<String> memberIds) implements FindingEvidence {
}
