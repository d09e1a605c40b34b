package com.civic.anomaly.dataset;

import java.util.List;

/**
 * Entities sharing one attribute value, with the number of distinct contact values among them.
 */
public record AttributeGroup(String attribute,
                             String value,
                             List<String> memberIds,
                             long distinctContacts) {

    public int memberCount() {
        return memberIds.size();
    }
}
