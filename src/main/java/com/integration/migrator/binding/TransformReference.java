package com.integration.migrator.binding;

import lombok.Value;

/**
 * Outbound map applied by a send port before transmission.
 */
@Value
public class TransformReference {
    String fullName;
    String shortName;

    public static TransformReference of(String fullName) {
        int dot = fullName.lastIndexOf('.');
        return new TransformReference(fullName, dot >= 0 ? fullName.substring(dot + 1) : fullName);
    }
}
