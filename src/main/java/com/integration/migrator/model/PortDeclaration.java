package com.integration.migrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortDeclaration {
    String name;
    String portTypeRef;
    @Builder.Default
    PortDirection direction = PortDirection.NONE;
    @Builder.Default
    BindingKind bindingKind = BindingKind.UNKNOWN;
    String transportType;
    String address;
    String folderPath;
    String fileMask;
}
