package com.integration.migrator.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class PortTypeDeclaration {
    String name;
    @Singular
    List<OperationDeclaration> operations;
}
