package com.integration.migrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MessageDeclaration {
    String name;
    String type;
    String direction;
}
