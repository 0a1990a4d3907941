package com.integration.migrator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

/**
 * Parsed orchestration: declarations plus the root nodes of the process-flow tree.
 * Read-only once built, apart from lazy unique-id assignment.
 */
@Getter
@Builder
public final class FlowSummary {

    @NonNull
    private final String name;
    private final String namespace;
    @Singular
    private final List<MessageDeclaration> messages;
    @Singular
    private final List<PortTypeDeclaration> portTypes;
    @Singular
    private final List<PortDeclaration> ports;
    @Singular
    private final List<ProcessNode> roots;
    /** Correlation sets declared at service level, outside the body tree. */
    @Singular
    private final List<CorrelationDeclarationNode> correlationDeclarations;
    @Builder.Default
    private final UniqueIdGenerator uniqueIds = new UniqueIdGenerator();

    public String getQualifiedName() {
        return namespace == null || namespace.isBlank() ? name : namespace + "." + name;
    }

    public Optional<PortDeclaration> findPort(String portName) {
        if (portName == null) {
            return Optional.empty();
        }
        return ports.stream().filter(p -> portName.equalsIgnoreCase(p.getName())).findFirst();
    }

    public Optional<MessageDeclaration> findMessage(String messageName) {
        if (messageName == null) {
            return Optional.empty();
        }
        return messages.stream().filter(m -> messageName.equalsIgnoreCase(m.getName())).findFirst();
    }

    public List<ProcessNode> allNodes() {
        return NodeTraversal.preorder(roots);
    }
}
