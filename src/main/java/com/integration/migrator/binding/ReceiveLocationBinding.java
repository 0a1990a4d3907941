package com.integration.migrator.binding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReceiveLocationBinding {
    String name;
    String receivePortName;
    String transportType;
    String address;
    boolean enabled;
    String receivePipelineName;
    String folderPath;
    String fileMask;
    Integer pollingIntervalSeconds;
    String userName;
    String connectionString;
    /** Cics, Ims, Vsam or HostFile for host-integration adapters. */
    String hostAppsSubtype;
}
