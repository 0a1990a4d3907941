package com.integration.migrator.workflow;

/**
 * Target-platform connector families a transport maps onto.
 */
public enum ConnectorKind {
    HTTP,
    FILE_SYSTEM,
    SFTP,
    FTP,
    SQL,
    AS2,
    X12,
    EDIFACT,
    MLLP,
    SERVICE_BUS,
    EVENT_HUBS,
    IBM_MQ,
    DB2,
    CICS,
    IMS,
    VSAM,
    HOST_FILE,
    INFORMIX,
    SAP,
    SMTP
}
