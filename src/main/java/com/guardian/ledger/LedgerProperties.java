package com.guardian.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "guardian.ledger")
public class LedgerProperties {

    /** Evidence directory holding one file per ledger record. */
    private String directory = "evidence/ledger";

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
