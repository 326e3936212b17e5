package com.bankjob;

public final class Version {
    /** OFX specification version written into every document header. */
    public static final String OFX_VERSION = "200";

    private Version() {}
}
