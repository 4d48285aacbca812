package net.belfry.api;

/**
 * Transport-level admission check.
 * Evaluated before a connection is opened; connections that are refused
 * here never reach the relay core.
 */
public interface AdmissionPolicy {

    /** A policy accepting everything. */
    AdmissionPolicy ALLOW_ALL = new AdmissionPolicy() {
        public boolean admit(String origin) {
            return true;
        }
    };

    /**
     * Decide whether a connection request may proceed.
     * origin is the value of the request's Origin header, or null if
     * there is none.
     */
    boolean admit(String origin);

}
