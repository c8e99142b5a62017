package com.specmend.oracle;

/**
 * Failure of the external generative service.
 *
 * Opaque by contract: callers propagate it verbatim and never inspect the
 * message to make decisions.
 */
public class OracleException extends Exception {

    public OracleException(String message)                  { super(message); }
    public OracleException(String message, Throwable cause) { super(message, cause); }
}
