package io.computehub.license;

/**
 * License server answer to an unbind request.
 */
public enum UnbindOutcome {

    /**
     * The binding to the requesting installation was released.
     */
    OK,

    /**
     * The key was not bound to the requesting installation.
     */
    NOT_BOUND
}
