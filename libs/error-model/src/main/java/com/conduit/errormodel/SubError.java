package com.conduit.errormodel;

/**
 * A nested failure attached to one identifier of a larger request.
 *
 * @param identifier the identifier that failed
 * @param error      what went wrong for that identifier
 */
public record SubError(Identifier identifier, ErrorEnvelope error) {

    public SubError {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier must not be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
    }
}
