package com.conduit.security;

import java.nio.file.Path;

/**
 * A local identity: a PEM certificate chain and its PKCS#8 private key.
 *
 * @param certChainFile PEM file, leaf certificate first
 * @param keyFile       PEM PKCS#8 private key matching the leaf
 */
public record KeyMaterial(Path certChainFile, Path keyFile) {

    public KeyMaterial {
        if (certChainFile == null) {
            throw new IllegalArgumentException("certChainFile must not be null");
        }
        if (keyFile == null) {
            throw new IllegalArgumentException("keyFile must not be null");
        }
    }
}
