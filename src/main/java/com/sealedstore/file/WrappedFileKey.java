package com.sealedstore.file;

/**
 * A File Key encrypted under a Master Key, with the nonce used for that wrap.
 */
public record WrappedFileKey(byte[] wrappedKey, byte[] keyWrapNonce) {}
