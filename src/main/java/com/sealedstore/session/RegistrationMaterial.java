package com.sealedstore.session;

/**
 * What the client sends at sign-up: the new user's salt (Base64) and the login digest.
 * The Master Key derived alongside it stays on the client.
 */
public record RegistrationMaterial(String saltBase64, String authDigest) {
}
