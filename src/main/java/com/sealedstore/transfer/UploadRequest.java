package com.sealedstore.transfer;

public record UploadRequest(String filename, String mimeType, byte[] bytes) {
}
