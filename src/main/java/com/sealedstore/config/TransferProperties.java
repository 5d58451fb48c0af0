package com.sealedstore.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Upload validation limits, bound from {@code sealedstore.transfer.*}.
 * An empty {@code allowedMimeTypes} list accepts every type.
 */
@ConfigurationProperties(prefix = "sealedstore.transfer")
public record TransferProperties(
        @DefaultValue("50MB") DataSize maxFileSize,
        @DefaultValue List<String> allowedMimeTypes
) {

    public static final DataSize DEFAULT_MAX_FILE_SIZE = DataSize.ofMegabytes(50);

    public TransferProperties {
        maxFileSize = maxFileSize == null ? DEFAULT_MAX_FILE_SIZE : maxFileSize;
        allowedMimeTypes = allowedMimeTypes == null ? List.of() : List.copyOf(allowedMimeTypes);
    }

    public boolean isAllowed(String mimeType) {
        return allowedMimeTypes.isEmpty() || allowedMimeTypes.contains(mimeType);
    }
}
