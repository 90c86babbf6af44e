package com.my.bridge.domain.model;

import java.util.Objects;

public record OutgoingFile(String filename, byte[] data) {

    public OutgoingFile {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(data, "data");
    }
}
