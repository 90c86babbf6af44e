package com.my.bridge.domain.model;

import java.util.Objects;

public record InboundAttachment(String url, long size, String filename) {

    public InboundAttachment {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(filename, "filename");
    }
}
