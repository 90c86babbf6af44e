package com.my.bridge.domain.model;

import java.util.List;

public record ConnectionPage(List<Connection> items, int page, int totalPages, int totalItems) {

    public ConnectionPage {
        items = List.copyOf(items);
    }
}
