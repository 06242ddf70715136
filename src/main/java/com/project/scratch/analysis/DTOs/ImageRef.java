package com.project.scratch.analysis.DTOs;

import java.util.UUID;

public record ImageRef(UUID id, UUID experimentId, int passes) {

    public boolean isReference() {
        return passes == 0;
    }
}
