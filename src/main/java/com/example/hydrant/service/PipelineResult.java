package com.example.hydrant.service;

import com.example.hydrant.model.Bundle;
import com.example.hydrant.model.ExtractionResult;
import com.example.hydrant.model.IdentityKey;
import com.example.hydrant.model.Job;

import java.util.List;

public record PipelineResult(
        Job job,
        ExtractionResult extraction,
        int mappedCount,
        List<IdentityKey> canonicalKeys,
        Bundle bundle) {
}
