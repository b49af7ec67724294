package com.example.hydrant.service;

import com.example.hydrant.model.Bundle;
import com.example.hydrant.model.EntityRecord;
import com.example.hydrant.model.ExtractionResult;
import com.example.hydrant.model.Job;
import com.example.hydrant.model.Resource;
import com.example.hydrant.model.ResourceSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one classified job end-to-end: extract, map, reconcile, validate, bundle.
 * Each stage finishes before the next starts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentPipeline {

    private final ExtractionDecider extractionDecider;
    private final EntityMapper entityMapper;
    private final ResourceReconciler reconciler;
    private final ValidationEnricher validationEnricher;
    private final BundleAssembler bundleAssembler;

    @Value("${hydrant.extraction.output-dir:${java.io.tmpdir}/hydrant/out}")
    private Path outputDir;

    @Value("${hydrant.bundle.type:collection}")
    private String bundleType;

    /**
     * @throws ExtractionException    when text could not be extracted
     * @throws EntityMappingException when the mapper failed
     */
    public PipelineResult process(Job job) {
        if (job.hasClassificationErrors()) {
            log.warn("Transaction {} continues with classification errors: {}",
                    job.transactionId(), job.classificationErrors());
        }

        ExtractionResult extraction = extractionDecider.extract(job, outputDir.resolve(job.transactionId()));
        log.info("Transaction {} extracted via {} ({} chars)",
                job.transactionId(), extraction.sourceKind(), extraction.payload().length());

        List<EntityRecord> entities = entityMapper.map(extraction);
        List<Resource> resources = new ArrayList<>(entities.size());
        for (EntityRecord entity : entities) {
            resources.add(entity.toResource());
        }

        ResourceSet reconciled = reconciler.reconcile(resources);
        List<Resource> validated = validationEnricher.enrichAll(reconciled.toList());
        Bundle bundle = bundleAssembler.assemble(validated, bundleType);

        log.info("Transaction {} produced bundle {} with {} entr(ies) from {} mapped resource(s)",
                job.transactionId(), bundle.id(), bundle.entries().size(), resources.size());
        return new PipelineResult(job, extraction, resources.size(), List.copyOf(reconciled.keys()), bundle);
    }
}
