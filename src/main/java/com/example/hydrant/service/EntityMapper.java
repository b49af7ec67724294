package com.example.hydrant.service;

import com.example.hydrant.model.EntityRecord;
import com.example.hydrant.model.ExtractionResult;

import java.util.List;

/**
 * Boundary to the external service turning extracted text or markup into entity records.
 */
public interface EntityMapper {

    /**
     * @throws EntityMappingException when the mapper fails or returns records that do not
     *                                satisfy the {@link EntityRecord} contract
     */
    List<EntityRecord> map(ExtractionResult extraction);
}
