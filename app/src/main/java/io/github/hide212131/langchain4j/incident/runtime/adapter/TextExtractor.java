package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.ExtractionResult;

/**
 * Recovers structured incident fields from operator text.
 */
@FunctionalInterface
public interface TextExtractor {

    ExtractionResult extract(String text) throws AdapterException;
}
