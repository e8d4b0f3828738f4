package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * Heading levels inferred for every block of a document.
 *
 * @param levels one level per block, in block order; smaller is more important
 * @param pivotLevel levels at or above this value open a new section
 */
public record HeadingLevels(List<Integer> levels, int pivotLevel) {}
