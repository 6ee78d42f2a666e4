package com.flamingo.ai.gedcom.service.genealogy;

/**
 * Counts over a loaded tree.
 *
 * @param recordCount all records below the root
 * @param individualCount top-level {@code INDI} records
 * @param familyCount top-level {@code FAM} records
 */
public record TreeStatistics(int recordCount, int individualCount, int familyCount) {}
