package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * A scalar array recorded for a junction table, replayed when the table is written.
 *
 * @param ownerRowId row id of the object that holds the array, or null for a top-level array
 * @param values the array itself
 * @param jsonPath where the array was found
 */
public record ScalarArraySource(Long ownerRowId, ArrayNode values, String jsonPath) {
}
