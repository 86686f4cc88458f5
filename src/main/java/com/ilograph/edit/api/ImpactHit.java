package com.ilograph.edit.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A place in the document that defines or mentions an identifier.
 *
 * @param perspective owning perspective identifier, null outside perspectives
 * @param section     logical section, e.g. {@code relations} or {@code contexts:Default}
 * @param path        document path of the container
 * @param field       key holding the value
 * @param value       current string value
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ImpactHit(String perspective, String section, String path, String field, String value) {
}
