package com.codeheadsystems.revoker.model.salesforce;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single SObject row from a SOQL query that selected {@code Id}.
 *
 * @param id the 15 or 18 character Salesforce record id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRecord(@JsonProperty("Id") String id) {
}
