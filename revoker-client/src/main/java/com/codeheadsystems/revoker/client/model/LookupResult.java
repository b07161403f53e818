package com.codeheadsystems.revoker.client.model;

import com.codeheadsystems.revoker.model.salesforce.QueryRecord;
import com.codeheadsystems.revoker.model.salesforce.QueryResponse;
import java.util.Optional;

/**
 * Outcome of a SOQL lookup: the first matching id (in the order Salesforce returned them) and
 * how many records matched.  Zero matches is a normal result, not an error.
 *
 * @param id    the id of the first matching record, null only when nothing matched
 * @param count number of records in the response
 */
public record LookupResult(String id, int count) {

  /**
   * A non-empty result always carries an id.
   */
  public LookupResult {
    if (count > 0 && (id == null || id.isBlank())) {
      throw new IllegalArgumentException("count=" + count + " without a first id");
    }
  }

  /**
   * From query response lookup result.
   *
   * @param response the response
   * @return the lookup result
   */
  public static LookupResult from(final QueryResponse response) {
    return new LookupResult(response.firstRecord().map(QueryRecord::id).orElse(null),
        response.records().size());
  }

  /**
   * The first matching id.
   *
   * @return the id, empty when nothing matched
   */
  public Optional<String> firstId() {
    return Optional.ofNullable(id);
  }

  /**
   * Whether nothing matched.
   *
   * @return true when there were no records
   */
  public boolean isEmpty() {
    return count == 0;
  }
}
