package com.dealsync.integration.pipedrive;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Paced access to deals in the record store. Implementations never throw for transport or API
 * failures; they log and report them as empty results or {@code false}.
 */
public interface PipedriveDealClient {
  Optional<PipedriveDeal> getDeal(PipedriveCredentials credentials, long dealId);

  boolean updateDealTitle(PipedriveCredentials credentials, long dealId, String title);

  Optional<PipedriveDeal> updateDeal(
      PipedriveCredentials credentials, long dealId, Map<String, Object> fields);

  Map<Long, Boolean> batchUpdateDeals(PipedriveCredentials credentials, List<DealUpdate> updates);
}
