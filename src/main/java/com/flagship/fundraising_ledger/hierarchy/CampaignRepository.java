package com.flagship.fundraising_ledger.hierarchy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CampaignRepository extends JpaRepository<CampaignEntity, UUID> {

    List<CampaignEntity> findByClubIdOrderByCreatedAtAscIdAsc(UUID clubId);

    long countBySummaryStatus(SummaryStatus summaryStatus);
}
