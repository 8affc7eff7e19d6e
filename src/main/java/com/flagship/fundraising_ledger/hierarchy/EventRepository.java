package com.flagship.fundraising_ledger.hierarchy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EventRepository extends JpaRepository<EventEntity, UUID> {

    List<EventEntity> findByClubIdOrderByEventDateDescIdAsc(UUID clubId);

    List<EventEntity> findByCampaignIdOrderByEventDateDescIdAsc(UUID campaignId);

    long countBySummaryStatus(SummaryStatus summaryStatus);
}
