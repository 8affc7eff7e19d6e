package com.flagship.fundraising_ledger.hierarchy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ClubRepository extends JpaRepository<ClubEntity, UUID> {

    long countBySummaryStatus(SummaryStatus summaryStatus);
}
