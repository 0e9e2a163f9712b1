package dk.trustworks.attribution.persistence.repository;

import dk.trustworks.attribution.dataset.AttributionDataSource;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import dk.trustworks.attribution.persistence.model.CampaignEntity;
import dk.trustworks.attribution.persistence.model.CampaignTouchEntity;
import dk.trustworks.attribution.persistence.model.OpportunityEntity;
import dk.trustworks.attribution.persistence.model.OpportunitySnapshotEntity;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Production data source reading the upload tables through Panache. Rows are turned into
 * immutable records here and nowhere else.
 */
@JBossLog
@ApplicationScoped
public class JpaAttributionDataSource implements AttributionDataSource {

    @Override
    public List<Campaign> getCampaigns(String type) {
        List<CampaignEntity> entities;
        if (type == null) {
            entities = CampaignEntity.listAll(Sort.by("startDate").and("id"));
        } else {
            entities = CampaignEntity.list("type", Sort.by("startDate").and("id"), type);
        }
        return entities.stream().map(CampaignEntity::toRecord).toList();
    }

    @Override
    public List<CampaignTouch> getTouches(Set<Long> campaignIds) {
        List<CampaignTouchEntity> entities;
        if (campaignIds == null) {
            entities = CampaignTouchEntity.listAll(Sort.by("id"));
        } else {
            entities = CampaignTouchEntity.list("campaignId in :ids", Sort.by("id"), Parameters.with("ids", campaignIds));
        }
        return entities.stream().map(CampaignTouchEntity::toRecord).toList();
    }

    /**
     * The target-account flag is recorded on the snapshots; an opportunity takes the flag of
     * its latest snapshot that has one.
     */
    @Override
    public List<Opportunity> getOpportunities() {
        Map<Long, Boolean> targetFlags = new HashMap<>();
        List<OpportunitySnapshotEntity> flagged =
                OpportunitySnapshotEntity.list("targetAccount is not null order by snapshotDate, id");
        flagged.forEach(s -> targetFlags.put(s.getOpportunityId(), s.getTargetAccount() == 1));

        List<OpportunityEntity> entities = OpportunityEntity.listAll(Sort.by("id"));
        log.debugf("Read %d opportunities, %d with target-account flag", entities.size(), targetFlags.size());
        return entities.stream()
                .map(o -> o.toRecord(targetFlags.get(o.getId())))
                .toList();
    }

    @Override
    public Optional<OpportunitySnapshot> getLatestSnapshot(Long opportunityId, LocalDate asOf) {
        Optional<OpportunitySnapshotEntity> entity;
        if (asOf == null) {
            entity = OpportunitySnapshotEntity
                    .find("opportunityId = ?1 order by snapshotDate desc, id desc", opportunityId)
                    .firstResultOptional();
        } else {
            entity = OpportunitySnapshotEntity
                    .find("opportunityId = ?1 and snapshotDate <= ?2 order by snapshotDate desc, id desc", opportunityId, asOf)
                    .firstResultOptional();
        }
        return entity.map(OpportunitySnapshotEntity::toRecord);
    }

    @Override
    public List<OpportunitySnapshot> getSnapshotHistory(Long opportunityId) {
        List<OpportunitySnapshotEntity> entities =
                OpportunitySnapshotEntity.list("opportunityId = ?1 order by snapshotDate, id", opportunityId);
        return entities.stream().map(OpportunitySnapshotEntity::toRecord).toList();
    }

    @Override
    public List<OpportunitySnapshot> getAllSnapshots() {
        List<OpportunitySnapshotEntity> entities = OpportunitySnapshotEntity.listAll(Sort.by("snapshotDate").and("id"));
        return entities.stream().map(OpportunitySnapshotEntity::toRecord).toList();
    }
}
