package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.DgEntry;
import org.safeshipper.engine.domain.model.DgItem;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.reference.HazardClassTable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Folds the line items of a shipment into a {@link DgProfile}.
 *
 * The fold is order independent: sums use exact decimal arithmetic, sets are sorted and the
 * highest-risk class is chosen by rank with ties going to the lowest class code.
 */
public final class DangerousGoodsAggregator {

    private static final Logger LOG = Logger.getLogger(DangerousGoodsAggregator.class.getName());

    private final HazardClassTable hazardClasses;

    public DangerousGoodsAggregator(HazardClassTable hazardClasses) {
        this.hazardClasses = Objects.requireNonNull(hazardClasses, "hazardClasses must not be null");
    }

    public DgProfile aggregate(List<DgItem> items) {
        Objects.requireNonNull(items, "items must not be null");

        DgProfile.Builder profile = DgProfile.builder();
        BigDecimal dgWeight = BigDecimal.ZERO;
        BigDecimal dgVolume = BigDecimal.ZERO;
        BigDecimal totalWeight = BigDecimal.ZERO;
        BigDecimal totalVolume = BigDecimal.ZERO;
        int dangerousItems = 0;
        int limitedQuantity = 0;
        int exceptedQuantity = 0;
        String highestRiskClass = null;
        int highestRiskRank = Integer.MIN_VALUE;

        for (DgItem item : items) {
            BigDecimal lineWeight = BigDecimal.valueOf(item.getLineWeightKg());
            BigDecimal lineVolume = BigDecimal.valueOf(item.getLineVolumeL());
            totalWeight = totalWeight.add(lineWeight);
            totalVolume = totalVolume.add(lineVolume);

            if (!item.isDangerousGood()) {
                continue;
            }
            dangerousItems++;
            dgWeight = dgWeight.add(lineWeight);
            dgVolume = dgVolume.add(lineVolume);
            if (item.isLimitedQuantity()) {
                limitedQuantity++;
            }
            if (item.isExceptedQuantity()) {
                exceptedQuantity++;
            }

            if (!item.hasUnNumber()) {
                profile.addIntegrityIssue("Item " + item.getItemId()
                        + " is flagged as dangerous goods but has no UN number");
            } else {
                profile.addUnNumber(item.getUnNumber().trim());
            }
            if (!item.hasHazardClass()) {
                profile.addIntegrityIssue("Item " + item.getItemId()
                        + " is flagged as dangerous goods but has no hazard class");
                continue;
            }
            if (item.getPackingGroup() != null && !item.getPackingGroup().trim().isEmpty()) {
                profile.addPackingGroup(item.getPackingGroup().trim());
            }

            String hazardClass = HazardClassTable.normalize(item.getHazardClass());
            profile.addHazardClass(hazardClass);
            addAdrClass(profile, hazardClass);

            List<String> subsidiaries = new ArrayList<>();
            for (String subsidiary : item.getSubsidiaryHazardClasses()) {
                String code = HazardClassTable.normalize(subsidiary);
                if (code != null && !code.isEmpty()) {
                    subsidiaries.add(code);
                    addAdrClass(profile, code);
                }
            }
            if (item.hasUnNumber()) {
                profile.addEntry(new DgEntry(item.getUnNumber().trim(), hazardClass, subsidiaries));
            }

            int rank = hazardClasses.riskRankOf(hazardClass);
            if (rank > highestRiskRank || (rank == highestRiskRank && hazardClass.compareTo(highestRiskClass) < 0)) {
                highestRiskRank = rank;
                highestRiskClass = hazardClass;
            }
        }

        DgProfile result = profile
                .dangerousGoodsWeightKg(dgWeight.doubleValue())
                .dangerousGoodsVolumeL(dgVolume.doubleValue())
                .totalWeightKg(totalWeight.doubleValue())
                .totalVolumeL(totalVolume.doubleValue())
                .highestRiskClass(highestRiskClass)
                .dangerousItemCount(dangerousItems)
                .limitedQuantityCount(limitedQuantity)
                .exceptedQuantityCount(exceptedQuantity)
                .build();

        LOG.fine(() -> String.format("Aggregated %d items: classes=%s, dgWeight=%.2fkg, highestRisk=%s",
                items.size(), result.getHazardClasses(), result.getDangerousGoodsWeightKg(), result.getHighestRiskClass()));
        return result;
    }

    private void addAdrClass(DgProfile.Builder profile, String hazardClass) {
        if (hazardClasses.adrClassFor(hazardClass).isPresent()) {
            profile.addAdrClass(hazardClasses.adrClassFor(hazardClass).get());
            return;
        }
        profile.addAdrClass(HazardClassTable.ALL_CLASSES);
        profile.addReferenceGap("Hazard class " + hazardClass
                + " has no ADR class mapping; manual review required");
        LOG.warning(() -> "No ADR class mapping for hazard class " + hazardClass);
    }
}
