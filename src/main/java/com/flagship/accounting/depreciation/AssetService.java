package com.flagship.accounting.depreciation;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.AccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Asset register: categories, assets and their depreciation schedule.
 * Book values only change through {@link DepreciationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetService {

    private final AssetCategoryRepository categoryRepository;
    private final FixedAssetRepository assetRepository;
    private final DepreciationEntryRepository entryRepository;
    private final AccountService accountService;

    @Transactional
    public AssetCategory createCategory(String code, String name, DepreciationMethod method, BigDecimal rate,
                                        Integer usefulLifeYears, UUID assetAccountId,
                                        UUID accumulatedDepreciationAccountId, UUID depreciationExpenseAccountId) {
        if (code == null || code.isBlank() || name == null || name.isBlank() || method == null || rate == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD,
                "Category code, name, depreciation method and rate are required");
        }
        if (rate.signum() < 0 || rate.compareTo(new BigDecimal("100")) > 0) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                "Depreciation rate must be between 0 and 100: " + rate);
        }
        if (categoryRepository.existsByCode(code)) {
            throw new ValidationFailureException(FailureKind.DUPLICATE_CODE, "Asset category code already exists: " + code);
        }
        List<UUID> mapped = Stream.of(assetAccountId, accumulatedDepreciationAccountId, depreciationExpenseAccountId)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
        accountService.requirePostable(mapped);

        AssetCategory category = AssetCategory.create(code, name, method, rate, usefulLifeYears,
            assetAccountId, accumulatedDepreciationAccountId, depreciationExpenseAccountId);
        categoryRepository.save(AssetCategoryEntity.fromDomain(category));
        log.info("Created asset category {} ({} {}%)", code, method, rate);
        return category;
    }

    @Transactional(readOnly = true)
    public List<AssetCategory> listCategories() {
        return categoryRepository.findAllByOrderByCodeAsc().stream()
            .map(AssetCategoryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public AssetCategory findCategory(UUID categoryId) {
        return categoryRepository.findById(categoryId)
            .map(AssetCategoryEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.CATEGORY_NOT_FOUND, "Asset category", categoryId));
    }

    /**
     * Registers an ACTIVE asset whose book value starts at its capitalized value.
     */
    @Transactional
    public FixedAsset registerAsset(String assetCode, String name, UUID categoryId, LocalDate acquisitionDate,
                                    BigDecimal capitalizedValue, DepreciationMethod methodOverride,
                                    BigDecimal rateOverride, BigDecimal salvageValue) {
        if (assetCode == null || assetCode.isBlank() || name == null || name.isBlank()
                || categoryId == null || acquisitionDate == null || capitalizedValue == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD,
                "Asset code, name, category, acquisition date and capitalized value are required");
        }
        if (assetRepository.existsByAssetCode(assetCode)) {
            throw new ValidationFailureException(FailureKind.DUPLICATE_CODE, "Asset code already exists: " + assetCode);
        }
        AssetCategory category = findCategory(categoryId);
        if (!category.isActive()) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE, "Asset category " + category.getCode() + " is inactive");
        }
        if (rateOverride != null && rateOverride.signum() < 0) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE, "Depreciation rate cannot be negative");
        }

        FixedAsset asset;
        try {
            asset = FixedAsset.register(assetCode, name, categoryId, acquisitionDate, capitalizedValue,
                methodOverride, rateOverride, salvageValue);
        } catch (IllegalArgumentException e) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE, e.getMessage());
        }
        assetRepository.save(FixedAssetEntity.fromDomain(asset));
        log.info("Registered asset {} {} at {}", assetCode, name, capitalizedValue);
        return asset;
    }

    @Transactional
    public FixedAsset changeStatus(UUID assetId, AssetStatus status) {
        if (status == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Asset status is required");
        }
        FixedAssetEntity entity = assetRepository.findByIdForUpdate(assetId)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.ASSET_NOT_FOUND, "Asset", assetId));
        FixedAsset current = entity.toDomain();
        if (!current.getStatus().canTransitionTo(status)) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Asset %s is %s and cannot move to %s", current.getAssetCode(), current.getStatus(), status));
        }
        FixedAsset updated = current.withStatus(status);
        entity.updateFromDomain(updated);
        assetRepository.save(entity);
        log.info("Asset {} moved {} -> {}", updated.getAssetCode(), current.getStatus(), status);
        return updated;
    }

    @Transactional(readOnly = true)
    public FixedAsset findById(UUID assetId) {
        return assetRepository.findById(assetId)
            .map(FixedAssetEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.ASSET_NOT_FOUND, "Asset", assetId));
    }

    @Transactional(readOnly = true)
    public List<FixedAsset> listAssets(AssetStatus status, UUID categoryId) {
        return assetRepository.search(status, categoryId).stream()
            .map(FixedAssetEntity::toDomain)
            .toList();
    }

    /**
     * Every depreciation entry of the asset, oldest first.
     */
    @Transactional(readOnly = true)
    public List<DepreciationEntry> schedule(UUID assetId) {
        findById(assetId);
        return entryRepository.findByAssetIdOrderByPeriodDateAsc(assetId).stream()
            .map(DepreciationEntryEntity::toDomain)
            .toList();
    }
}
